package com.example.leadintake.service;

import com.example.leadintake.model.DispatchOutcome;
import com.example.leadintake.model.LeadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one structured line per lead outcome.
 */
@Component
public class LoggingOutcomeRecorder implements OutcomeRecorder {

    private static final Logger logger = LoggerFactory.getLogger("lead.outcome");

    @Override
    public void record(LeadResult result) {
        try {
            DispatchOutcome outcome = result.getOutcome();
            String line = "index={} shape={} outcome={} stage={} attempts={} latencyMs={} fallbacks={} remoteId={} cause={}";
            Object[] args = {result.getIndex(), result.getShape(), outcome.getKind(), outcome.getStage(),
                    outcome.getAttempts(), outcome.getLatency().toMillis(), result.getAppliedFallbacks(),
                    outcome.getRemoteId(), outcome.getCause()};
            if (outcome.isCreated()) {
                logger.info(line, args);
            } else if (outcome.getKind() == DispatchOutcome.Kind.FATAL_FAILURE) {
                logger.error(line, args);
            } else {
                logger.warn(line, args);
            }
        } catch (RuntimeException e) {
            LoggerFactory.getLogger(LoggingOutcomeRecorder.class).warn("Failed to record lead outcome", e);
        }
    }
}
