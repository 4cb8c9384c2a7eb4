package com.example.leadintake.service;

import com.example.leadintake.model.DispatchOutcome;
import com.example.leadintake.model.FallbackPolicy;
import com.example.leadintake.model.IntakeResult;
import com.example.leadintake.model.LeadResult;
import com.example.leadintake.model.MappedLead;
import com.example.leadintake.model.PayloadShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point per inbound request: decode, classify, map, dispatch. Always
 * returns one {@link LeadResult} per logical lead, never an exception for bad input.
 */
public class LeadIntakePipeline {

    private static final Logger logger = LoggerFactory.getLogger(LeadIntakePipeline.class);

    private final EnvelopeDecoder decoder;
    private final PayloadClassifier classifier;
    private final LeadFieldMapper mapper;
    private final DispatchClient dispatchClient;
    private final FallbackPolicy fallbackPolicy;
    private final OutcomeRecorder recorder;

    public LeadIntakePipeline(EnvelopeDecoder decoder, PayloadClassifier classifier, LeadFieldMapper mapper,
                              DispatchClient dispatchClient, FallbackPolicy fallbackPolicy, OutcomeRecorder recorder) {
        this.decoder = decoder;
        this.classifier = classifier;
        this.mapper = mapper;
        this.dispatchClient = dispatchClient;
        this.fallbackPolicy = fallbackPolicy;
        this.recorder = recorder;
    }

    public IntakeResult handle(String rawBody) {
        Map<String, Object> payload;
        try {
            payload = decoder.decode(rawBody);
        } catch (DecodeException e) {
            return decodeFailure(e);
        }
        return process(payload, true);
    }

    public IntakeResult handle(Map<String, Object> body) {
        Map<String, Object> payload;
        try {
            payload = decoder.decode(body);
        } catch (DecodeException e) {
            return decodeFailure(e);
        }
        return process(payload, true);
    }

    /**
     * For a payload the caller already ran through {@link EnvelopeDecoder}; it is not unwrapped again.
     */
    public IntakeResult handleDecoded(Map<String, Object> payload) {
        return process(payload, true);
    }

    /**
     * Decode, classify and map without dispatching anything.
     */
    public IntakeResult preview(Map<String, Object> body) {
        Map<String, Object> payload;
        try {
            payload = decoder.decode(body);
        } catch (DecodeException e) {
            return new IntakeResult(PayloadShape.UNKNOWN, List.of(decodeResult(e)));
        }
        return process(payload, false);
    }

    public IntakeResult previewDecoded(Map<String, Object> payload) {
        return process(payload, false);
    }

    private IntakeResult process(Map<String, Object> payload, boolean dispatch) {
        PayloadShape shape = classifier.classify(payload);
        logger.info("Received intake payload shape={} keys={}", shape, payload.keySet());

        List<LeadResult> results = new ArrayList<>();
        switch (shape) {
            case UNKNOWN:
                results.add(LeadResult.builder()
                        .index(0)
                        .shape(shape)
                        .outcome(DispatchOutcome.rejectedLocally(DispatchOutcome.Stage.CLASSIFY, "payload",
                                "Unrecognized payload format. Keys: " + payload.keySet()))
                        .build());
                break;
            case ENVELOPE_BATCH:
                List<Object> items = classifier.expand(payload);
                Map<String, Object> root = classifier.envelopeRoot(payload);
                for (int i = 0; i < items.size(); i++) {
                    results.add(processItem(i, items.get(i), root, dispatch));
                }
                if (items.isEmpty()) {
                    logger.warn("Batch envelope holds no leads");
                }
                break;
            default:
                results.add(processLead(0, shape, payload, dispatch));
                break;
        }

        if (dispatch) {
            results.forEach(recorder::record);
        }
        IntakeResult result = new IntakeResult(shape, results);
        logger.info("Intake finished shape={} total={} successful={} failed={}", shape,
                result.getTotal(), result.getSuccessful(), result.getFailed());
        return result;
    }

    @SuppressWarnings("unchecked")
    private LeadResult processItem(int index, Object item, Map<String, Object> root, boolean dispatch) {
        if (!(item instanceof Map)) {
            logger.warn("Batch item {} is not an object: {}", index, item);
            return LeadResult.builder()
                    .index(index)
                    .shape(PayloadShape.ENVELOPE_SINGLE)
                    .outcome(DispatchOutcome.rejectedLocally(DispatchOutcome.Stage.MAP, "inbox_leads[" + index + "]",
                            "Lead entry must be an object"))
                    .build();
        }
        Map<String, Object> lead = (Map<String, Object>) item;
        try {
            MappedLead mapped = mapper.mapBatchItem(lead, root, fallbackPolicy);
            return finish(index, PayloadShape.ENVELOPE_SINGLE, mapped, dispatch);
        } catch (LeadValidationException e) {
            return unsatisfied(index, PayloadShape.ENVELOPE_SINGLE, e);
        }
    }

    private LeadResult processLead(int index, PayloadShape shape, Map<String, Object> payload, boolean dispatch) {
        try {
            MappedLead mapped = mapper.map(shape, payload, fallbackPolicy);
            return finish(index, shape, mapped, dispatch);
        } catch (LeadValidationException e) {
            return unsatisfied(index, shape, e);
        }
    }

    private LeadResult finish(int index, PayloadShape shape, MappedLead mapped, boolean dispatch) {
        if (!mapped.getAppliedFallbacks().isEmpty()) {
            logger.info("Lead {} uses fallbacks for {}", index, mapped.getAppliedFallbacks());
        }
        // previewed leads carry no outcome
        DispatchOutcome outcome = dispatch ? dispatchClient.dispatch(mapped.getLead()) : null;
        return LeadResult.builder()
                .index(index)
                .shape(shape)
                .lead(mapped.getLead())
                .appliedFallbacks(mapped.getAppliedFallbacks())
                .outcome(outcome)
                .build();
    }

    private LeadResult unsatisfied(int index, PayloadShape shape, LeadValidationException e) {
        // only reachable with blank defaults in the fallback configuration
        logger.error("Fallback policy left {} empty for lead {}", e.getUnsatisfiedFields(), index);
        return LeadResult.builder()
                .index(index)
                .shape(shape)
                .outcome(DispatchOutcome.rejectedLocally(DispatchOutcome.Stage.MAP, "fields", e.getMessage()))
                .build();
    }

    /**
     * Result for a body the caller already failed to decode.
     */
    public IntakeResult rejectUndecodable(DecodeException e) {
        return decodeFailure(e);
    }

    private IntakeResult decodeFailure(DecodeException e) {
        LeadResult result = decodeResult(e);
        recorder.record(result);
        return new IntakeResult(PayloadShape.UNKNOWN, List.of(result));
    }

    private LeadResult decodeResult(DecodeException e) {
        logger.warn("Rejecting undecodable body: {} raw={}", e.getMessage(), abbreviate(e.getRaw()));
        return LeadResult.builder()
                .index(0)
                .shape(PayloadShape.UNKNOWN)
                .outcome(DispatchOutcome.rejectedLocally(DispatchOutcome.Stage.DECODE, "body", e.getMessage()))
                .build();
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.length() > 512 ? raw.substring(0, 512) + "..." : raw;
    }
}
