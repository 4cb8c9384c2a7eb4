package com.example.leadintake.config;

import com.example.leadintake.client.InboxTransport;
import com.example.leadintake.client.WebClientInboxTransport;
import com.example.leadintake.model.FallbackPolicy;
import com.example.leadintake.service.BackoffPolicy;
import com.example.leadintake.service.BulkSyncEngine;
import com.example.leadintake.service.DispatchClient;
import com.example.leadintake.service.EnvelopeDecoder;
import com.example.leadintake.service.ExponentialBackoffPolicy;
import com.example.leadintake.service.LeadFieldMapper;
import com.example.leadintake.service.LeadIntakePipeline;
import com.example.leadintake.service.OutcomeRecorder;
import com.example.leadintake.service.PayloadClassifier;
import com.example.leadintake.service.RateLimitWindow;
import com.example.leadintake.service.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeConfig {

    private static final Logger logger = LoggerFactory.getLogger(IntakeConfig.class);

    @Bean
    public Clock intakeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public FallbackPolicy fallbackPolicy(IntakeProperties properties) {
        FallbackPolicy policy = properties.getFallback().toPolicy();
        if (!policy.isComplete()) {
            logger.error("Fallback policy has no default for {}; leads missing these fields will be rejected",
                    policy.uncoveredFields());
        }
        return policy;
    }

    @Bean
    public RateLimitWindow rateLimitWindow(IntakeProperties properties, Clock clock, Sleeper sleeper) {
        IntakeProperties.RateLimit rateLimit = properties.getRateLimit();
        return new RateLimitWindow(rateLimit.getMaxRequests(), rateLimit.getWindow(), clock, sleeper);
    }

    @Bean
    public BackoffPolicy backoffPolicy(IntakeProperties properties) {
        IntakeProperties.Retry retry = properties.getRetry();
        return new ExponentialBackoffPolicy(retry.getBaseDelay(), retry.getMaxDelay(), retry.isJitter());
    }

    @Bean
    public InboxTransport inboxTransport(WebClient.Builder webClientBuilder, IntakeProperties properties) {
        return new WebClientInboxTransport(webClientBuilder.build(), properties.getInbox().getRequestTimeout());
    }

    @Bean
    public DispatchClient dispatchClient(InboxTransport inboxTransport, RateLimitWindow rateLimitWindow,
                                         BackoffPolicy backoffPolicy, IntakeProperties properties,
                                         Sleeper sleeper, Clock clock, ObjectMapper objectMapper) {
        if (properties.getInbox().getToken() == null || properties.getInbox().getToken().isBlank()) {
            logger.warn("intake.inbox.token is not set; the inbox will reject every lead");
        }
        return new DispatchClient(inboxTransport, rateLimitWindow, backoffPolicy, properties, sleeper, clock,
                objectMapper);
    }

    @Bean
    public BulkSyncEngine bulkSyncEngine(DispatchClient dispatchClient, IntakeProperties properties,
                                         ObjectMapper objectMapper) {
        return new BulkSyncEngine(dispatchClient, properties, objectMapper);
    }

    @Bean
    public LeadIntakePipeline leadIntakePipeline(EnvelopeDecoder decoder, PayloadClassifier classifier,
                                                 LeadFieldMapper mapper, DispatchClient dispatchClient,
                                                 FallbackPolicy fallbackPolicy, OutcomeRecorder recorder) {
        return new LeadIntakePipeline(decoder, classifier, mapper, dispatchClient, fallbackPolicy, recorder);
    }
}
