package com.example.leadintake.service;

import com.example.leadintake.client.InboxRequest;
import com.example.leadintake.client.InboxResponse;
import com.example.leadintake.client.InboxTransport;
import com.example.leadintake.client.TransportException;
import com.example.leadintake.config.IntakeProperties;
import com.example.leadintake.model.DispatchOutcome;
import com.example.leadintake.model.NormalizedLead;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Sole owner of outbound calls to the lead-inbox API. Every attempt takes a
 * slot from the {@link RateLimitWindow}; 429, 5xx and I/O failures are retried
 * with backoff up to the attempt ceiling, everything else is terminal.
 */
public class DispatchClient {

    private static final Logger logger = LoggerFactory.getLogger(DispatchClient.class);

    static final String LEAD_KEY = "inbox_lead";
    static final String TOKEN_KEY = "inbox_lead_token";

    private final InboxTransport transport;
    private final RateLimitWindow rateLimitWindow;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final String inboxUrl;
    private final String inboxToken;
    private final int maxAttempts;
    private final Duration acquireTimeout;
    private final Duration maxRetryAfter;
    private final Duration requestBudget;

    private final Map<DispatchOutcome.Kind, LongAdder> outcomeCounts = new EnumMap<>(DispatchOutcome.Kind.class);
    private final LongAdder retries = new LongAdder();

    public DispatchClient(InboxTransport transport, RateLimitWindow rateLimitWindow, BackoffPolicy backoffPolicy,
                          IntakeProperties properties, Sleeper sleeper, Clock clock, ObjectMapper objectMapper) {
        this.transport = transport;
        this.rateLimitWindow = rateLimitWindow;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.inboxUrl = properties.getInbox().getUrl();
        this.inboxToken = properties.getInbox().getToken();
        this.maxAttempts = Math.max(1, properties.getRetry().getMaxAttempts());
        this.acquireTimeout = properties.getRateLimit().getAcquireTimeout();
        this.maxRetryAfter = properties.getRetry().getMaxRetryAfter();
        this.requestBudget = properties.getRetry().getRequestBudget();
        for (DispatchOutcome.Kind kind : DispatchOutcome.Kind.values()) {
            outcomeCounts.put(kind, new LongAdder());
        }
    }

    /**
     * Sends one lead to the inbox and classifies the result.
     */
    public DispatchOutcome dispatch(NormalizedLead lead) {
        long startedAt = clock.millis();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(LEAD_KEY, lead.toInboxLead());
        body.put(TOKEN_KEY, inboxToken);

        Exchange exchange = exchange(InboxRequest.post(inboxUrl, body));
        DispatchOutcome outcome = exchange.isSuccess()
                ? DispatchOutcome.created(parseRemoteId(exchange.getResponse()), exchange.getAttempts())
                : exchange.getFailure();
        outcome = outcome.withLatency(Duration.ofMillis(clock.millis() - startedAt));
        outcomeCounts.get(outcome.getKind()).increment();
        return outcome;
    }

    /**
     * Runs the rate-limited retry loop for any request against the downstream API.
     * A 2xx response comes back as-is; anything else as a terminal outcome.
     */
    public Exchange exchange(InboxRequest request) {
        long deadline = clock.millis() + requestBudget.toMillis();
        int attempt = 0;
        String lastCause = null;

        while (true) {
            if (attempt > 0 && remaining(deadline).isZero()) {
                return Exchange.failed(DispatchOutcome.transientFailure(attempt, "timeout"));
            }
            Duration slotWait = min(acquireTimeout, remaining(deadline));
            RateLimitWindow.Acquisition slot;
            try {
                slot = rateLimitWindow.tryAcquire(slotWait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Exchange.failed(DispatchOutcome.transientFailure(attempt, "interrupted"));
            }
            if (!slot.isGranted()) {
                logger.warn("No rate-limit slot within {} ms for {} {}", slotWait.toMillis(),
                        request.getMethod(), request.getUrl());
                return Exchange.failed(DispatchOutcome.rateLimited(slot.getRetryAfter(), attempt));
            }

            attempt++;
            Duration retryDelay;
            Duration serverRetryAfter = null;
            try {
                // a single call may not outlive the request budget
                InboxResponse response = transport.exchange(request.withTimeout(remaining(deadline)));
                int status = response.getStatus();
                if (response.is2xx()) {
                    return Exchange.succeeded(response, attempt);
                }
                if (status == 401 || status == 403) {
                    logger.warn("Inbox rejected credentials: HTTP {}", status);
                    return Exchange.failed(DispatchOutcome.authRejected(status, attempt));
                }
                if (status == 422) {
                    return Exchange.failed(validationOutcome(response, attempt));
                }
                if (status == 429) {
                    lastCause = "HTTP 429";
                    serverRetryAfter = parseRetryAfter(response.header("Retry-After"));
                    if (serverRetryAfter != null && serverRetryAfter.compareTo(maxRetryAfter) > 0) {
                        logger.warn("Inbox asks to retry after {} s, longer than the {} s this client waits",
                                serverRetryAfter.toSeconds(), maxRetryAfter.toSeconds());
                        return Exchange.failed(DispatchOutcome.rateLimited(serverRetryAfter, attempt));
                    }
                    retryDelay = serverRetryAfter != null ? serverRetryAfter : backoffPolicy.delayFor(attempt);
                } else if (response.is5xx()) {
                    lastCause = "HTTP " + status;
                    retryDelay = backoffPolicy.delayFor(attempt);
                } else {
                    logger.error("Unexpected HTTP {} from {} body={}", status, request.getUrl(), response.getBody());
                    return Exchange.failed(DispatchOutcome.fatalFailure("Unexpected HTTP status " + status, attempt));
                }
            } catch (TransportException e) {
                lastCause = e.isTimeout() ? "timeout" : "network: " + e.getMessage();
                retryDelay = backoffPolicy.delayFor(attempt);
            }

            if (attempt >= maxAttempts) {
                logger.warn("Giving up on {} {} after {} attempts: {}", request.getMethod(), request.getUrl(),
                        attempt, lastCause);
                return Exchange.failed(DispatchOutcome.transientFailure(attempt, lastCause));
            }
            if (retryDelay.toMillis() > remaining(deadline).toMillis()) {
                if (serverRetryAfter != null) {
                    return Exchange.failed(DispatchOutcome.rateLimited(serverRetryAfter, attempt));
                }
                return Exchange.failed(DispatchOutcome.transientFailure(attempt, "timeout"));
            }

            logger.info("Attempt {} of {} failed ({}), retrying in {} ms", attempt, maxAttempts, lastCause,
                    retryDelay.toMillis());
            retries.increment();
            try {
                sleeper.sleep(retryDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Exchange.failed(DispatchOutcome.transientFailure(attempt, "interrupted"));
            }
        }
    }

    private DispatchOutcome validationOutcome(InboxResponse response, int attempt) {
        JsonNode errors = null;
        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            if (root != null) {
                errors = root.path(LEAD_KEY).path("errors");
                if (!errors.isObject()) {
                    errors = root.path("errors");
                }
            }
        } catch (JsonProcessingException e) {
            logger.debug("422 body is not JSON", e);
        }
        if (errors == null || !errors.isObject()) {
            logger.error("Unparsable 422 body: {}", response.getBody());
            return DispatchOutcome.fatalFailure("Unparsable validation error body", attempt);
        }
        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = errors.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            List<String> messages = new ArrayList<>();
            if (entry.getValue().isArray()) {
                entry.getValue().forEach(m -> messages.add(m.asText()));
            } else {
                messages.add(entry.getValue().asText());
            }
            fieldErrors.put(entry.getKey(), messages);
        }
        logger.warn("Inbox rejected lead: {}", fieldErrors);
        return DispatchOutcome.validationRejected(fieldErrors, attempt);
    }

    private String parseRemoteId(InboxResponse response) {
        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            if (root != null) {
                JsonNode id = root.path(LEAD_KEY).path("id");
                if (id.isMissingNode() || id.isNull()) {
                    id = root.path("id");
                }
                if (!id.isMissingNode() && !id.isNull()) {
                    return id.asText();
                }
            }
        } catch (JsonProcessingException e) {
            logger.debug("Created response body is not JSON", e);
        }
        logger.warn("Lead created (HTTP {}) but no id in response body: {}", response.getStatus(), response.getBody());
        return null;
    }

    /**
     * {@code Retry-After} as delta-seconds or HTTP-date; null when absent or unreadable.
     */
    Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            return Duration.ofSeconds(Math.max(0L, Long.parseLong(value)));
        } catch (NumberFormatException e) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                long millis = at.toInstant().toEpochMilli() - clock.millis();
                return Duration.ofMillis(Math.max(0L, millis));
            } catch (DateTimeParseException ignored) {
                logger.debug("Ignoring unreadable Retry-After '{}'", value);
                return null;
            }
        }
    }

    private Duration remaining(long deadline) {
        return Duration.ofMillis(Math.max(0L, deadline - clock.millis()));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public Map<String, Object> getStats() {
        Map<String, Object> outcomes = new LinkedHashMap<>();
        outcomeCounts.forEach((kind, count) -> outcomes.put(kind.name(), count.sum()));
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("outcomes", outcomes);
        stats.put("retries", retries.sum());
        stats.put("rateLimit", rateLimitWindow.snapshot());
        stats.put("configuration", Map.of(
                "maxAttempts", maxAttempts,
                "acquireTimeoutMs", acquireTimeout.toMillis(),
                "requestBudgetMs", requestBudget.toMillis()));
        return stats;
    }

    /**
     * Result of {@link #exchange}: the 2xx response, or the terminal failure.
     */
    public static final class Exchange {
        private final InboxResponse response;
        private final DispatchOutcome failure;
        private final int attempts;

        private Exchange(InboxResponse response, DispatchOutcome failure, int attempts) {
            this.response = response;
            this.failure = failure;
            this.attempts = attempts;
        }

        static Exchange succeeded(InboxResponse response, int attempts) {
            return new Exchange(response, null, attempts);
        }

        static Exchange failed(DispatchOutcome failure) {
            return new Exchange(null, failure, failure.getAttempts());
        }

        public boolean isSuccess() { return failure == null; }
        public InboxResponse getResponse() { return response; }
        public DispatchOutcome getFailure() { return failure; }
        public int getAttempts() { return attempts; }
    }
}
