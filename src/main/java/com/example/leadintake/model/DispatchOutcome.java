package com.example.leadintake.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of handling one logical lead. Exactly one {@link Kind} per lead.
 * Outcomes produced before any network call carry a local {@link Stage}.
 */
public final class DispatchOutcome {

    public enum Kind {
        CREATED,
        VALIDATION_REJECTED,
        AUTH_REJECTED,
        RATE_LIMITED,
        TRANSIENT_FAILURE,
        FATAL_FAILURE
    }

    public enum Stage {
        DECODE,
        CLASSIFY,
        MAP,
        DISPATCH;

        public boolean isLocal() {
            return this != DISPATCH;
        }
    }

    private final Kind kind;
    private final Stage stage;
    private final String remoteId;
    private final Map<String, List<String>> fieldErrors;
    private final Duration retryAfter;
    private final int attempts;
    private final String cause;
    private final Duration latency;

    private DispatchOutcome(Kind kind, Stage stage, String remoteId, Map<String, List<String>> fieldErrors,
                            Duration retryAfter, int attempts, String cause, Duration latency) {
        this.kind = kind;
        this.stage = stage;
        this.remoteId = remoteId;
        this.fieldErrors = fieldErrors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
        this.retryAfter = retryAfter;
        this.attempts = attempts;
        this.cause = cause;
        this.latency = latency == null ? Duration.ZERO : latency;
    }

    public static DispatchOutcome created(String remoteId, int attempts) {
        return new DispatchOutcome(Kind.CREATED, Stage.DISPATCH, remoteId, null, null, attempts, null, null);
    }

    public static DispatchOutcome validationRejected(Map<String, List<String>> fieldErrors, int attempts) {
        return new DispatchOutcome(Kind.VALIDATION_REJECTED, Stage.DISPATCH, null, fieldErrors, null, attempts, null, null);
    }

    /**
     * Input rejected before dispatch: malformed envelope, unknown shape or unmappable item.
     */
    public static DispatchOutcome rejectedLocally(Stage stage, String field, String reason) {
        if (!stage.isLocal()) {
            throw new IllegalArgumentException("Local rejection needs a local stage, got " + stage);
        }
        return new DispatchOutcome(Kind.VALIDATION_REJECTED, stage, null, Map.of(field, List.of(reason)),
                null, 0, reason, null);
    }

    public static DispatchOutcome authRejected(int status, int attempts) {
        return new DispatchOutcome(Kind.AUTH_REJECTED, Stage.DISPATCH, null, null, null, attempts,
                "HTTP " + status, null);
    }

    public static DispatchOutcome rateLimited(Duration retryAfter, int attempts) {
        return new DispatchOutcome(Kind.RATE_LIMITED, Stage.DISPATCH, null, null, retryAfter, attempts,
                "rate limited", null);
    }

    public static DispatchOutcome transientFailure(int attempts, String cause) {
        return new DispatchOutcome(Kind.TRANSIENT_FAILURE, Stage.DISPATCH, null, null, null, attempts, cause, null);
    }

    public static DispatchOutcome fatalFailure(String cause, int attempts) {
        return new DispatchOutcome(Kind.FATAL_FAILURE, Stage.DISPATCH, null, null, null, attempts, cause, null);
    }

    public DispatchOutcome withLatency(Duration latency) {
        return new DispatchOutcome(kind, stage, remoteId, fieldErrors, retryAfter, attempts, cause, latency);
    }

    public Kind getKind() { return kind; }
    public Stage getStage() { return stage; }
    public String getRemoteId() { return remoteId; }
    public Map<String, List<String>> getFieldErrors() { return fieldErrors; }
    public Duration getRetryAfter() { return retryAfter; }
    public int getAttempts() { return attempts; }
    public String getCause() { return cause; }
    public Duration getLatency() { return latency; }

    public boolean isCreated() {
        return kind == Kind.CREATED;
    }

    /**
     * True when the caller's input is at fault (local stage) rather than the downstream system.
     */
    public boolean isInputRejected() {
        return kind == Kind.VALIDATION_REJECTED && stage.isLocal();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("outcome", kind.name());
        result.put("stage", stage.name());
        result.put("attempts", attempts);
        result.put("latencyMs", latency.toMillis());
        if (remoteId != null) {
            result.put("remoteId", remoteId);
        }
        if (!fieldErrors.isEmpty()) {
            result.put("fieldErrors", fieldErrors);
        }
        if (retryAfter != null) {
            result.put("retryAfterSec", retryAfter.toSeconds());
        }
        if (cause != null) {
            result.put("cause", cause);
        }
        return result;
    }

    @Override
    public String toString() {
        return "DispatchOutcome" + toMap();
    }
}
