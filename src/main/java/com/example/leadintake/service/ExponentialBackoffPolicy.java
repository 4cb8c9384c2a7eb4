package com.example.leadintake.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 * With jitter the capped delay is scaled by a random factor in [0.5, 1.5) and
 * capped again, so concurrent batch retries do not fire in lockstep.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay, boolean jitter) {
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        if (base <= 0) {
            throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
        }
        if (max < base) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        this.baseDelayMs = base;
        this.maxDelayMs = max;
        this.jitter = jitter;
    }

    @Override
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        if (!jitter) {
            return Duration.ofMillis(capped);
        }
        double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Duration.ofMillis(Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor))));
    }
}
