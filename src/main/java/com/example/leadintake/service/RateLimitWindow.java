package com.example.leadintake.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-window request counter: at most {@code maxRequests} slots per window.
 * A saturated window makes callers wait for the boundary instead of dropping
 * the request. A slot is consumed when granted, before the call is issued.
 */
public final class RateLimitWindow {

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private long windowStartMillis;
    private int count;
    private long totalGranted;
    private long totalWaits;

    public RateLimitWindow(int maxRequests, Duration window, Clock clock, Sleeper sleeper) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0, got: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
        this.windowStartMillis = clock.millis();
    }

    /**
     * Takes a slot, waiting for later windows for at most {@code maxWait}.
     */
    public Acquisition tryAcquire(Duration maxWait) throws InterruptedException {
        long startedAt = clock.millis();
        long deadline = startedAt + Math.max(0L, maxWait.toMillis());
        while (true) {
            long waitMillis;
            lock.lock();
            try {
                long now = clock.millis();
                if (now - windowStartMillis >= windowMillis) {
                    windowStartMillis = now;
                    count = 0;
                }
                if (count < maxRequests) {
                    count++;
                    totalGranted++;
                    return Acquisition.granted(Duration.ofMillis(now - startedAt));
                }
                waitMillis = windowStartMillis + windowMillis - now;
                if (now + waitMillis > deadline) {
                    return Acquisition.denied(Duration.ofMillis(waitMillis));
                }
                totalWaits++;
            } finally {
                lock.unlock();
            }
            sleeper.sleep(Duration.ofMillis(waitMillis));
        }
    }

    public Map<String, Object> snapshot() {
        lock.lock();
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("maxRequests", maxRequests);
            stats.put("windowMs", windowMillis);
            stats.put("windowStart", Instant.ofEpochMilli(windowStartMillis).toString());
            stats.put("inWindow", count);
            stats.put("totalGranted", totalGranted);
            stats.put("totalWaits", totalWaits);
            return stats;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Result of a slot request: granted after {@code waited}, or denied with the
     * time left until the window boundary.
     */
    public static final class Acquisition {
        private final boolean granted;
        private final Duration duration;

        private Acquisition(boolean granted, Duration duration) {
            this.granted = granted;
            this.duration = duration;
        }

        static Acquisition granted(Duration waited) {
            return new Acquisition(true, waited);
        }

        static Acquisition denied(Duration retryAfter) {
            return new Acquisition(false, retryAfter);
        }

        public boolean isGranted() { return granted; }
        public Duration getWaited() { return granted ? duration : Duration.ZERO; }
        public Duration getRetryAfter() { return granted ? Duration.ZERO : duration; }
    }
}
