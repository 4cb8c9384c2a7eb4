package com.example.leadintake.service;

import java.time.Duration;

/**
 * Delay before retrying after a failed attempt.
 *
 * @see ExponentialBackoffPolicy
 */
public interface BackoffPolicy {

    /**
     * @param attempt the attempt that just failed (1-based)
     * @return non-negative delay
     */
    Duration delayFor(int attempt);
}
