package com.carescore.resilience;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter: {@code base * 2^(attempt-1) + random(0, jitter)},
 * capped at {@code maxDelayMs}.
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelayMs = Math.max(0, baseDelayMs);
        maxDelayMs = Math.max(0, maxDelayMs);
        jitterMs = Math.max(0, jitterMs);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public long delayAfterAttempt(int attempt) {
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long exponential = baseDelayMs * (1L << exponent);
        long jitter = jitterMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterMs + 1);
        return Math.min(exponential + jitter, maxDelayMs);
    }
}
