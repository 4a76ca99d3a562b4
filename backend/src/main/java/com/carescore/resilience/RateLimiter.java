package com.carescore.resilience;

import com.carescore.exception.RateLimitException;

/**
 * Fixed-window request limiter keyed by caller identity.
 */
public interface RateLimiter {

    /**
     * Counts one request for the caller and rejects it when the window is already full.
     * Every call counts exactly once, whether admitted or rejected.
     *
     * @throws RateLimitException when the caller has used up the current window
     */
    void checkLimit(String callerKey);

    /**
     * Requests still available to the caller in the current window.
     */
    int remaining(String callerKey);
}
