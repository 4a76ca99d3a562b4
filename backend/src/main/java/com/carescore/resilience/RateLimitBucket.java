package com.carescore.resilience;

import lombok.Getter;

/**
 * Request counter for one caller within one window. Mutated under its own monitor.
 */
@Getter
public class RateLimitBucket {

    private final String key;
    private int count;
    private long windowStart;

    RateLimitBucket(String key, long windowStart) {
        this.key = key;
        this.windowStart = windowStart;
    }

    boolean isExpired(long now, long windowMs) {
        return now > windowStart + windowMs;
    }

    /**
     * Counts a request and returns the count as it was before this request.
     */
    int increment(long now, long windowMs) {
        if (isExpired(now, windowMs)) {
            windowStart = now;
            count = 0;
        }
        return count++;
    }
}
