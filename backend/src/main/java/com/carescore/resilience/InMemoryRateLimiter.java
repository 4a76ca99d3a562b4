package com.carescore.resilience;

import com.carescore.exception.RateLimitException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local rate limiter. Counters are not shared between service instances.
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long windowMs;
    private final int maxRequests;
    private final int maxBuckets;

    public InMemoryRateLimiter(Clock clock, long windowMs, int maxRequests, int maxBuckets) {
        this.clock = clock;
        this.windowMs = Math.max(1, windowMs);
        this.maxRequests = Math.max(1, maxRequests);
        this.maxBuckets = Math.max(1, maxBuckets);
    }

    @Override
    public void checkLimit(String callerKey) {
        long now = clock.millis();
        purgeIdleBuckets(now);

        RateLimitBucket bucket = buckets.computeIfAbsent(callerKey, k -> new RateLimitBucket(k, now));
        int previous;
        long resetAt;
        synchronized (bucket) {
            previous = bucket.increment(now, windowMs);
            // first millisecond at which the window has expired
            resetAt = bucket.getWindowStart() + windowMs + 1;
        }

        if (previous >= maxRequests) {
            long retryAfter = Math.max(1, (long) Math.ceil((resetAt - now) / 1000.0));
            log.warn("Rate limit exceeded for caller {} ({} requests in window)", callerKey, previous + 1);
            throw new RateLimitException(retryAfter);
        }
    }

    @Override
    public int remaining(String callerKey) {
        RateLimitBucket bucket = buckets.get(callerKey);
        if (bucket == null) {
            return maxRequests;
        }
        synchronized (bucket) {
            if (bucket.isExpired(clock.millis(), windowMs)) {
                return maxRequests;
            }
            return Math.max(0, maxRequests - bucket.getCount());
        }
    }

    int bucketCount() {
        return buckets.size();
    }

    private void purgeIdleBuckets(long now) {
        if (buckets.size() <= maxBuckets) {
            return;
        }
        buckets.values().removeIf(b -> b.isExpired(now, windowMs));
    }
}
