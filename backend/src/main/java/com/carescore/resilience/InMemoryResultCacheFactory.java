package com.carescore.resilience;

import java.time.Clock;

public class InMemoryResultCacheFactory implements ResultCacheFactory {

    private final Clock clock;
    private final long ttlMs;
    private final int maxEntries;

    public InMemoryResultCacheFactory(Clock clock, long ttlMs, int maxEntries) {
        this.clock = clock;
        this.ttlMs = ttlMs;
        this.maxEntries = maxEntries;
    }

    @Override
    public <V> ResultCache<String, V> create(String name) {
        return new TtlCache<>(name, clock, ttlMs, maxEntries);
    }
}
