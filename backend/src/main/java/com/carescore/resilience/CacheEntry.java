package com.carescore.resilience;

/**
 * Cached value with the time it was stored and how long it stays valid.
 */
public record CacheEntry<K, V>(K key, V value, long storedAt, long ttlMs) {

    public boolean isExpired(long now) {
        return now - storedAt >= ttlMs;
    }
}
