package com.carescore.resilience;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Bounded key-value cache with per-entry time-to-live.
 */
public interface ResultCache<K, V> {

    /**
     * Returns the value if present and not expired. An expired entry is evicted and counts as a miss.
     */
    Optional<V> get(K key);

    void put(K key, V value);

    void put(K key, V value, long ttlMs);

    void invalidate(K key);

    void invalidateIf(Predicate<K> keyMatcher);

    int size();

    long hits();

    long misses();
}
