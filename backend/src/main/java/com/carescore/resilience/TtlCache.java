package com.carescore.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-memory TTL cache. When full, a write first drops expired entries and then the oldest one.
 * Not a source of truth: anything cached here can be recomputed from the repository.
 */
@Slf4j
public class TtlCache<K, V> implements ResultCache<K, V> {

    private final Map<K, CacheEntry<K, V>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final String name;
    private final Clock clock;
    private final long defaultTtlMs;
    private final int maxEntries;

    public TtlCache(String name, Clock clock, long defaultTtlMs, int maxEntries) {
        this.name = name;
        this.clock = clock;
        this.defaultTtlMs = Math.max(0, defaultTtlMs);
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public Optional<V> get(K key) {
        if (key == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.ofNullable(entry.value());
    }

    @Override
    public void put(K key, V value) {
        put(key, value, defaultTtlMs);
    }

    @Override
    public synchronized void put(K key, V value, long ttlMs) {
        if (key == null) {
            return;
        }
        long now = clock.millis();
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            makeRoom(now);
        }
        entries.put(key, new CacheEntry<>(key, value, now, Math.max(0, ttlMs)));
    }

    @Override
    public void invalidate(K key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    @Override
    public void invalidateIf(Predicate<K> keyMatcher) {
        entries.keySet().removeIf(keyMatcher);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public long hits() {
        return hits.get();
    }

    @Override
    public long misses() {
        return misses.get();
    }

    private void makeRoom(long now) {
        entries.values().removeIf(e -> e.isExpired(now));
        while (entries.size() >= maxEntries) {
            Optional<CacheEntry<K, V>> oldest = entries.values().stream()
                .min(Comparator.comparingLong(CacheEntry::storedAt));
            if (oldest.isEmpty()) {
                return;
            }
            entries.remove(oldest.get().key());
            log.debug("Cache {} full, evicted oldest entry", name);
        }
    }
}
