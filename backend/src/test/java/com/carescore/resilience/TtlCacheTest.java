package com.carescore.resilience;

import com.carescore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TtlCache Unit Tests")
class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String, Integer> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        cache = new TtlCache<>("test", clock, 1_000, 3);
    }

    @Test
    @DisplayName("Should serve a fresh entry and count hits and misses")
    void shouldServeFreshEntry() {
        cache.put("a", 1);

        assertThat(cache.get("a")).contains(1);
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should evict an entry on read once its TTL has passed")
    void shouldExpireEntries() {
        // Given
        cache.put("a", 1);
        cache.put("b", 2, 5_000);

        // When
        clock.advanceMillis(1_000);

        // Then
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop the oldest entry when full")
    void shouldEvictOldestWhenFull() {
        // Given
        cache.put("a", 1);
        clock.advanceMillis(10);
        cache.put("b", 2);
        clock.advanceMillis(10);
        cache.put("c", 3);

        // When
        cache.put("d", 4);

        // Then
        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("d")).contains(4);
    }

    @Test
    @DisplayName("Should overwrite an existing key without evicting")
    void shouldOverwriteInPlace() {
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);

        cache.put("a", 10);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("a")).contains(10);
    }

    @Test
    @DisplayName("Should invalidate by key prefix")
    void shouldInvalidateMatchingKeys() {
        cache.put("record:1:v1", 1);
        cache.put("record:1:v2", 2);
        cache.put("record:2:v1", 3);

        cache.invalidateIf(key -> key.startsWith("record:1:"));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("record:2:v1")).contains(3);
    }
}
