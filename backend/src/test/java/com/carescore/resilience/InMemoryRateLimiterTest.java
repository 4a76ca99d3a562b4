package com.carescore.resilience;

import com.carescore.exception.RateLimitException;
import com.carescore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryRateLimiter Unit Tests")
class InMemoryRateLimiterTest {

    private MutableClock clock;
    private InMemoryRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        limiter = new InMemoryRateLimiter(clock, 60_000, 3, 100);
    }

    @Test
    @DisplayName("Should admit up to the limit and reject the next call with a retry hint")
    void shouldRejectOverLimit() {
        // Given
        limiter.checkLimit("clinician-1");
        limiter.checkLimit("clinician-1");
        limiter.checkLimit("clinician-1");
        clock.advanceMillis(15_500);

        // When / Then
        assertThatThrownBy(() -> limiter.checkLimit("clinician-1"))
            .isInstanceOf(RateLimitException.class)
            .satisfies(e -> assertThat(((RateLimitException) e).getRetryAfterSeconds()).isEqualTo(45));
        assertThat(limiter.remaining("clinician-1")).isZero();
    }

    @Test
    @DisplayName("Should admit a caller that waits exactly the reported retry-after")
    void shouldAdmitAfterReportedRetryAfter() {
        // Given
        for (int i = 0; i < 3; i++) {
            limiter.checkLimit("clinician-1");
        }
        long retryAfter = catchRetryAfter("clinician-1");

        // When
        clock.advanceMillis(retryAfter * 1_000);

        // Then
        assertThat(retryAfter).isEqualTo(61);
        assertThatCode(() -> limiter.checkLimit("clinician-1")).doesNotThrowAnyException();
    }

    private long catchRetryAfter(String caller) {
        try {
            limiter.checkLimit(caller);
        } catch (RateLimitException e) {
            return e.getRetryAfterSeconds();
        }
        throw new AssertionError("Expected " + caller + " to be rate limited");
    }

    @Test
    @DisplayName("Should keep callers independent")
    void shouldIsolateCallers() {
        limiter.checkLimit("a");
        limiter.checkLimit("a");
        limiter.checkLimit("a");

        assertThatCode(() -> limiter.checkLimit("b")).doesNotThrowAnyException();
        assertThat(limiter.remaining("b")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should open a fresh window once the old one has passed")
    void shouldResetAfterWindow() {
        // Given
        for (int i = 0; i < 3; i++) {
            limiter.checkLimit("clinician-1");
        }
        assertThatThrownBy(() -> limiter.checkLimit("clinician-1")).isInstanceOf(RateLimitException.class);

        // When
        clock.advanceMillis(60_001);

        // Then
        assertThatCode(() -> limiter.checkLimit("clinician-1")).doesNotThrowAnyException();
        assertThat(limiter.remaining("clinician-1")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should drop idle buckets once the bucket cap is exceeded")
    void shouldPurgeIdleBuckets() {
        // Given
        InMemoryRateLimiter small = new InMemoryRateLimiter(clock, 1_000, 5, 2);
        small.checkLimit("a");
        small.checkLimit("b");
        small.checkLimit("c");
        clock.advanceMillis(2_000);

        // When
        small.checkLimit("d");

        // Then
        assertThat(small.bucketCount()).isEqualTo(1);
    }
}
