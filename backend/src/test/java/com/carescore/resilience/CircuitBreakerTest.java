package com.carescore.resilience;

import com.carescore.exception.ServiceUnavailableException;
import com.carescore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CircuitBreaker Unit Tests")
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        breaker = new CircuitBreaker("repository", 3, 30_000, clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IllegalStateException("db down");
            })).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("Should open after consecutive failures and stop calling through")
    void shouldOpenAfterThreshold() {
        // Given
        fail(3);
        AtomicInteger calls = new AtomicInteger();

        // When / Then
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> breaker.execute(calls::incrementAndGet))
            .isInstanceOf(ServiceUnavailableException.class)
            .extracting("reason").isEqualTo(ServiceUnavailableException.CIRCUIT_OPEN);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("Should reset the failure count on success")
    void shouldResetCountOnSuccess() {
        fail(2);
        breaker.execute(() -> "ok");
        fail(2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should close after a successful trial call once the timeout has passed")
    void shouldCloseAfterHalfOpenSuccess() {
        // Given
        fail(3);
        clock.advanceMillis(30_000);

        // When
        String result = breaker.execute(() -> "ok");

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Should reopen when the trial call fails")
    void shouldReopenAfterHalfOpenFailure() {
        // Given
        fail(3);
        clock.advanceMillis(30_001);

        // When
        fail(1);

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("Should reject other calls while the half-open trial call is running")
    void shouldAllowSingleTrialCall() {
        // Given
        fail(3);
        clock.advanceMillis(30_000);
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = breaker.execute(() -> {
            calls.incrementAndGet();
            assertThatThrownBy(() -> breaker.execute(calls::incrementAndGet))
                .isInstanceOf(ServiceUnavailableException.class)
                .extracting("reason").isEqualTo(ServiceUnavailableException.CIRCUIT_OPEN);
            return "ok";
        });

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(1);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
    }

    @Test
    @DisplayName("Should close on operator reset")
    void shouldCloseOnReset() {
        fail(3);

        breaker.reset();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("Should hand out one breaker per dependency")
    void shouldShareBreakersPerDependency() {
        InMemoryCircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry(clock, 3, 30_000);

        assertThat(registry.forDependency("ai")).isSameAs(registry.forDependency("ai"));
        registry.forDependency("repository");
        assertThat(registry.states()).containsKeys("ai", "repository");
    }
}
