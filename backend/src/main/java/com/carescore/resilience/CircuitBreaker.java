package com.carescore.resilience;

import com.carescore.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Per-dependency circuit breaker.
 * <p>
 * CLOSED opens after {@code failureThreshold} consecutive failures. OPEN rejects calls without
 * running them until {@code openTimeoutMs} has passed since the last failure, then lets the next
 * call through as HALF_OPEN. While that trial call runs, other calls are rejected. A success in
 * HALF_OPEN closes the circuit, a failure reopens it.
 */
@Slf4j
public class CircuitBreaker {

    private final String dependency;
    private final int failureThreshold;
    private final long openTimeoutMs;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private long lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(String dependency, int failureThreshold, long openTimeoutMs, Clock clock) {
        this.dependency = dependency;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openTimeoutMs = Math.max(0, openTimeoutMs);
        this.clock = clock;
    }

    /**
     * Runs the call if the circuit allows it and records the outcome.
     *
     * @throws ServiceUnavailableException with reason {@code circuit_open} when the call was not attempted
     */
    public <T> T execute(Supplier<T> call) {
        if (!tryAcquire()) {
            throw new ServiceUnavailableException(dependency, ServiceUnavailableException.CIRCUIT_OPEN);
        }
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            recordFailure();
            throw e;
        }
        recordSuccess();
        return result;
    }

    public synchronized boolean tryAcquire() {
        if (state == CircuitState.OPEN) {
            if (clock.millis() - lastFailureTime >= openTimeoutMs) {
                state = CircuitState.HALF_OPEN;
                trialInFlight = true;
                log.info("Circuit for {} half-open, allowing a trial call", dependency);
                return true;
            }
            return false;
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                return false;
            }
            trialInFlight = true;
        }
        return true;
    }

    public synchronized void recordSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("Circuit for {} closed", dependency);
        }
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        lastFailureTime = clock.millis();
        trialInFlight = false;
        if (state == CircuitState.HALF_OPEN) {
            state = CircuitState.OPEN;
            log.warn("Circuit for {} reopened after failed trial call", dependency);
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            state = CircuitState.OPEN;
            log.warn("Circuit for {} opened after {} consecutive failures", dependency, consecutiveFailures);
        }
    }

    /**
     * Operator recovery: forget failures and close the circuit.
     */
    public synchronized void reset() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        lastFailureTime = 0;
        trialInFlight = false;
    }

    public String getDependency() {
        return dependency;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized long getLastFailureTime() {
        return lastFailureTime;
    }
}
