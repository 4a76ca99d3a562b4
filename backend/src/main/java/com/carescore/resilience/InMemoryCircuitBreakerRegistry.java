package com.carescore.resilience;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCircuitBreakerRegistry implements CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int failureThreshold;
    private final long openTimeoutMs;

    public InMemoryCircuitBreakerRegistry(Clock clock, int failureThreshold, long openTimeoutMs) {
        this.clock = clock;
        this.failureThreshold = failureThreshold;
        this.openTimeoutMs = openTimeoutMs;
    }

    @Override
    public CircuitBreaker forDependency(String dependency) {
        return breakers.computeIfAbsent(dependency,
            d -> new CircuitBreaker(d, failureThreshold, openTimeoutMs, clock));
    }

    @Override
    public Map<String, CircuitState> states() {
        Map<String, CircuitState> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.getState()));
        return result;
    }
}
