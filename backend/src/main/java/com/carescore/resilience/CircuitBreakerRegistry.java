package com.carescore.resilience;

import java.util.Map;

/**
 * Hands out one breaker per dependency name, created on first use.
 */
public interface CircuitBreakerRegistry {

    String REPOSITORY = "repository";
    String AI = "ai";

    CircuitBreaker forDependency(String dependency);

    Map<String, CircuitState> states();
}
