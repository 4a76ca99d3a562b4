package com.carescore.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
