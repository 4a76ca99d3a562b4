package com.carescore.exception;

import java.util.Set;

/**
 * Alerting severity derived from an error code. Used for log routing, not for control flow.
 */
public enum ErrorSeverity {
    CRITICAL,
    HIGH,
    MEDIUM;

    private static final Set<String> CRITICAL_CODES = Set.of(
        "PROGRESS_DATA_CORRUPTION",
        "CRITICAL_DATA_LOSS",
        "PATIENT_SAFETY_RISK"
    );

    private static final Set<String> HIGH_CODES = Set.of(
        "VALIDATION_FAILURE",
        "UNAUTHORIZED_ACCESS",
        "RATE_LIMIT_EXCEEDED"
    );

    public static ErrorSeverity forCode(String code) {
        if (code == null) return MEDIUM;
        if (CRITICAL_CODES.contains(code)) return CRITICAL;
        if (HIGH_CODES.contains(code)) return HIGH;
        return MEDIUM;
    }
}
