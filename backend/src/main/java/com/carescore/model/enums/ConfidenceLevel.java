package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence levels for statistical results.
 */
public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConfidenceLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ConfidenceLevel candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConfidenceLevel: " + value);
    }
}
