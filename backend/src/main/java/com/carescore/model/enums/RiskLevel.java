package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized risk severity. Declaration order is the severity order: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Level for a 0..100 risk score given without one: 80 critical, 60 high, 40 medium.
     */
    public static RiskLevel forScore(double score) {
        if (score >= 80) return CRITICAL;
        if (score >= 60) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }

    public static RiskLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        // "moderate" is what most clinical tools call the middle band
        if ("moderate".equalsIgnoreCase(value)) {
            return MEDIUM;
        }
        for (RiskLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown RiskLevel: " + value);
    }
}
