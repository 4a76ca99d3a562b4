package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of patient risk the aggregator understands.
 */
public enum RiskType {
    FALL("fall"),
    PRESSURE_ULCER("pressure_ulcer"),
    COGNITIVE_DECLINE("cognitive_decline"),
    INFECTION("infection"),
    MEDICATION("medication"),
    READMISSION("readmission");

    private final String value;

    RiskType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RiskType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RiskType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown RiskType: " + value);
    }
}
