package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical domain an assessment covers.
 */
public enum AssessmentType {
    FALL_RISK("fall-risk"),
    PRESSURE_ULCER("pressure-ulcer"),
    COGNITIVE("cognitive");

    private final String value;

    AssessmentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AssessmentType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AssessmentType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown AssessmentType: " + value);
    }
}
