package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a fitted trend.
 */
public enum TrendDirection {
    IMPROVING("improving"),
    DECLINING("declining"),
    STABLE("stable");

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TrendDirection fromValue(String value) {
        if (value == null) {
            return STABLE;
        }
        for (TrendDirection candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TrendDirection: " + value);
    }
}
