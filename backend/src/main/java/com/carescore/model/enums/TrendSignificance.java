package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a trend's correlation clears the significance threshold.
 */
public enum TrendSignificance {
    SIGNIFICANT("significant"),
    NOT_SIGNIFICANT("not_significant"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String value;

    TrendSignificance(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TrendSignificance fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TrendSignificance candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TrendSignificance: " + value);
    }
}
