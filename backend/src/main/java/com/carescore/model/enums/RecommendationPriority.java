package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority of a mitigation recommendation, highest first.
 */
public enum RecommendationPriority {
    URGENT("urgent"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    RecommendationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RecommendationPriority fromValue(String value) {
        if (value == null) {
            return MEDIUM;
        }
        for (RecommendationPriority candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RecommendationPriority: " + value);
    }
}
