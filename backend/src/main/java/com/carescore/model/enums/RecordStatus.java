package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an assessment or progress record. Records are archived, never deleted.
 */
public enum RecordStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    ARCHIVED("archived");

    private final String value;

    RecordStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RecordStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RecordStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown RecordStatus: " + value);
    }
}
