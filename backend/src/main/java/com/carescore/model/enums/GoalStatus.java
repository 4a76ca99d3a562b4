package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a SMART goal. Automatic transitions only leave ACTIVE.
 */
public enum GoalStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    OVERDUE("overdue");

    private final String value;

    GoalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static GoalStatus fromValue(String value) {
        if (value == null) {
            return ACTIVE;
        }
        for (GoalStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown GoalStatus: " + value);
    }
}
