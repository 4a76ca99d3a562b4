package com.carescore.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Standardized assessment instruments. Each tool belongs to exactly one assessment type
 * and feeds exactly one risk type.
 */
public enum ToolType {
    MORSE("morse", AssessmentType.FALL_RISK, RiskType.FALL),
    BRADEN("braden", AssessmentType.PRESSURE_ULCER, RiskType.PRESSURE_ULCER),
    MMSE("mmse", AssessmentType.COGNITIVE, RiskType.COGNITIVE_DECLINE);

    private final String value;
    private final AssessmentType assessmentType;
    private final RiskType riskType;

    ToolType(String value, AssessmentType assessmentType, RiskType riskType) {
        this.value = value;
        this.assessmentType = assessmentType;
        this.riskType = riskType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public AssessmentType getAssessmentType() {
        return assessmentType;
    }

    public RiskType getRiskType() {
        return riskType;
    }

    public static ToolType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ToolType tool : values()) {
            if (tool.value.equalsIgnoreCase(value) || tool.name().equalsIgnoreCase(value)) {
                return tool;
            }
        }
        throw new IllegalArgumentException("Unknown ToolType: " + value);
    }
}
