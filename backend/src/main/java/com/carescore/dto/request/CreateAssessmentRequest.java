package com.carescore.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request DTO for recording a new assessment.
 * Totals and risk levels are always computed server-side from the category values.
 */
public record CreateAssessmentRequest(
    @NotBlank(message = "Patient ID is required")
    String patientId,

    @NotBlank(message = "Tool type is required")
    String toolType,

    // Optional; must match the tool when given
    String assessmentType,

    @NotNull(message = "Category values are required")
    Map<String, Integer> categories,

    boolean draft
) {}
