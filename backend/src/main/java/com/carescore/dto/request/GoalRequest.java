package com.carescore.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for a SMART goal. Missing SMART fields get defaults.
 */
public record GoalRequest(
    @NotBlank(message = "Description is required")
    String description,

    String category,
    String priority,

    // SMART criteria
    String specific,
    String measurable,
    Boolean achievable,
    Boolean relevant,
    Instant timeBound,

    @NotNull(message = "Target value is required")
    @Positive(message = "Target value must be greater than 0")
    Double targetValue,

    Double currentValue,
    String unit,

    @Valid
    List<MilestoneRequest> milestones
) {

    public record MilestoneRequest(
        String description,

        @DecimalMin(value = "0", message = "Threshold must be between 0 and 100")
        @DecimalMax(value = "100", message = "Threshold must be between 0 and 100")
        double threshold
    ) {}
}
