package com.carescore.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request DTO for recording an intervention.
 * Effectiveness is estimated from recorded progress when omitted.
 */
public record RecordInterventionRequest(
    @NotBlank(message = "Intervention type is required")
    String type,

    String description,

    @DecimalMin(value = "0", message = "Effectiveness must be between 0 and 100")
    @DecimalMax(value = "100", message = "Effectiveness must be between 0 and 100")
    Double effectiveness,

    List<String> goalIds,

    Long expectedVersion
) {}
