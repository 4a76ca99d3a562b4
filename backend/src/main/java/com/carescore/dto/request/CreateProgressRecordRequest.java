package com.carescore.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request DTO for opening a progress record, optionally with initial goals.
 */
public record CreateProgressRecordRequest(
    @NotBlank(message = "Patient ID is required")
    String patientId,

    @Valid
    List<GoalRequest> goals
) {}
