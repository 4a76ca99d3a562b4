package com.carescore.dto.request;

import jakarta.validation.constraints.NotNull;

public record UpdateGoalProgressRequest(
    @NotNull(message = "Current value is required")
    Double currentValue,

    Long expectedVersion
) {}
