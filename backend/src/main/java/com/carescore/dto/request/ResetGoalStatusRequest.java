package com.carescore.dto.request;

import jakarta.validation.constraints.NotBlank;

public record ResetGoalStatusRequest(
    @NotBlank(message = "Status is required")
    String status,

    Long expectedVersion
) {}
