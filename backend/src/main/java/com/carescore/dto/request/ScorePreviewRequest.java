package com.carescore.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record ScorePreviewRequest(
    @NotBlank(message = "Tool type is required")
    String toolType,

    @NotNull(message = "Category values are required")
    Map<String, Integer> categories
) {}
