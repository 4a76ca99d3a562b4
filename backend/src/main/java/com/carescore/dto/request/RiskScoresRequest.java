package com.carescore.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Request DTO carrying risk scores computed elsewhere, keyed by risk type
 * (e.g. "infection", "medication", "readmission").
 */
public record RiskScoresRequest(
    @Valid
    Map<String, RiskScoreRequest> scores
) {

    public record RiskScoreRequest(
        @NotNull(message = "Score value is required")
        @DecimalMin(value = "0", message = "Score value must be between 0 and 100")
        @DecimalMax(value = "100", message = "Score value must be between 0 and 100")
        Double value,

        // Derived from the value when omitted
        String level,

        List<String> contributingFactors,

        @DecimalMin(value = "0", message = "Confidence must be between 0 and 1")
        @DecimalMax(value = "1", message = "Confidence must be between 0 and 1")
        Double confidence
    ) {}
}
