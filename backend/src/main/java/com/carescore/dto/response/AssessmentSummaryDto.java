package com.carescore.dto.response;

import java.time.Instant;

/**
 * Response DTO for assessment lists.
 */
public record AssessmentSummaryDto(
    String id,
    String patientId,
    String toolType,
    Integer totalScore,
    String riskLevel,
    String status,
    long version,
    Instant createdAt
) {}
