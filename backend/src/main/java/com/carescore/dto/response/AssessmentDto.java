package com.carescore.dto.response;

import com.carescore.model.HistoryEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a full assessment, history included.
 */
public record AssessmentDto(
    String id,
    String patientId,
    String authorId,
    String assessmentType,
    String toolType,
    Map<String, Integer> categories,
    Integer totalScore,
    String riskLevel,
    String normalizedRisk,
    String status,
    long version,
    List<String> warnings,
    List<HistoryEntry> history,
    Instant createdAt,
    Instant updatedAt
) {}
