package com.carescore.dto.request;

import java.util.Map;

/**
 * Request DTO for updating an assessment.
 * Only the category values provided are changed; the rest are kept.
 */
public record UpdateAssessmentRequest(
    Map<String, Integer> categories,
    String status,
    Long expectedVersion
) {}
