package com.carescore.service;

import com.carescore.integration.ClinicalInsights;
import com.carescore.service.risk.RiskAggregation;

import java.time.Instant;
import java.util.List;

/**
 * Patient-level risk picture built from the latest active assessment of each tool plus any
 * externally supplied scores.
 */
public record RiskAssessmentReport(
    String patientId,
    RiskAggregation aggregation,
    ClinicalInsights insights,
    List<String> sourceAssessmentIds,
    Instant assessedAt
) {}
