package com.carescore.service.risk;

import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.RiskType;

import java.util.List;
import java.util.Map;

public record RiskAggregation(
    RiskLevel overallLevel,
    double averageScore,
    Map<RiskType, RiskScore> scores,
    List<RiskAlert> alerts,
    List<Recommendation> recommendations,
    List<RiskType> highestRiskAreas
) {}
