package com.carescore.service.analytics;

import com.carescore.model.enums.TrendDirection;

import java.util.List;

/**
 * @param probability      likelihood of reaching the goal, 0..1
 * @param confidence       absolute correlation of the underlying trend
 * @param estimatedPeriods periods until completion, null when no forward progress is expected
 */
public record AchievementPrediction(
    String goalId,
    double probability,
    double confidence,
    TrendDirection direction,
    Integer estimatedPeriods,
    List<String> recommendations
) {}
