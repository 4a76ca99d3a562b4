package com.carescore.service.progress;

import com.carescore.model.enums.GoalStatus;
import com.carescore.model.enums.RiskLevel;

/**
 * @param daysRemaining whole days until the time bound, negative once past it, null without one
 */
public record GoalAnalytics(
    String goalId,
    String description,
    double progress,
    GoalStatus status,
    Long daysRemaining,
    int interventionCount,
    boolean onTrack,
    RiskLevel riskLevel
) {}
