package com.carescore.service;

import com.carescore.integration.ClinicalInsights;
import com.carescore.model.progress.ProgressMetrics;
import com.carescore.service.analytics.AchievementPrediction;
import com.carescore.service.analytics.TrendReport;
import com.carescore.service.progress.GoalAnalytics;
import com.carescore.service.progress.ProgressAlert;

import java.time.Instant;
import java.util.List;

/**
 * Read-only analytics over one progress record at one version.
 *
 * @param trends progress trend per goal, keyed "goal:&lt;goalId&gt;"
 */
public record ProgressAnalyticsReport(
    String recordId,
    String patientId,
    long version,
    ProgressMetrics metrics,
    List<GoalAnalytics> goals,
    List<ProgressAlert> alerts,
    List<AchievementPrediction> predictions,
    TrendReport trends,
    ClinicalInsights insights,
    Instant generatedAt
) {}
