package com.carescore.model.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Snapshot of aggregate goal metrics, recomputed after every change to a progress record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressMetrics {

    private double overallProgress;

    private double goalCompletionRate;

    private double averageGoalProgress;

    private int totalGoals;

    private int activeGoals;

    private int completedGoals;

    private int overdueGoals;

    private int interventionCount;

    private Instant lastUpdated;
}
