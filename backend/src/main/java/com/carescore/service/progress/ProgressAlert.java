package com.carescore.service.progress;

public record ProgressAlert(
    String type,
    String severity,
    String goalId,
    String message
) {

    public static final String GOAL_OVERDUE = "goal_overdue";
    public static final String PROGRESS_STALLED = "progress_stalled";
}
