package com.carescore.dto.response;

import java.util.List;

/**
 * Response DTO for a goal progress update.
 */
public record GoalUpdateDto(
    ProgressRecordDto record,
    String goalId,
    double progress,
    String status,
    boolean statusChanged,
    List<String> reachedMilestones
) {}
