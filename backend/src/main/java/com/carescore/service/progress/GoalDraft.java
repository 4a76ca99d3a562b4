package com.carescore.service.progress;

import java.time.Instant;
import java.util.List;

/**
 * Caller input for a new goal. Optional fields are filled with SMART defaults.
 */
public record GoalDraft(
    String description,
    String category,
    String priority,
    String specific,
    String measurable,
    Boolean achievable,
    Boolean relevant,
    Instant timeBound,
    Double targetValue,
    Double currentValue,
    String unit,
    List<MilestoneDraft> milestones
) {}
