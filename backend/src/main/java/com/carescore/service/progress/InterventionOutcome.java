package com.carescore.service.progress;

import com.carescore.model.progress.Intervention;

import java.util.List;

public record InterventionOutcome(
    Intervention intervention,
    List<GoalProgressUpdate> goalUpdates,
    List<String> warnings
) {}
