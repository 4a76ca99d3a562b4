package com.carescore.service.progress;

import com.carescore.model.enums.GoalStatus;
import com.carescore.model.progress.Goal;
import com.carescore.model.progress.Milestone;

import java.util.List;

/**
 * What changed on a goal after its progress was recomputed.
 *
 * @param reachedMilestones milestones reached by this update only
 */
public record GoalProgressUpdate(
    Goal goal,
    List<Milestone> reachedMilestones,
    GoalStatus previousStatus,
    boolean statusChanged
) {}
