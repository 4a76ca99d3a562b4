package com.carescore.service;

import com.carescore.model.progress.ProgressRecord;
import com.carescore.service.progress.GoalProgressUpdate;

/**
 * Saved record plus what changed on the updated goal.
 */
public record GoalUpdateResult(ProgressRecord record, GoalProgressUpdate update) {}
