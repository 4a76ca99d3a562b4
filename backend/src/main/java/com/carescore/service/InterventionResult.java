package com.carescore.service;

import com.carescore.model.progress.ProgressRecord;
import com.carescore.service.progress.InterventionOutcome;

public record InterventionResult(ProgressRecord record, InterventionOutcome outcome) {}
