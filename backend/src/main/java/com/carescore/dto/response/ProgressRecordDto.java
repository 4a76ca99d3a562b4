package com.carescore.dto.response;

import com.carescore.model.HistoryEntry;
import com.carescore.model.progress.Goal;
import com.carescore.model.progress.Intervention;
import com.carescore.model.progress.ProgressMetrics;

import java.time.Instant;
import java.util.List;

public record ProgressRecordDto(
    String id,
    String patientId,
    String authorId,
    String status,
    long version,
    List<Goal> goals,
    List<Intervention> interventions,
    ProgressMetrics metrics,
    List<HistoryEntry> history,
    Instant createdAt,
    Instant updatedAt
) {}
