package com.carescore.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a record's append-only audit log.
 * Stored as part of a JSON array; entries are never edited once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntry {

    private Instant timestamp;

    private String actor;

    /**
     * What happened, e.g. "created", "scored", "goal_progress_updated", "archived".
     */
    private String action;

    /**
     * Changed fields as {field: {from, to}} or free-form details for the action.
     */
    @Builder.Default
    private Map<String, Object> diff = new LinkedHashMap<>();

    /**
     * Overall progress right after the change. Only progress records fill this in.
     */
    private Double progressSnapshot;

    /**
     * Record version produced by this entry.
     */
    private long version;
}
