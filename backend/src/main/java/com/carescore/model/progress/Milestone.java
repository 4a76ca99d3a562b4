package com.carescore.model.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress threshold on the way to a goal. Once reached it stays reached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    private String description;

    /**
     * Progress percentage (0-100) at which the milestone counts as reached.
     */
    private double threshold;

    private boolean reached;

    private Instant reachedAt;
}
