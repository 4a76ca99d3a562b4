package com.carescore.model.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A care intervention applied to a patient and linked to the goals it targets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Intervention {

    private String id;

    private String type;

    private String description;

    /**
     * Effectiveness in [0, 100]; null when it could not be estimated.
     */
    private Double effectiveness;

    /**
     * high / moderate / low / unknown, derived from effectiveness.
     */
    private String impact;

    /**
     * True when effectiveness was estimated from recorded progress rather than supplied.
     * Estimated values are revised as new measurements arrive.
     */
    private boolean effectivenessEstimated;

    @Builder.Default
    private List<String> goalIds = new ArrayList<>();

    private Instant recordedAt;

    private String recordedBy;
}
