package com.carescore.model.progress;

import com.carescore.model.enums.GoalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SMART goal tracked inside a progress record.
 * <p>
 * {@code progress} is derived from {@code currentValue / targetValue} and is kept in [0, 100].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Goal {

    private String id;

    private String description;

    private String category;

    private String priority;

    // SMART criteria
    private String specific;

    private String measurable;

    private boolean achievable;

    private boolean relevant;

    private Instant timeBound;

    private double targetValue;

    private double currentValue;

    private String unit;

    private double progress;

    @Builder.Default
    private GoalStatus status = GoalStatus.ACTIVE;

    private Instant createdAt;

    private Instant completedAt;

    @Builder.Default
    private List<Milestone> milestones = new ArrayList<>();

    @Builder.Default
    private List<String> interventionIds = new ArrayList<>();

    /**
     * Measurements in the order they were recorded.
     */
    @Builder.Default
    private List<ProgressObservation> observations = new ArrayList<>();
}
