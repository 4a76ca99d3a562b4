package com.carescore.service.progress;

import com.carescore.config.CareScoreProperties;
import com.carescore.exception.ValidationException;
import com.carescore.model.HistoryEntry;
import com.carescore.model.enums.GoalStatus;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.progress.Goal;
import com.carescore.model.progress.Intervention;
import com.carescore.model.progress.Milestone;
import com.carescore.model.progress.ProgressMetrics;
import com.carescore.model.progress.ProgressObservation;
import com.carescore.model.progress.ProgressRecord;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Progress Goal Tracker
 *
 * Goal lifecycle for progress records:
 * - ACTIVE -> COMPLETED when progress reaches 100 (checked first)
 * - ACTIVE -> OVERDUE when now is past the time bound
 * - no automatic way back; {@link #resetStatus} is the explicit human action
 *
 * Milestones are reached once and stay reached. The tracker mutates the goal and record
 * objects it is given; persisting them and writing history is up to the caller.
 */
@Service
public class ProgressGoalTracker {

    private final CareScoreProperties.Progress settings;

    public ProgressGoalTracker(CareScoreProperties properties) {
        this.settings = properties.getProgress();
    }

    // ========================================================================
    // Goals
    // ========================================================================

    public Goal createGoal(GoalDraft draft, Instant now) {
        if (draft == null || draft.description() == null || draft.description().isBlank()) {
            throw ValidationException.required("description");
        }
        if (draft.targetValue() == null) {
            throw ValidationException.required("targetValue");
        }
        if (!Double.isFinite(draft.targetValue()) || draft.targetValue() <= 0) {
            throw new ValidationException("targetValue", "range", "targetValue must be greater than 0");
        }
        double current = draft.currentValue() == null ? 0.0 : draft.currentValue();
        requireFinite("currentValue", current);

        List<Milestone> milestones = new ArrayList<>();
        if (draft.milestones() != null) {
            for (MilestoneDraft m : draft.milestones()) {
                if (m.threshold() < 0 || m.threshold() > 100) {
                    throw new ValidationException("milestones", "range", "Milestone threshold must be between 0 and 100");
                }
                milestones.add(Milestone.builder()
                    .description(m.description())
                    .threshold(m.threshold())
                    .build());
            }
        }
        milestones.sort(Comparator.comparingDouble(Milestone::getThreshold));

        Goal goal = Goal.builder()
            .id("goal-" + UUID.randomUUID().toString().substring(0, 8))
            .description(draft.description())
            .category(draft.category())
            .priority(draft.priority() == null ? "medium" : draft.priority())
            .specific(isBlank(draft.specific()) ? draft.description() : draft.specific())
            .measurable(isBlank(draft.measurable()) ? describeMeasure(draft.targetValue(), draft.unit()) : draft.measurable())
            .achievable(draft.achievable() == null || draft.achievable())
            .relevant(draft.relevant() == null || draft.relevant())
            .timeBound(draft.timeBound() != null ? draft.timeBound() : now.plus(Duration.ofDays(settings.getDefaultTimeBoundDays())))
            .targetValue(draft.targetValue())
            .currentValue(current)
            .unit(draft.unit())
            .status(GoalStatus.ACTIVE)
            .createdAt(now)
            .milestones(milestones)
            .build();

        goal.setProgress(computeProgress(current, goal.getTargetValue()));
        goal.getObservations().add(new ProgressObservation(now, current, goal.getProgress()));
        checkMilestones(goal, now);
        evaluateStatus(goal, now);
        return goal;
    }

    /**
     * Records a new measurement and recomputes progress, milestones and status.
     */
    public GoalProgressUpdate updateProgress(Goal goal, double currentValue, Instant now) {
        requireFinite("currentValue", currentValue);
        goal.setCurrentValue(currentValue);
        goal.setProgress(computeProgress(currentValue, goal.getTargetValue()));
        goal.getObservations().add(new ProgressObservation(now, currentValue, goal.getProgress()));
        return evaluate(goal, now);
    }

    /**
     * Recomputes progress from the stored current value without recording a measurement.
     */
    public GoalProgressUpdate recompute(Goal goal, Instant now) {
        goal.setProgress(computeProgress(goal.getCurrentValue(), goal.getTargetValue()));
        return evaluate(goal, now);
    }

    /**
     * Applies time-based transitions to every goal of the record.
     */
    public List<GoalProgressUpdate> evaluateGoals(ProgressRecord record, Instant now) {
        List<GoalProgressUpdate> changed = new ArrayList<>();
        for (Goal goal : record.getGoals()) {
            GoalProgressUpdate update = recompute(goal, now);
            if (update.statusChanged() || !update.reachedMilestones().isEmpty()) {
                changed.add(update);
            }
        }
        return changed;
    }

    public static double computeProgress(double currentValue, double targetValue) {
        if (targetValue <= 0 || !Double.isFinite(currentValue)) {
            return 0.0;
        }
        double raw = currentValue / targetValue * 100.0;
        return Math.max(0.0, Math.min(100.0, raw));
    }

    /**
     * Only ACTIVE goals move. Completion wins over lateness.
     *
     * @return true when the status changed
     */
    public boolean evaluateStatus(Goal goal, Instant now) {
        if (goal.getStatus() != GoalStatus.ACTIVE) {
            return false;
        }
        if (goal.getProgress() >= 100.0) {
            goal.setStatus(GoalStatus.COMPLETED);
            goal.setCompletedAt(now);
            return true;
        }
        if (goal.getTimeBound() != null && now.isAfter(goal.getTimeBound())) {
            goal.setStatus(GoalStatus.OVERDUE);
            return true;
        }
        return false;
    }

    /**
     * Marks milestones reached the first time progress meets their threshold.
     *
     * @return milestones reached by this call
     */
    public List<Milestone> checkMilestones(Goal goal, Instant now) {
        List<Milestone> reached = new ArrayList<>();
        for (Milestone milestone : goal.getMilestones()) {
            if (!milestone.isReached() && goal.getProgress() >= milestone.getThreshold()) {
                milestone.setReached(true);
                milestone.setReachedAt(now);
                reached.add(milestone);
            }
        }
        return reached;
    }

    /**
     * Explicit status change by a clinician, the only way a goal leaves COMPLETED or OVERDUE.
     */
    public GoalStatus resetStatus(Goal goal, GoalStatus status, Instant now) {
        if (status == null) {
            throw ValidationException.required("status");
        }
        GoalStatus previous = goal.getStatus();
        goal.setStatus(status);
        if (status == GoalStatus.COMPLETED) {
            goal.setCompletedAt(now);
        } else {
            goal.setCompletedAt(null);
        }
        return previous;
    }

    private GoalProgressUpdate evaluate(Goal goal, Instant now) {
        GoalStatus previous = goal.getStatus();
        List<Milestone> reached = checkMilestones(goal, now);
        boolean changed = evaluateStatus(goal, now);
        return new GoalProgressUpdate(goal, reached, previous, changed);
    }

    // ========================================================================
    // Interventions
    // ========================================================================

    /**
     * Appends an intervention, links it to the goals it names, recomputes those goals and the
     * record metrics, and estimates effectiveness when none was supplied.
     */
    public InterventionOutcome recordIntervention(ProgressRecord record, InterventionDraft draft, String actor, Instant now) {
        if (draft == null || isBlank(draft.type())) {
            throw ValidationException.required("type");
        }
        Double supplied = draft.effectiveness();
        if (supplied != null && (!Double.isFinite(supplied) || supplied < 0 || supplied > 100)) {
            throw new ValidationException("effectiveness", "range", "effectiveness must be between 0 and 100");
        }

        Intervention intervention = Intervention.builder()
            .id("INT-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT))
            .type(draft.type())
            .description(draft.description())
            .recordedAt(now)
            .recordedBy(actor)
            .build();
        record.getInterventions().add(intervention);

        List<String> warnings = new ArrayList<>();
        List<GoalProgressUpdate> updates = new ArrayList<>();
        if (draft.goalIds() != null) {
            for (String goalId : draft.goalIds()) {
                Goal goal = record.findGoal(goalId).orElse(null);
                if (goal == null) {
                    warnings.add("Unknown goal '" + goalId + "' not linked");
                    continue;
                }
                if (!goal.getInterventionIds().contains(intervention.getId())) {
                    goal.getInterventionIds().add(intervention.getId());
                }
                if (!intervention.getGoalIds().contains(goalId)) {
                    intervention.getGoalIds().add(goalId);
                }
                updates.add(recompute(goal, now));
            }
        }

        ProgressMetrics metrics = calculateMetrics(record, now);
        record.setMetrics(metrics);

        Double effectiveness = supplied != null
            ? supplied
            : estimateEffectiveness(record.getHistory(), now, metrics.getOverallProgress());
        intervention.setEffectiveness(effectiveness);
        intervention.setImpact(impactOf(effectiveness));
        intervention.setEffectivenessEstimated(supplied == null);

        return new InterventionOutcome(intervention, updates, warnings);
    }

    /**
     * Revises the estimated effectiveness of every intervention linked to the goal, comparing the
     * last observation before each intervention with the latest one after it. Supplied
     * effectiveness values are left alone.
     *
     * @return interventions whose effectiveness changed
     */
    public List<Intervention> reassessInterventions(ProgressRecord record, Goal goal) {
        List<Intervention> changed = new ArrayList<>();
        for (Intervention intervention : record.getInterventions()) {
            if (!intervention.isEffectivenessEstimated()
                    || intervention.getRecordedAt() == null
                    || !intervention.getGoalIds().contains(goal.getId())) {
                continue;
            }
            Double estimate = estimateFromObservations(record, intervention);
            if (estimate == null || estimate.equals(intervention.getEffectiveness())) {
                continue;
            }
            intervention.setEffectiveness(estimate);
            intervention.setImpact(impactOf(estimate));
            changed.add(intervention);
        }
        return changed;
    }

    /**
     * {@code clamp(50 + mean progress change, 0, 100)} over the linked goals that have an
     * observation on both sides of the intervention. Null when none has.
     */
    static Double estimateFromObservations(ProgressRecord record, Intervention intervention) {
        Instant at = intervention.getRecordedAt();
        double deltaSum = 0;
        int goals = 0;
        for (String goalId : intervention.getGoalIds()) {
            Goal goal = record.findGoal(goalId).orElse(null);
            if (goal == null) {
                continue;
            }
            ProgressObservation before = null;
            ProgressObservation after = null;
            for (ProgressObservation observation : goal.getObservations()) {
                if (observation.getTimestamp() == null) {
                    continue;
                }
                if (observation.getTimestamp().isBefore(at)) {
                    before = observation;
                } else if (observation.getTimestamp().isAfter(at)) {
                    after = observation;
                }
            }
            if (before != null && after != null) {
                deltaSum += after.getProgress() - before.getProgress();
                goals++;
            }
        }
        if (goals == 0) {
            return null;
        }
        double score = 50.0 + deltaSum / goals;
        return round1(Math.max(0.0, Math.min(100.0, score)));
    }

    /**
     * {@code clamp(50 + (after - before), 0, 100)} where before is the last progress snapshot
     * recorded strictly before the intervention. Null when there is no such snapshot.
     */
    public static Double estimateEffectiveness(List<HistoryEntry> history, Instant interventionTime, double progressAfter) {
        Double before = null;
        for (HistoryEntry entry : history) {
            if (entry.getProgressSnapshot() != null
                    && entry.getTimestamp() != null
                    && entry.getTimestamp().isBefore(interventionTime)) {
                before = entry.getProgressSnapshot();
            }
        }
        if (before == null) {
            return null;
        }
        double score = 50.0 + (progressAfter - before);
        return round1(Math.max(0.0, Math.min(100.0, score)));
    }

    public static String impactOf(Double effectiveness) {
        if (effectiveness == null) return "unknown";
        if (effectiveness > 70) return "high";
        if (effectiveness > 40) return "moderate";
        return "low";
    }

    // ========================================================================
    // Metrics & analytics
    // ========================================================================

    public ProgressMetrics calculateMetrics(ProgressRecord record, Instant now) {
        List<Goal> goals = record.getGoals();
        int total = goals.size();
        int active = 0;
        int completed = 0;
        int overdue = 0;
        double progressSum = 0;
        for (Goal goal : goals) {
            switch (goal.getStatus()) {
                case ACTIVE -> active++;
                case COMPLETED -> completed++;
                case OVERDUE -> overdue++;
            }
            progressSum += goal.getProgress();
        }
        double average = total == 0 ? 0.0 : round1(progressSum / total);

        return ProgressMetrics.builder()
            .overallProgress(average)
            .averageGoalProgress(average)
            .goalCompletionRate(total == 0 ? 0.0 : round1(completed * 100.0 / total))
            .totalGoals(total)
            .activeGoals(active)
            .completedGoals(completed)
            .overdueGoals(overdue)
            .interventionCount(record.getInterventions().size())
            .lastUpdated(now)
            .build();
    }

    public List<GoalAnalytics> goalAnalytics(ProgressRecord record, Instant now) {
        List<GoalAnalytics> result = new ArrayList<>();
        for (Goal goal : record.getGoals()) {
            Double expected = expectedProgress(goal, now);
            boolean onTrack = switch (goal.getStatus()) {
                case COMPLETED -> true;
                case OVERDUE -> false;
                case ACTIVE -> expected == null || goal.getProgress() >= expected * settings.getOnTrackRatio();
            };
            result.add(new GoalAnalytics(
                goal.getId(),
                goal.getDescription(),
                goal.getProgress(),
                goal.getStatus(),
                daysRemaining(goal, now),
                goal.getInterventionIds().size(),
                onTrack,
                goalRisk(goal, onTrack, expected)
            ));
        }
        return result;
    }

    public List<ProgressAlert> progressAlerts(ProgressRecord record, Instant now) {
        List<ProgressAlert> alerts = new ArrayList<>();
        Instant stallCutoff = now.minus(Duration.ofDays(settings.getStallWindowDays()));
        for (Goal goal : record.getGoals()) {
            boolean pastDue = goal.getTimeBound() != null && now.isAfter(goal.getTimeBound());
            if (goal.getStatus() == GoalStatus.OVERDUE || (goal.getStatus() == GoalStatus.ACTIVE && pastDue)) {
                alerts.add(new ProgressAlert(ProgressAlert.GOAL_OVERDUE, "high", goal.getId(),
                    "Goal '" + goal.getDescription() + "' is past its time bound at " + round1(goal.getProgress()) + "% progress"));
                continue;
            }
            if (goal.getStatus() == GoalStatus.ACTIVE) {
                Instant lastActivity = lastActivity(goal);
                if (lastActivity != null && lastActivity.isBefore(stallCutoff)) {
                    alerts.add(new ProgressAlert(ProgressAlert.PROGRESS_STALLED, "medium", goal.getId(),
                        "No progress recorded for goal '" + goal.getDescription() + "' in "
                            + settings.getStallWindowDays() + " days"));
                }
            }
        }
        return alerts;
    }

    /**
     * Whole days left until the time bound, rounded up; negative once past it.
     */
    private static Long daysRemaining(Goal goal, Instant now) {
        if (goal.getTimeBound() == null) {
            return null;
        }
        long millis = Duration.between(now, goal.getTimeBound()).toMillis();
        return (long) Math.ceil(millis / (double) Duration.ofDays(1).toMillis());
    }

    /**
     * Progress a goal should have by now if it advanced evenly over its lifetime.
     */
    private Double expectedProgress(Goal goal, Instant now) {
        if (goal.getCreatedAt() == null || goal.getTimeBound() == null) {
            return null;
        }
        long lifetime = Duration.between(goal.getCreatedAt(), goal.getTimeBound()).toMillis();
        if (lifetime <= 0) {
            return null;
        }
        long elapsed = Duration.between(goal.getCreatedAt(), now).toMillis();
        return Math.max(0.0, Math.min(100.0, elapsed * 100.0 / lifetime));
    }

    private RiskLevel goalRisk(Goal goal, boolean onTrack, Double expected) {
        return switch (goal.getStatus()) {
            case COMPLETED -> RiskLevel.LOW;
            case OVERDUE -> RiskLevel.HIGH;
            case ACTIVE -> {
                if (onTrack) yield RiskLevel.LOW;
                yield expected != null && goal.getProgress() < expected * 0.5 ? RiskLevel.HIGH : RiskLevel.MEDIUM;
            }
        };
    }

    private Instant lastActivity(Goal goal) {
        List<ProgressObservation> observations = goal.getObservations();
        if (!observations.isEmpty()) {
            return observations.get(observations.size() - 1).getTimestamp();
        }
        return goal.getCreatedAt();
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(field, "range", field + " must be a finite number");
        }
    }

    private static String describeMeasure(double target, String unit) {
        String amount = target == Math.rint(target) ? String.valueOf((long) target) : String.valueOf(target);
        return unit == null || unit.isBlank() ? "Reach " + amount : "Reach " + amount + " " + unit;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
