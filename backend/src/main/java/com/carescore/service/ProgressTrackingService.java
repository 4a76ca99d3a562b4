package com.carescore.service;

import com.carescore.exception.ValidationException;
import com.carescore.integration.ClinicalEventPublisher;
import com.carescore.integration.ClinicalInsights;
import com.carescore.integration.EventTypes;
import com.carescore.integration.InsightGenerator;
import com.carescore.integration.InsightRequest;
import com.carescore.integration.PublishOptions;
import com.carescore.model.HistoryEntry;
import com.carescore.model.enums.GoalStatus;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.progress.Goal;
import com.carescore.model.progress.Intervention;
import com.carescore.model.progress.Milestone;
import com.carescore.model.progress.ProgressRecord;
import com.carescore.repository.ProgressRecordRepository;
import com.carescore.resilience.ResilientExecutor;
import com.carescore.resilience.ResultCache;
import com.carescore.resilience.ResultCacheFactory;
import com.carescore.service.analytics.AchievementPrediction;
import com.carescore.service.analytics.PredictiveModel;
import com.carescore.service.analytics.SeriesPoint;
import com.carescore.service.analytics.TrendAnalyzer;
import com.carescore.service.analytics.TrendReport;
import com.carescore.service.progress.GoalAnalytics;
import com.carescore.service.progress.GoalDraft;
import com.carescore.service.progress.GoalProgressUpdate;
import com.carescore.service.progress.InterventionDraft;
import com.carescore.service.progress.InterventionOutcome;
import com.carescore.service.progress.ProgressAlert;
import com.carescore.service.progress.ProgressGoalTracker;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Progress Tracking Service
 *
 * Facade for goal-directed care progress:
 * - every write recomputes the record metrics and appends a history entry carrying the
 *   overall progress snapshot, which later drives intervention effectiveness
 * - writes accept an optional expected version
 * - analytics are cached per record version
 */
@Slf4j
@Service
public class ProgressTrackingService {

    private static final Set<String> SORTABLE = Set.of("createdAt", "updatedAt");

    private final FacadeBoundary boundary;
    private final ResilientExecutor resilientExecutor;
    private final ProgressRecordRepository progressRecordRepository;
    private final ProgressGoalTracker goalTracker;
    private final TrendAnalyzer trendAnalyzer;
    private final PredictiveModel predictiveModel;
    private final InsightGenerator insightGenerator;
    private final ClinicalEventPublisher eventPublisher;
    private final ResultCache<String, ProgressAnalyticsReport> analyticsCache;
    private final Clock clock;

    public ProgressTrackingService(
            FacadeBoundary boundary,
            ResilientExecutor resilientExecutor,
            ProgressRecordRepository progressRecordRepository,
            ProgressGoalTracker goalTracker,
            TrendAnalyzer trendAnalyzer,
            PredictiveModel predictiveModel,
            InsightGenerator insightGenerator,
            ClinicalEventPublisher eventPublisher,
            ResultCacheFactory cacheFactory,
            Clock clock) {
        this.boundary = boundary;
        this.resilientExecutor = resilientExecutor;
        this.progressRecordRepository = progressRecordRepository;
        this.goalTracker = goalTracker;
        this.trendAnalyzer = trendAnalyzer;
        this.predictiveModel = predictiveModel;
        this.insightGenerator = insightGenerator;
        this.eventPublisher = eventPublisher;
        this.analyticsCache = cacheFactory.create("progress-analytics");
        this.clock = clock;
    }

    // ========================================================================
    // Records
    // ========================================================================

    public ServiceResult<ProgressRecord> createRecord(String actor, String patientId, List<GoalDraft> goals) {
        return boundary.execute("createProgressRecord", actor,
            () -> RecordGuards.requireText(patientId, "patientId"),
            () -> {
                Instant now = clock.instant();
                ProgressRecord record = ProgressRecord.builder()
                    .id("prog-" + UUID.randomUUID().toString().substring(0, 8))
                    .patientId(patientId)
                    .authorId(actor)
                    .status(RecordStatus.ACTIVE)
                    .version(0)
                    .createdAt(now)
                    .build();
                if (goals != null) {
                    for (GoalDraft draft : goals) {
                        record.getGoals().add(goalTracker.createGoal(draft, now));
                    }
                }

                Map<String, Object> diff = new LinkedHashMap<>();
                diff.put("goalCount", record.getGoals().size());
                ProgressRecord saved = saveWithHistory(record, actor, "created", diff, now);
                publish(EventTypes.PROGRESS_CREATED, saved, Map.of("goalCount", saved.getGoals().size()), false);
                log.info("Created progress record {} for patient {} with {} goal(s)",
                    saved.getId(), saved.getPatientId(), saved.getGoals().size());
                return saved;
            });
    }

    public ServiceResult<ProgressRecord> addGoal(String actor, String recordId, GoalDraft draft, Long expectedVersion) {
        return boundary.execute("addGoal", actor,
            () -> RecordGuards.requireText(recordId, "recordId"),
            () -> {
                ProgressRecord record = loadForWrite(recordId, expectedVersion);
                Instant now = clock.instant();
                Goal goal = goalTracker.createGoal(draft, now);
                record.getGoals().add(goal);

                Map<String, Object> diff = new LinkedHashMap<>();
                diff.put("goalId", goal.getId());
                diff.put("description", goal.getDescription());
                ProgressRecord saved = saveWithHistory(record, actor, "goal_added", diff, now);
                log.info("Added goal {} to progress record {}", goal.getId(), saved.getId());
                return saved;
            });
    }

    /**
     * Records a new measurement for one goal.
     */
    public ServiceResult<GoalUpdateResult> updateGoalProgress(
            String actor, String recordId, String goalId, Double currentValue, Long expectedVersion) {
        return boundary.execute("updateGoalProgress", actor,
            () -> {
                RecordGuards.requireText(recordId, "recordId");
                RecordGuards.requireText(goalId, "goalId");
                if (currentValue == null) {
                    throw ValidationException.required("currentValue");
                }
            },
            () -> {
                ProgressRecord record = loadForWrite(recordId, expectedVersion);
                Goal goal = findGoal(record, goalId);
                Instant now = clock.instant();
                double previousProgress = goal.getProgress();
                GoalProgressUpdate update = goalTracker.updateProgress(goal, currentValue, now);
                List<Intervention> reassessed = goalTracker.reassessInterventions(record, goal);

                Map<String, Object> diff = new LinkedHashMap<>();
                diff.put("goalId", goalId);
                diff.put("progress", change(previousProgress, goal.getProgress()));
                if (update.statusChanged()) {
                    diff.put("status", change(update.previousStatus().getValue(), goal.getStatus().getValue()));
                }
                if (!update.reachedMilestones().isEmpty()) {
                    diff.put("milestonesReached", milestoneNames(update.reachedMilestones()));
                }
                if (!reassessed.isEmpty()) {
                    Map<String, Object> effectiveness = new LinkedHashMap<>();
                    reassessed.forEach(i -> effectiveness.put(i.getId(), i.getEffectiveness()));
                    diff.put("interventionEffectiveness", effectiveness);
                }
                ProgressRecord saved = saveWithHistory(record, actor, "goal_progress_updated", diff, now);
                publishGoalUpdate(saved, update);
                log.info("Goal {} of progress record {} at {}% ({})",
                    goalId, saved.getId(), goal.getProgress(), goal.getStatus().getValue());
                return new GoalUpdateResult(saved, update);
            });
    }

    /**
     * Explicit status change by a clinician, e.g. reopening an overdue goal after extending it.
     */
    public ServiceResult<ProgressRecord> resetGoalStatus(
            String actor, String recordId, String goalId, String status, Long expectedVersion) {
        return boundary.execute("resetGoalStatus", actor,
            () -> {
                RecordGuards.requireText(recordId, "recordId");
                RecordGuards.requireText(goalId, "goalId");
                RecordGuards.requireText(status, "status");
                parseGoalStatus(status);
            },
            () -> {
                ProgressRecord record = loadForWrite(recordId, expectedVersion);
                Goal goal = findGoal(record, goalId);
                Instant now = clock.instant();
                GoalStatus previous = goalTracker.resetStatus(goal, parseGoalStatus(status), now);

                Map<String, Object> diff = new LinkedHashMap<>();
                diff.put("goalId", goalId);
                diff.put("status", change(previous.getValue(), goal.getStatus().getValue()));
                ProgressRecord saved = saveWithHistory(record, actor, "goal_status_reset", diff, now);
                publishGoalUpdate(saved, new GoalProgressUpdate(goal, List.of(), previous, previous != goal.getStatus()));
                return saved;
            });
    }

    public ServiceResult<InterventionResult> recordIntervention(
            String actor, String recordId, InterventionDraft draft, Long expectedVersion) {
        return boundary.execute("recordIntervention", actor,
            () -> {
                RecordGuards.requireText(recordId, "recordId");
                if (draft == null) {
                    throw ValidationException.required("intervention");
                }
                RecordGuards.requireText(draft.type(), "type");
            },
            () -> {
                ProgressRecord record = loadForWrite(recordId, expectedVersion);
                Instant now = clock.instant();
                InterventionOutcome outcome = goalTracker.recordIntervention(record, draft, actor, now);

                Map<String, Object> diff = new LinkedHashMap<>();
                diff.put("interventionId", outcome.intervention().getId());
                diff.put("type", outcome.intervention().getType());
                diff.put("goalIds", outcome.intervention().getGoalIds());
                diff.put("effectiveness", outcome.intervention().getEffectiveness());
                if (!outcome.warnings().isEmpty()) {
                    diff.put("warnings", outcome.warnings());
                }
                ProgressRecord saved = saveWithHistory(record, actor, "intervention_recorded", diff, now);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("interventionId", outcome.intervention().getId());
                payload.put("type", outcome.intervention().getType());
                payload.put("impact", outcome.intervention().getImpact());
                publish(EventTypes.PROGRESS_INTERVENTION_RECORDED, saved, payload, false);
                outcome.goalUpdates().forEach(update -> publishGoalUpdate(saved, update));
                log.info("Recorded intervention {} on progress record {} (impact {})",
                    outcome.intervention().getId(), saved.getId(), outcome.intervention().getImpact());
                return new InterventionResult(saved, outcome);
            });
    }

    /**
     * Applies time-based goal transitions. Saves only when something changed.
     */
    public ServiceResult<ProgressRecord> refreshStatuses(String actor, String recordId) {
        return boundary.execute("refreshGoalStatuses", actor,
            () -> RecordGuards.requireText(recordId, "recordId"),
            () -> {
                ProgressRecord record = loadForWrite(recordId, null);
                Instant now = clock.instant();
                List<GoalProgressUpdate> changed = goalTracker.evaluateGoals(record, now);
                if (changed.isEmpty()) {
                    return record;
                }

                Map<String, Object> diff = new LinkedHashMap<>();
                for (GoalProgressUpdate update : changed) {
                    diff.put(update.goal().getId(),
                        change(update.previousStatus().getValue(), update.goal().getStatus().getValue()));
                }
                ProgressRecord saved = saveWithHistory(record, actor, "statuses_refreshed", diff, now);
                changed.forEach(update -> publishGoalUpdate(saved, update));
                return saved;
            });
    }

    public ServiceResult<ProgressRecord> archive(String actor, String recordId, Long expectedVersion) {
        return boundary.execute("archiveProgressRecord", actor,
            () -> RecordGuards.requireText(recordId, "recordId"),
            () -> {
                ProgressRecord record = load(recordId);
                if (record.isArchived()) {
                    return record;
                }
                RecordGuards.checkVersion(recordId, expectedVersion, record.getVersion());
                return archiveRecord(record, actor);
            });
    }

    public ServiceResult<Integer> archiveAllForPatient(String actor, String patientId) {
        return boundary.execute("archivePatientProgress", actor,
            () -> RecordGuards.requireText(patientId, "patientId"),
            () -> {
                List<ProgressRecord> active = resilientExecutor.callRepository("findActiveProgressRecords",
                    () -> progressRecordRepository.findActiveByPatientId(patientId));
                active.forEach(r -> archiveRecord(r, actor));
                log.info("Archived {} progress record(s) for patient {}", active.size(), patientId);
                return active.size();
            });
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public ServiceResult<ProgressRecord> get(String actor, String recordId) {
        return boundary.execute("getProgressRecord", actor,
            () -> RecordGuards.requireText(recordId, "recordId"),
            () -> load(recordId));
    }

    public ServiceResult<Page<ProgressRecord>> list(String actor, String patientId, String status, int page, int limit, String sort) {
        return boundary.execute("listProgressRecords", actor,
            () -> {
                RecordGuards.requireText(patientId, "patientId");
                parseStatus(status);
                RecordGuards.pageRequest(page, limit, sort, SORTABLE, "createdAt");
            },
            () -> {
                Pageable pageable = RecordGuards.pageRequest(page, limit, sort, SORTABLE, "createdAt");
                RecordStatus filter = parseStatus(status);
                return resilientExecutor.callRepository("findProgressRecords", () -> filter == null
                    ? progressRecordRepository.findByPatientId(patientId, pageable)
                    : progressRecordRepository.findByPatientIdAndStatus(patientId, filter, pageable));
            });
    }

    public ServiceResult<List<HistoryEntry>> history(String actor, String recordId) {
        return boundary.execute("progressHistory", actor,
            () -> RecordGuards.requireText(recordId, "recordId"),
            () -> List.copyOf(load(recordId).getHistory()));
    }

    /**
     * Metrics, per-goal analytics, alerts, achievement predictions and progress trends.
     * Insights are added when the generator answers in time.
     */
    public ServiceResult<ProgressAnalyticsReport> analytics(String actor, String recordId) {
        return boundary.execute("progressAnalytics", actor,
            () -> RecordGuards.requireText(recordId, "recordId"),
            () -> {
                ProgressRecord record = load(recordId);
                String cacheKey = "record:" + record.getId() + ":v" + record.getVersion();
                Optional<ProgressAnalyticsReport> cached = analyticsCache.get(cacheKey);
                if (cached.isPresent()) {
                    return cached.get();
                }
                ProgressAnalyticsReport report = buildAnalytics(record);
                analyticsCache.put(cacheKey, report);
                return report;
            });
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private ProgressAnalyticsReport buildAnalytics(ProgressRecord record) {
        Instant now = clock.instant();
        List<GoalAnalytics> goals = goalTracker.goalAnalytics(record, now);
        List<ProgressAlert> alerts = goalTracker.progressAlerts(record, now);

        Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
        List<AchievementPrediction> predictions = new ArrayList<>();
        for (Goal goal : record.getGoals()) {
            List<SeriesPoint> progress = predictiveModel.progressSeries(goal);
            series.put("goal:" + goal.getId(), progress);
            predictions.add(predictiveModel.predictGoalAchievement(progress, goal));
        }
        TrendReport trends = trendAnalyzer.analyzeMetrics(series);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("overallProgress", record.getMetrics().getOverallProgress());
        data.put("goalCompletionRate", record.getMetrics().getGoalCompletionRate());
        data.put("overallDirection", trends.overallDirection().getValue());
        data.put("alertCount", alerts.size());
        ClinicalInsights insights = resilientExecutor
            .callInsights(() -> insightGenerator.generateInsights(new InsightRequest("progress", record.getPatientId(), data)))
            .orElse(ClinicalInsights.empty());

        return new ProgressAnalyticsReport(
            record.getId(),
            record.getPatientId(),
            record.getVersion(),
            goalTracker.calculateMetrics(record, now),
            goals,
            alerts,
            predictions,
            trends,
            insights,
            now);
    }

    private ProgressRecord saveWithHistory(ProgressRecord record, String actor, String action, Map<String, Object> diff, Instant now) {
        record.setMetrics(goalTracker.calculateMetrics(record, now));
        record.appendHistory(HistoryEntry.builder()
            .timestamp(now)
            .actor(actor)
            .action(action)
            .diff(diff)
            .progressSnapshot(record.getMetrics().getOverallProgress())
            .build());
        return resilientExecutor.callRepository("saveProgressRecord", () -> progressRecordRepository.save(record));
    }

    private ProgressRecord archiveRecord(ProgressRecord record, String actor) {
        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("status", change(record.getStatus().getValue(), RecordStatus.ARCHIVED.getValue()));
        record.setStatus(RecordStatus.ARCHIVED);
        ProgressRecord saved = saveWithHistory(record, actor, "archived", diff, clock.instant());
        publish(EventTypes.PROGRESS_ARCHIVED, saved, Map.of(), false);
        return saved;
    }

    private void publishGoalUpdate(ProgressRecord record, GoalProgressUpdate update) {
        Goal goal = update.goal();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("goalId", goal.getId());
        payload.put("progress", goal.getProgress());
        payload.put("status", goal.getStatus().getValue());
        payload.put("statusChanged", update.statusChanged());
        publish(EventTypes.PROGRESS_GOAL_UPDATED, record, payload, goal.getStatus() == GoalStatus.OVERDUE);

        for (Milestone milestone : update.reachedMilestones()) {
            Map<String, Object> reached = new LinkedHashMap<>();
            reached.put("goalId", goal.getId());
            reached.put("milestone", milestone.getDescription());
            reached.put("threshold", milestone.getThreshold());
            publish(EventTypes.PROGRESS_MILESTONE_REACHED, record, reached, false);
        }
    }

    private void publish(String eventType, ProgressRecord record, Map<String, Object> details, boolean urgent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recordId", record.getId());
        payload.put("patientId", record.getPatientId());
        payload.put("version", record.getVersion());
        payload.putAll(details);
        eventPublisher.publish(eventType, payload,
            urgent ? PublishOptions.urgent(record.getPatientId()) : PublishOptions.forPatient(record.getPatientId()));
    }

    private ProgressRecord loadForWrite(String recordId, Long expectedVersion) {
        ProgressRecord record = load(recordId);
        if (record.isArchived()) {
            throw new ValidationException("status", "state", "Archived progress record " + recordId + " cannot be modified");
        }
        RecordGuards.checkVersion(recordId, expectedVersion, record.getVersion());
        return record;
    }

    private ProgressRecord load(String recordId) {
        return resilientExecutor.callRepository("findProgressRecord", () -> progressRecordRepository.findById(recordId))
            .orElseThrow(() -> new EntityNotFoundException("Progress record not found: " + recordId));
    }

    private static Goal findGoal(ProgressRecord record, String goalId) {
        return record.findGoal(goalId)
            .orElseThrow(() -> new EntityNotFoundException("Goal " + goalId + " not found in progress record " + record.getId()));
    }

    private static List<String> milestoneNames(List<Milestone> milestones) {
        return milestones.stream().map(Milestone::getDescription).toList();
    }

    private static Map<String, Object> change(Object from, Object to) {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("from", from);
        change.put("to", to);
        return change;
    }

    private static GoalStatus parseGoalStatus(String status) {
        try {
            return GoalStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("status", "allowed_values", "Unknown goal status: " + status);
        }
    }

    private static RecordStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return RecordStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("status", "allowed_values", "Unknown status: " + status);
        }
    }
}
