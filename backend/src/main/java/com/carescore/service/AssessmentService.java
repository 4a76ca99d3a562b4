package com.carescore.service;

import com.carescore.exception.ValidationException;
import com.carescore.integration.ClinicalEventPublisher;
import com.carescore.integration.EventTypes;
import com.carescore.integration.PublishOptions;
import com.carescore.model.HistoryEntry;
import com.carescore.model.assessment.Assessment;
import com.carescore.model.enums.AssessmentType;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;
import com.carescore.model.enums.TrendPeriod;
import com.carescore.repository.AssessmentRepository;
import com.carescore.resilience.ResilientExecutor;
import com.carescore.resilience.ResultCache;
import com.carescore.resilience.ResultCacheFactory;
import com.carescore.service.analytics.SeriesPoint;
import com.carescore.service.analytics.TimedValue;
import com.carescore.service.analytics.TrendAnalyzer;
import com.carescore.service.analytics.TrendReport;
import com.carescore.service.scoring.AssessmentScoringEngine;
import com.carescore.service.scoring.CategoryRule;
import com.carescore.service.scoring.ScoringTool;
import com.carescore.service.scoring.ToolScore;
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
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Assessment Service
 *
 * Facade for clinical assessments:
 * - create/update always re-score from the category values
 * - every mutation appends a history entry and bumps the version
 * - removal archives, records are never deleted
 * - score trends per tool, grouped by day/week/month
 */
@Slf4j
@Service
public class AssessmentService {

    private static final Set<String> SORTABLE = Set.of("createdAt", "updatedAt", "totalScore");

    private final FacadeBoundary boundary;
    private final ResilientExecutor resilientExecutor;
    private final AssessmentRepository assessmentRepository;
    private final AssessmentScoringEngine scoringEngine;
    private final TrendAnalyzer trendAnalyzer;
    private final RiskAssessmentService riskAssessmentService;
    private final ClinicalEventPublisher eventPublisher;
    private final ResultCache<String, TrendReport> trendCache;
    private final Clock clock;

    public AssessmentService(
            FacadeBoundary boundary,
            ResilientExecutor resilientExecutor,
            AssessmentRepository assessmentRepository,
            AssessmentScoringEngine scoringEngine,
            TrendAnalyzer trendAnalyzer,
            RiskAssessmentService riskAssessmentService,
            ClinicalEventPublisher eventPublisher,
            ResultCacheFactory cacheFactory,
            Clock clock) {
        this.boundary = boundary;
        this.resilientExecutor = resilientExecutor;
        this.assessmentRepository = assessmentRepository;
        this.scoringEngine = scoringEngine;
        this.trendAnalyzer = trendAnalyzer;
        this.riskAssessmentService = riskAssessmentService;
        this.eventPublisher = eventPublisher;
        this.trendCache = cacheFactory.create("assessment-trends");
        this.clock = clock;
    }

    // ========================================================================
    // Scoring
    // ========================================================================

    /**
     * Scores categories without storing anything.
     */
    public ServiceResult<ToolScore> scorePreview(String actor, String toolType, Map<String, Integer> categories) {
        return boundary.execute("scorePreview", actor,
            () -> parseTool(toolType),
            () -> scoringEngine.score(parseTool(toolType), categories));
    }

    // ========================================================================
    // Create / update / archive
    // ========================================================================

    public ServiceResult<Assessment> create(
            String actor,
            String patientId,
            String toolType,
            String assessmentType,
            Map<String, Integer> categories,
            boolean draft) {
        return boundary.execute("createAssessment", actor,
            () -> {
                RecordGuards.requireText(patientId, "patientId");
                checkTypeMatchesTool(parseTool(toolType), assessmentType);
                if (categories == null) {
                    throw ValidationException.required("categories");
                }
            },
            () -> {
                ToolType tool = parseTool(toolType);
                ToolScore score = scoringEngine.score(tool, categories);
                Instant now = clock.instant();

                Assessment assessment = Assessment.builder()
                    .id("asmt-" + UUID.randomUUID().toString().substring(0, 8))
                    .patientId(patientId)
                    .authorId(actor)
                    .assessmentType(tool.getAssessmentType())
                    .toolType(tool)
                    .categories(new LinkedHashMap<>(categories))
                    .status(draft ? RecordStatus.DRAFT : RecordStatus.ACTIVE)
                    .version(0)
                    .createdAt(now)
                    .build();
                applyScore(assessment, score);

                Map<String, Object> diff = new LinkedHashMap<>();
                diff.put("totalScore", score.total());
                diff.put("riskLevel", score.level());
                assessment.appendHistory(history(now, actor, "created", diff));

                Assessment saved = resilientExecutor.callRepository("saveAssessment",
                    () -> assessmentRepository.save(assessment));
                afterChange(saved, EventTypes.ASSESSMENT_CREATED);
                log.info("Created {} assessment {} for patient {}: total {} ({})",
                    tool.getValue(), saved.getId(), saved.getPatientId(), saved.getTotalScore(), saved.getRiskLevel());
                return saved;
            });
    }

    /**
     * Merges the given category values into the assessment and re-scores it. A status of
     * "active" publishes a draft; archiving goes through {@link #archive}.
     */
    public ServiceResult<Assessment> update(
            String actor,
            String id,
            Map<String, Integer> categories,
            String status,
            Long expectedVersion) {
        return boundary.execute("updateAssessment", actor,
            () -> {
                RecordGuards.requireText(id, "id");
                parseEditableStatus(status);
            },
            () -> {
                Assessment assessment = load(id);
                if (assessment.isArchived()) {
                    throw new ValidationException("status", "state", "Archived assessment " + id + " cannot be modified");
                }
                RecordGuards.checkVersion(id, expectedVersion, assessment.getVersion());

                Map<String, Object> diff = new LinkedHashMap<>();
                Map<String, Integer> merged = new LinkedHashMap<>(assessment.getCategories());
                if (categories != null) {
                    categories.forEach((key, value) -> {
                        Integer previous = merged.get(key);
                        if (!Objects.equals(previous, value)) {
                            diff.put(key, change(previous, value));
                            merged.put(key, value);
                        }
                    });
                }

                ToolScore score = scoringEngine.score(assessment.getToolType(), merged);
                if (!Objects.equals(assessment.getTotalScore(), score.total())) {
                    diff.put("totalScore", change(assessment.getTotalScore(), score.total()));
                }
                if (!Objects.equals(assessment.getRiskLevel(), score.level())) {
                    diff.put("riskLevel", change(assessment.getRiskLevel(), score.level()));
                }
                RecordStatus newStatus = parseEditableStatus(status);
                if (newStatus != null && newStatus != assessment.getStatus()) {
                    diff.put("status", change(assessment.getStatus().getValue(), newStatus.getValue()));
                    assessment.setStatus(newStatus);
                }

                assessment.setCategories(merged);
                applyScore(assessment, score);
                assessment.appendHistory(history(clock.instant(), actor, "updated", diff));

                Assessment saved = resilientExecutor.callRepository("saveAssessment",
                    () -> assessmentRepository.save(assessment));
                afterChange(saved, EventTypes.ASSESSMENT_UPDATED);
                log.info("Updated assessment {} to version {}", saved.getId(), saved.getVersion());
                return saved;
            });
    }

    /**
     * Archives an assessment. Archiving an archived assessment returns it unchanged.
     */
    public ServiceResult<Assessment> archive(String actor, String id, Long expectedVersion) {
        return boundary.execute("archiveAssessment", actor,
            () -> RecordGuards.requireText(id, "id"),
            () -> {
                Assessment assessment = load(id);
                if (assessment.isArchived()) {
                    return assessment;
                }
                RecordGuards.checkVersion(id, expectedVersion, assessment.getVersion());
                return archiveRecord(assessment, actor);
            });
    }

    /**
     * Archives every non-archived assessment of a patient, each with its own history entry.
     *
     * @return number of assessments archived
     */
    public ServiceResult<Integer> archiveAllForPatient(String actor, String patientId) {
        return boundary.execute("archivePatientAssessments", actor,
            () -> RecordGuards.requireText(patientId, "patientId"),
            () -> {
                List<Assessment> active = resilientExecutor.callRepository("findActiveAssessments",
                    () -> assessmentRepository.findActiveByPatientId(patientId));
                active.forEach(a -> archiveRecord(a, actor));
                log.info("Archived {} assessment(s) for patient {}", active.size(), patientId);
                return active.size();
            });
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public ServiceResult<Assessment> get(String actor, String id) {
        return boundary.execute("getAssessment", actor,
            () -> RecordGuards.requireText(id, "id"),
            () -> load(id));
    }

    public ServiceResult<Page<Assessment>> list(String actor, String patientId, String status, int page, int limit, String sort) {
        return boundary.execute("listAssessments", actor,
            () -> {
                RecordGuards.requireText(patientId, "patientId");
                parseStatus(status);
                RecordGuards.pageRequest(page, limit, sort, SORTABLE, "createdAt");
            },
            () -> {
                Pageable pageable = RecordGuards.pageRequest(page, limit, sort, SORTABLE, "createdAt");
                RecordStatus filter = parseStatus(status);
                return resilientExecutor.callRepository("findAssessments", () -> filter == null
                    ? assessmentRepository.findByPatientId(patientId, pageable)
                    : assessmentRepository.findByPatientIdAndStatus(patientId, filter, pageable));
            });
    }

    public ServiceResult<List<HistoryEntry>> history(String actor, String id) {
        return boundary.execute("assessmentHistory", actor,
            () -> RecordGuards.requireText(id, "id"),
            () -> List.copyOf(load(id).getHistory()));
    }

    /**
     * Trends of one tool's scores for a patient. Every series is oriented so that rising values
     * mean improvement: the total and, per category, its value (Morse values are flipped).
     */
    public ServiceResult<TrendReport> analyzeTrends(String actor, String patientId, String toolType, String period) {
        return boundary.execute("analyzeAssessmentTrends", actor,
            () -> {
                RecordGuards.requireText(patientId, "patientId");
                parseTool(toolType);
                parsePeriod(period);
            },
            () -> {
                ToolType tool = parseTool(toolType);
                TrendPeriod bucket = parsePeriod(period);
                String cacheKey = patientId + ":" + tool.getValue() + ":" + bucket.getValue();
                Optional<TrendReport> cached = trendCache.get(cacheKey);
                if (cached.isPresent()) {
                    return cached.get();
                }

                List<Assessment> assessments = resilientExecutor.callRepository("findAssessmentSeries",
                    () -> assessmentRepository.findByPatientIdAndToolTypeAndStatusNotOrderByCreatedAtAsc(
                        patientId, tool, RecordStatus.ARCHIVED));
                TrendReport report = trendAnalyzer.analyzeMetrics(buildSeries(tool, assessments, bucket));
                trendCache.put(cacheKey, report);
                return report;
            });
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Map<String, List<SeriesPoint>> buildSeries(ToolType tool, List<Assessment> assessments, TrendPeriod period) {
        ScoringTool scoringTool = scoringEngine.toolFor(tool);
        Map<String, List<TimedValue>> raw = new LinkedHashMap<>();
        String totalMetric = tool.getValue() + ".total";
        raw.put(totalMetric, new ArrayList<>());

        for (Assessment assessment : assessments) {
            if (assessment.getTotalScore() == null) {
                continue;
            }
            Instant at = assessment.getCreatedAt();
            raw.get(totalMetric).add(new TimedValue(at, scoringTool.orientedTotal(assessment.getTotalScore())));
            for (CategoryRule rule : scoringTool.getRules()) {
                Integer value = assessment.getCategories().get(rule.name());
                if (value != null) {
                    raw.computeIfAbsent(tool.getValue() + "." + rule.name(), k -> new ArrayList<>())
                        .add(new TimedValue(at, scoringTool.orientedCategory(rule, value)));
                }
            }
        }

        Map<String, List<SeriesPoint>> series = new LinkedHashMap<>();
        raw.forEach((metric, values) -> series.put(metric, trendAnalyzer.groupByPeriod(values, period)));
        return series;
    }

    private Assessment archiveRecord(Assessment assessment, String actor) {
        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("status", change(assessment.getStatus().getValue(), RecordStatus.ARCHIVED.getValue()));
        assessment.setStatus(RecordStatus.ARCHIVED);
        assessment.appendHistory(history(clock.instant(), actor, "archived", diff));
        Assessment saved = resilientExecutor.callRepository("saveAssessment",
            () -> assessmentRepository.save(assessment));
        afterChange(saved, EventTypes.ASSESSMENT_ARCHIVED);
        return saved;
    }

    private void afterChange(Assessment saved, String eventType) {
        trendCache.invalidateIf(key -> key.startsWith(saved.getPatientId() + ":"));
        riskAssessmentService.invalidatePatient(saved.getPatientId());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("assessmentId", saved.getId());
        payload.put("patientId", saved.getPatientId());
        payload.put("toolType", saved.getToolType().getValue());
        payload.put("totalScore", saved.getTotalScore());
        payload.put("riskLevel", saved.getRiskLevel());
        payload.put("status", saved.getStatus().getValue());
        payload.put("version", saved.getVersion());
        boolean urgent = saved.getStatus() == RecordStatus.ACTIVE
            && saved.getNormalizedRisk() != null
            && saved.getNormalizedRisk().isAtLeast(RiskLevel.HIGH);
        eventPublisher.publish(eventType, payload,
            urgent ? PublishOptions.urgent(saved.getPatientId()) : PublishOptions.forPatient(saved.getPatientId()));
    }

    private Assessment load(String id) {
        return resilientExecutor.callRepository("findAssessment", () -> assessmentRepository.findById(id))
            .orElseThrow(() -> new EntityNotFoundException("Assessment not found: " + id));
    }

    private static void applyScore(Assessment assessment, ToolScore score) {
        assessment.setTotalScore(score.total());
        assessment.setRiskLevel(score.level());
        assessment.setNormalizedRisk(score.riskLevel());
        assessment.setWarnings(new ArrayList<>(score.warnings()));
    }

    private static HistoryEntry history(Instant at, String actor, String action, Map<String, Object> diff) {
        return HistoryEntry.builder()
            .timestamp(at)
            .actor(actor)
            .action(action)
            .diff(diff)
            .build();
    }

    private static Map<String, Object> change(Object from, Object to) {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("from", from);
        change.put("to", to);
        return change;
    }

    static ToolType parseTool(String toolType) {
        if (toolType == null || toolType.isBlank()) {
            throw ValidationException.required("toolType");
        }
        try {
            return ToolType.fromValue(toolType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("toolType", "allowed_values", "Unknown tool type: " + toolType);
        }
    }

    private static void checkTypeMatchesTool(ToolType tool, String assessmentType) {
        if (assessmentType == null || assessmentType.isBlank()) {
            return;
        }
        AssessmentType type;
        try {
            type = AssessmentType.fromValue(assessmentType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("assessmentType", "allowed_values", "Unknown assessment type: " + assessmentType);
        }
        if (type != tool.getAssessmentType()) {
            throw new ValidationException("assessmentType", "tool_mismatch",
                "Tool " + tool.getValue() + " is a " + tool.getAssessmentType().getValue() + " assessment, not " + type.getValue());
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

    private static RecordStatus parseEditableStatus(String status) {
        RecordStatus parsed = parseStatus(status);
        if (parsed == RecordStatus.ARCHIVED) {
            throw new ValidationException("status", "allowed_values", "Use archive to archive an assessment");
        }
        return parsed;
    }

    private static TrendPeriod parsePeriod(String period) {
        try {
            return TrendPeriod.fromValue(period == null || period.isBlank() ? null : period);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("period", "allowed_values", "Unknown period: " + period);
        }
    }
}
