package com.carescore.service;

import com.carescore.integration.ClinicalEventPublisher;
import com.carescore.integration.ClinicalInsights;
import com.carescore.integration.EventTypes;
import com.carescore.integration.InsightGenerator;
import com.carescore.integration.InsightRequest;
import com.carescore.integration.PublishOptions;
import com.carescore.model.assessment.Assessment;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.enums.RiskType;
import com.carescore.model.enums.ToolType;
import com.carescore.repository.AssessmentRepository;
import com.carescore.resilience.ResilientExecutor;
import com.carescore.resilience.ResultCache;
import com.carescore.resilience.ResultCacheFactory;
import com.carescore.service.risk.RiskAggregation;
import com.carescore.service.risk.RiskAlert;
import com.carescore.service.risk.RiskAssessmentAggregator;
import com.carescore.service.risk.RiskScore;
import com.carescore.service.scoring.AssessmentScoringEngine;
import com.carescore.service.scoring.RiskScoreMapper;
import com.carescore.service.scoring.ToolScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Risk Assessment Service
 *
 * Builds a patient's overall risk from their latest active assessment per tool, optionally
 * combined with risk scores computed elsewhere (infection, medication, readmission).
 * Results without external input are cached per patient until an assessment changes.
 */
@Slf4j
@Service
public class RiskAssessmentService {

    private final FacadeBoundary boundary;
    private final ResilientExecutor resilientExecutor;
    private final AssessmentRepository assessmentRepository;
    private final AssessmentScoringEngine scoringEngine;
    private final RiskScoreMapper riskScoreMapper;
    private final RiskAssessmentAggregator aggregator;
    private final InsightGenerator insightGenerator;
    private final ClinicalEventPublisher eventPublisher;
    private final ResultCache<String, RiskAssessmentReport> reportCache;
    private final Clock clock;

    public RiskAssessmentService(
            FacadeBoundary boundary,
            ResilientExecutor resilientExecutor,
            AssessmentRepository assessmentRepository,
            AssessmentScoringEngine scoringEngine,
            RiskScoreMapper riskScoreMapper,
            RiskAssessmentAggregator aggregator,
            InsightGenerator insightGenerator,
            ClinicalEventPublisher eventPublisher,
            ResultCacheFactory cacheFactory,
            Clock clock) {
        this.boundary = boundary;
        this.resilientExecutor = resilientExecutor;
        this.assessmentRepository = assessmentRepository;
        this.scoringEngine = scoringEngine;
        this.riskScoreMapper = riskScoreMapper;
        this.aggregator = aggregator;
        this.insightGenerator = insightGenerator;
        this.eventPublisher = eventPublisher;
        this.reportCache = cacheFactory.create("risk-reports");
        this.clock = clock;
    }

    // ========================================================================
    // Facade operations
    // ========================================================================

    /**
     * Overall risk for a patient. External scores fill in risk types that no assessment covers.
     */
    public ServiceResult<RiskAssessmentReport> assessPatientRisk(
            String actor, String patientId, Map<RiskType, RiskScore> externalScores) {
        return boundary.execute("assessPatientRisk", actor,
            () -> RecordGuards.requireText(patientId, "patientId"),
            () -> buildReport(patientId, externalScores));
    }

    /**
     * Aggregates caller-supplied scores without touching stored assessments.
     */
    public ServiceResult<RiskAggregation> aggregate(String actor, Map<RiskType, RiskScore> scores) {
        return boundary.execute("aggregateRisk", actor, null, () -> aggregator.aggregate(scores));
    }

    public void invalidatePatient(String patientId) {
        reportCache.invalidate(patientId);
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private RiskAssessmentReport buildReport(String patientId, Map<RiskType, RiskScore> externalScores) {
        boolean cacheable = externalScores == null || externalScores.isEmpty();
        if (cacheable) {
            Optional<RiskAssessmentReport> cached = reportCache.get(patientId);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        List<Assessment> assessments = resilientExecutor.callRepository("findActiveAssessments",
            () -> assessmentRepository.findActiveByPatientId(patientId));

        Map<RiskType, RiskScore> scores = new EnumMap<>(RiskType.class);
        List<String> sourceIds = new ArrayList<>();
        for (Assessment latest : latestActivePerTool(assessments).values()) {
            ToolScore toolScore = scoringEngine.score(latest.getToolType(), latest.getCategories());
            scores.put(latest.getToolType().getRiskType(), riskScoreMapper.toRiskScore(toolScore));
            sourceIds.add(latest.getId());
        }
        if (externalScores != null) {
            externalScores.forEach((type, score) -> {
                if (type != null && score != null) {
                    scores.putIfAbsent(type, score);
                }
            });
        }

        RiskAggregation aggregation = aggregator.aggregate(scores);
        ClinicalInsights insights = resilientExecutor
            .callInsights(() -> insightGenerator.generateInsights(insightRequest(patientId, aggregation)))
            .orElse(ClinicalInsights.empty());

        RiskAssessmentReport report = new RiskAssessmentReport(
            patientId, aggregation, insights, sourceIds, clock.instant());

        for (RiskAlert alert : aggregation.alerts()) {
            eventPublisher.publish(EventTypes.RISK_ALERT, alertPayload(patientId, alert), PublishOptions.urgent(patientId));
        }
        if (cacheable) {
            reportCache.put(patientId, report);
        }
        log.info("Risk assessed for patient {}: overall {} with {} alert(s)",
            patientId, aggregation.overallLevel().getValue(), aggregation.alerts().size());
        return report;
    }

    private Map<ToolType, Assessment> latestActivePerTool(List<Assessment> assessments) {
        Map<ToolType, Assessment> latest = new EnumMap<>(ToolType.class);
        assessments.stream()
            .filter(a -> a.getStatus() == RecordStatus.ACTIVE)
            .sorted(Comparator.comparing(Assessment::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
            .forEach(a -> latest.put(a.getToolType(), a));
        return latest;
    }

    private InsightRequest insightRequest(String patientId, RiskAggregation aggregation) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("overallLevel", aggregation.overallLevel().getValue());
        data.put("averageScore", aggregation.averageScore());
        data.put("highestRiskAreas", aggregation.highestRiskAreas().stream().map(RiskType::getValue).toList());
        data.put("alertCount", aggregation.alerts().size());
        return new InsightRequest("risk", patientId, data);
    }

    private Map<String, Object> alertPayload(String patientId, RiskAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("patientId", patientId);
        payload.put("riskType", alert.riskType().getValue());
        payload.put("level", alert.level().getValue());
        payload.put("score", alert.score());
        payload.put("immediateAction", alert.immediateAction());
        return payload;
    }
}
