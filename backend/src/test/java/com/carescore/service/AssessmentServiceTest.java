package com.carescore.service;

import com.carescore.config.CareScoreProperties;
import com.carescore.exception.StaleVersionException;
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
import com.carescore.model.enums.TrendDirection;
import com.carescore.repository.AssessmentRepository;
import com.carescore.resilience.InMemoryCircuitBreakerRegistry;
import com.carescore.resilience.InMemoryResultCacheFactory;
import com.carescore.resilience.RateLimiter;
import com.carescore.resilience.ResilientExecutor;
import com.carescore.resilience.RetryPolicy;
import com.carescore.service.analytics.TrendAnalyzer;
import com.carescore.service.analytics.TrendReport;
import com.carescore.service.scoring.AssessmentScoringEngine;
import com.carescore.service.scoring.MorseFallScale;
import com.carescore.service.scoring.ScoringBands;
import com.carescore.service.scoring.ToolScore;
import com.carescore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssessmentService Unit Tests")
class AssessmentServiceTest {

    private static final String ACTOR = "nurse-1";
    private static final String PATIENT = "patient-1";

    @Mock
    private AssessmentRepository assessmentRepository;

    @Mock
    private RiskAssessmentService riskAssessmentService;

    @Mock
    private ClinicalEventPublisher eventPublisher;

    @Mock
    private RateLimiter rateLimiter;

    private MutableClock clock;
    private AssessmentService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T09:00:00Z");
        ResilientExecutor executor = new ResilientExecutor(
            new InMemoryCircuitBreakerRegistry(clock, 5, 30_000),
            new RetryPolicy(1, 0, 0, 0), Runnable::run, millis -> { }, 1_000, 1_000);
        service = new AssessmentService(
            new FacadeBoundary(rateLimiter, clock),
            executor,
            assessmentRepository,
            new AssessmentScoringEngine(new ScoringBands()),
            new TrendAnalyzer(new CareScoreProperties()),
            riskAssessmentService,
            eventPublisher,
            new InMemoryResultCacheFactory(clock, 60_000, 100),
            clock);
    }

    private static Map<String, Integer> morse(int falls, int diagnosis, int aid, int iv, int gait, int mental) {
        Map<String, Integer> values = new LinkedHashMap<>();
        values.put(MorseFallScale.HISTORY_OF_FALLS, falls);
        values.put(MorseFallScale.SECONDARY_DIAGNOSIS, diagnosis);
        values.put(MorseFallScale.AMBULATORY_AID, aid);
        values.put(MorseFallScale.IV_THERAPY, iv);
        values.put(MorseFallScale.GAIT, gait);
        values.put(MorseFallScale.MENTAL_STATUS, mental);
        return values;
    }

    private static Assessment stored(String id, Map<String, Integer> categories, int total, RecordStatus status, long version, Instant createdAt) {
        return Assessment.builder()
            .id(id)
            .patientId(PATIENT)
            .authorId(ACTOR)
            .assessmentType(AssessmentType.FALL_RISK)
            .toolType(ToolType.MORSE)
            .categories(new LinkedHashMap<>(categories))
            .totalScore(total)
            .riskLevel("high")
            .normalizedRisk(RiskLevel.HIGH)
            .status(status)
            .version(version)
            .createdAt(createdAt)
            .build();
    }

    private void saveReturnsArgument() {
        when(assessmentRepository.save(any(Assessment.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Should score, version and publish a new assessment")
    void shouldCreateAssessment() {
        // Given
        saveReturnsArgument();

        // When
        ServiceResult<Assessment> result = service.create(
            ACTOR, PATIENT, "morse", "fall_risk", morse(25, 15, 0, 0, 10, 0), false);

        // Then
        assertThat(result.success()).isTrue();
        Assessment created = result.data();
        assertThat(created.getId()).startsWith("asmt-");
        assertThat(created.getTotalScore()).isEqualTo(50);
        assertThat(created.getRiskLevel()).isEqualTo("high");
        assertThat(created.getStatus()).isEqualTo(RecordStatus.ACTIVE);
        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getHistory()).singleElement()
            .satisfies(entry -> {
                assertThat(entry.getAction()).isEqualTo("created");
                assertThat(entry.getActor()).isEqualTo(ACTOR);
                assertThat(entry.getVersion()).isEqualTo(1);
                assertThat(entry.getDiff()).containsEntry("totalScore", 50);
            });

        verify(riskAssessmentService).invalidatePatient(PATIENT);
        ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
        verify(eventPublisher).publish(eq(EventTypes.ASSESSMENT_CREATED), any(), options.capture());
        assertThat(options.getValue().priority()).isEqualTo("high");
        assertThat(options.getValue().key()).isEqualTo(PATIENT);
    }

    @Test
    @DisplayName("Should store a draft and publish it at normal priority")
    void shouldCreateDraft() {
        saveReturnsArgument();

        ServiceResult<Assessment> result = service.create(
            ACTOR, PATIENT, "morse", null, morse(25, 15, 0, 0, 10, 0), true);

        assertThat(result.data().getStatus()).isEqualTo(RecordStatus.DRAFT);
        verify(eventPublisher).publish(eq(EventTypes.ASSESSMENT_CREATED), any(), eq(PublishOptions.forPatient(PATIENT)));
    }

    @Test
    @DisplayName("Should reject an assessment type that does not match the tool")
    void shouldRejectToolMismatch() {
        ServiceResult<Assessment> result = service.create(
            ACTOR, PATIENT, "morse", "cognitive", morse(0, 0, 0, 0, 0, 0), false);

        assertThat(result.success()).isFalse();
        assertThat(result.error().code()).isEqualTo(ValidationException.CODE);
        assertThat(result.error().field()).isEqualTo("assessmentType");
        verify(assessmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject an unknown tool")
    void shouldRejectUnknownTool() {
        ServiceResult<ToolScore> result = service.scorePreview(ACTOR, "glasgow", Map.of());

        assertThat(result.error().field()).isEqualTo("toolType");
    }

    @Test
    @DisplayName("Should merge changed categories, re-score and record the diff")
    void shouldUpdateAssessment() {
        // Given
        Assessment existing = stored("asmt-1", morse(25, 15, 0, 0, 10, 0), 50, RecordStatus.ACTIVE, 1,
            Instant.parse("2026-03-01T09:00:00Z"));
        when(assessmentRepository.findById("asmt-1")).thenReturn(Optional.of(existing));
        saveReturnsArgument();

        // When
        ServiceResult<Assessment> result = service.update(
            ACTOR, "asmt-1", Map.of(MorseFallScale.HISTORY_OF_FALLS, 0), null, 1L);

        // Then
        Assessment updated = result.data();
        assertThat(updated.getTotalScore()).isEqualTo(25);
        assertThat(updated.getRiskLevel()).isEqualTo("moderate");
        assertThat(updated.getVersion()).isEqualTo(2);
        HistoryEntry entry = updated.getHistory().get(updated.getHistory().size() - 1);
        assertThat(entry.getAction()).isEqualTo("updated");
        assertThat(entry.getDiff()).containsKeys(MorseFallScale.HISTORY_OF_FALLS, "totalScore", "riskLevel");
        assertThat(entry.getDiff().get("totalScore")).isEqualTo(Map.of("from", 50, "to", 25));
        verify(eventPublisher).publish(eq(EventTypes.ASSESSMENT_UPDATED), any(), any());
    }

    @Test
    @DisplayName("Should refuse an update against an older version")
    void shouldRejectStaleUpdate() {
        Assessment existing = stored("asmt-1", morse(25, 15, 0, 0, 10, 0), 50, RecordStatus.ACTIVE, 3,
            Instant.parse("2026-03-01T09:00:00Z"));
        when(assessmentRepository.findById("asmt-1")).thenReturn(Optional.of(existing));

        ServiceResult<Assessment> result = service.update(ACTOR, "asmt-1", Map.of(MorseFallScale.GAIT, 20), null, 2L);

        assertThat(result.error().code()).isEqualTo(StaleVersionException.CODE);
        verify(assessmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should not modify an archived assessment")
    void shouldRejectUpdateOfArchived() {
        Assessment existing = stored("asmt-1", morse(0, 0, 0, 0, 0, 0), 0, RecordStatus.ARCHIVED, 2,
            Instant.parse("2026-03-01T09:00:00Z"));
        when(assessmentRepository.findById("asmt-1")).thenReturn(Optional.of(existing));

        ServiceResult<Assessment> result = service.update(ACTOR, "asmt-1", Map.of(MorseFallScale.GAIT, 20), null, null);

        assertThat(result.error().field()).isEqualTo("status");
    }

    @Test
    @DisplayName("Should archive once and return an archived assessment unchanged")
    void shouldArchiveIdempotently() {
        // Given
        Assessment existing = stored("asmt-1", morse(0, 0, 0, 0, 0, 0), 0, RecordStatus.ACTIVE, 1,
            Instant.parse("2026-03-01T09:00:00Z"));
        when(assessmentRepository.findById("asmt-1")).thenReturn(Optional.of(existing));
        saveReturnsArgument();

        // When
        ServiceResult<Assessment> first = service.archive(ACTOR, "asmt-1", null);
        ServiceResult<Assessment> second = service.archive(ACTOR, "asmt-1", 0L);

        // Then
        assertThat(first.data().getStatus()).isEqualTo(RecordStatus.ARCHIVED);
        assertThat(second.success()).isTrue();
        assertThat(second.data().getVersion()).isEqualTo(2);
        verify(assessmentRepository, times(1)).save(any());
        verify(eventPublisher, times(1)).publish(eq(EventTypes.ASSESSMENT_ARCHIVED), any(), any());
    }

    @Test
    @DisplayName("Should archive every active assessment of a patient")
    void shouldArchiveAllForPatient() {
        Instant at = Instant.parse("2026-03-01T09:00:00Z");
        when(assessmentRepository.findActiveByPatientId(PATIENT)).thenReturn(List.of(
            stored("asmt-1", morse(0, 0, 0, 0, 0, 0), 0, RecordStatus.ACTIVE, 1, at),
            stored("asmt-2", morse(0, 0, 0, 0, 0, 0), 0, RecordStatus.DRAFT, 1, at)));
        saveReturnsArgument();

        ServiceResult<Integer> result = service.archiveAllForPatient(ACTOR, PATIENT);

        assertThat(result.data()).isEqualTo(2);
        verify(assessmentRepository, times(2)).save(any());
    }

    @Test
    @DisplayName("Should report a missing assessment as not found")
    void shouldReportNotFound() {
        when(assessmentRepository.findById(anyString())).thenReturn(Optional.empty());

        ServiceResult<Assessment> result = service.get(ACTOR, "asmt-missing");

        assertThat(result.error().code()).isEqualTo(FacadeBoundary.NOT_FOUND);
    }

    @Test
    @DisplayName("Should reject sorting by an unknown property")
    void shouldRejectUnknownSort() {
        ServiceResult<?> result = service.list(ACTOR, PATIENT, null, 0, 20, "authorId,asc");

        assertThat(result.error().field()).isEqualTo("sort");
    }

    @Test
    @DisplayName("Should orient Morse trends so that a falling score reads as improving, and cache the report")
    void shouldAnalyzeTrends() {
        // Given
        when(assessmentRepository.findByPatientIdAndToolTypeAndStatusNotOrderByCreatedAtAsc(
            PATIENT, ToolType.MORSE, RecordStatus.ARCHIVED)).thenReturn(List.of(
                stored("asmt-1", morse(25, 15, 0, 0, 10, 0), 50, RecordStatus.ACTIVE, 1, Instant.parse("2026-03-01T09:00:00Z")),
                stored("asmt-2", morse(0, 15, 0, 0, 10, 0), 25, RecordStatus.ACTIVE, 1, Instant.parse("2026-03-02T09:00:00Z"))));

        // When
        TrendReport report = service.analyzeTrends(ACTOR, PATIENT, "morse", "day").data();
        service.analyzeTrends(ACTOR, PATIENT, "morse", "day");

        // Then
        assertThat(report.trends()).containsKeys("morse.total", "morse.historyOfFalls");
        assertThat(report.trends().get("morse.total").direction()).isEqualTo(TrendDirection.IMPROVING);
        assertThat(report.trends().get("morse.total").slope()).isEqualTo(25.0);
        assertThat(report.trends().get("morse.gait").direction()).isEqualTo(TrendDirection.STABLE);
        verify(assessmentRepository, times(1))
            .findByPatientIdAndToolTypeAndStatusNotOrderByCreatedAtAsc(PATIENT, ToolType.MORSE, RecordStatus.ARCHIVED);
    }
}
