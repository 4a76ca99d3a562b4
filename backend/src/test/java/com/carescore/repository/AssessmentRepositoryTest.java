package com.carescore.repository;

import com.carescore.model.HistoryEntry;
import com.carescore.model.assessment.Assessment;
import com.carescore.model.enums.AssessmentType;
import com.carescore.model.enums.RecordStatus;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against the embedded H2 database.
 */
@DataJpaTest
@DisplayName("AssessmentRepository Integration Tests")
class AssessmentRepositoryTest {

    @Autowired
    private AssessmentRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private Assessment assessment(String id, String patientId, ToolType tool, RecordStatus status, int total, String createdAt) {
        Assessment assessment = Assessment.builder()
            .id(id)
            .patientId(patientId)
            .authorId("nurse-1")
            .assessmentType(tool.getAssessmentType())
            .toolType(tool)
            .categories(new LinkedHashMap<>(Map.of("gait", 10)))
            .totalScore(total)
            .riskLevel("low")
            .normalizedRisk(RiskLevel.LOW)
            .status(status)
            .createdAt(Instant.parse(createdAt))
            .build();
        assessment.appendHistory(HistoryEntry.builder()
            .timestamp(Instant.parse(createdAt))
            .actor("nurse-1")
            .action("created")
            .diff(Map.of("totalScore", total))
            .build());
        return assessment;
    }

    @Test
    @DisplayName("Should round-trip JSON columns and the record version")
    void shouldPersistStructuredColumns() {
        // Given
        repository.save(assessment("asmt-1", "patient-1", ToolType.MORSE, RecordStatus.ACTIVE, 10, "2026-03-01T09:00:00Z"));
        entityManager.flush();
        entityManager.clear();

        // When
        Assessment loaded = repository.findById("asmt-1").orElseThrow();

        // Then
        assertThat(loaded.getCategories()).containsEntry("gait", 10);
        assertThat(loaded.getAssessmentType()).isEqualTo(AssessmentType.FALL_RISK);
        assertThat(loaded.getVersion()).isEqualTo(1);
        assertThat(loaded.getHistory()).singleElement()
            .satisfies(entry -> {
                assertThat(entry.getAction()).isEqualTo("created");
                assertThat(entry.getVersion()).isEqualTo(1);
                assertThat(entry.getTimestamp()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
            });
        assertThat(loaded.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should exclude archived assessments from the active query")
    void shouldFindActiveOnly() {
        repository.save(assessment("asmt-1", "patient-1", ToolType.MORSE, RecordStatus.ACTIVE, 10, "2026-03-01T09:00:00Z"));
        repository.save(assessment("asmt-2", "patient-1", ToolType.BRADEN, RecordStatus.DRAFT, 20, "2026-03-01T10:00:00Z"));
        repository.save(assessment("asmt-3", "patient-1", ToolType.MORSE, RecordStatus.ARCHIVED, 30, "2026-03-01T11:00:00Z"));
        repository.save(assessment("asmt-4", "patient-2", ToolType.MORSE, RecordStatus.ACTIVE, 40, "2026-03-01T12:00:00Z"));

        List<Assessment> active = repository.findActiveByPatientId("patient-1");

        assertThat(active).extracting(Assessment::getId).containsExactlyInAnyOrder("asmt-1", "asmt-2");
    }

    @Test
    @DisplayName("Should return a tool's non-archived series oldest first")
    void shouldFindSeriesInOrder() {
        repository.save(assessment("asmt-b", "patient-1", ToolType.MORSE, RecordStatus.ACTIVE, 20, "2026-03-03T09:00:00Z"));
        repository.save(assessment("asmt-a", "patient-1", ToolType.MORSE, RecordStatus.ACTIVE, 10, "2026-03-01T09:00:00Z"));
        repository.save(assessment("asmt-x", "patient-1", ToolType.MORSE, RecordStatus.ARCHIVED, 99, "2026-03-02T09:00:00Z"));
        repository.save(assessment("asmt-m", "patient-1", ToolType.MMSE, RecordStatus.ACTIVE, 28, "2026-03-02T09:00:00Z"));

        List<Assessment> series = repository.findByPatientIdAndToolTypeAndStatusNotOrderByCreatedAtAsc(
            "patient-1", ToolType.MORSE, RecordStatus.ARCHIVED);

        assertThat(series).extracting(Assessment::getId).containsExactly("asmt-a", "asmt-b");
    }

    @Test
    @DisplayName("Should page and filter by status")
    void shouldPageByStatus() {
        for (int i = 0; i < 5; i++) {
            repository.save(assessment("asmt-" + i, "patient-1", ToolType.MORSE, RecordStatus.ACTIVE, i, "2026-03-0" + (i + 1) + "T09:00:00Z"));
        }
        repository.save(assessment("asmt-d", "patient-1", ToolType.MORSE, RecordStatus.DRAFT, 0, "2026-03-09T09:00:00Z"));

        Page<Assessment> page = repository.findByPatientIdAndStatus(
            "patient-1", RecordStatus.ACTIVE, PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "totalScore")));
        Page<Assessment> all = repository.findByPatientId("patient-1", PageRequest.of(0, 10));

        assertThat(page.getTotalElements()).isEqualTo(5);
        assertThat(page.getContent()).extracting(Assessment::getTotalScore).containsExactly(4, 3);
        assertThat(all.getTotalElements()).isEqualTo(6);
    }
}
