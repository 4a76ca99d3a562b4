package com.carescore.dto.mapper;

import com.carescore.dto.request.GoalRequest;
import com.carescore.dto.request.RiskScoresRequest;
import com.carescore.dto.response.PageDto;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.RiskType;
import com.carescore.service.progress.GoalDraft;
import com.carescore.service.risk.RiskScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClinicalRecordMapper Unit Tests")
class ClinicalRecordMapperTest {

    private final ClinicalRecordMapper mapper = new ClinicalRecordMapper();

    @Test
    @DisplayName("Should derive a missing level from the score and default confidence to 1")
    void shouldFillRiskScoreDefaults() {
        // Given
        Map<String, RiskScoresRequest.RiskScoreRequest> scores = new LinkedHashMap<>();
        scores.put("infection", new RiskScoresRequest.RiskScoreRequest(65.0, null, List.of("fever"), null));
        scores.put("medication", new RiskScoresRequest.RiskScoreRequest(30.0, "moderate", null, 0.4));

        // When
        Map<RiskType, RiskScore> result = mapper.toRiskScores(new RiskScoresRequest(scores));

        // Then
        assertThat(result.get(RiskType.INFECTION).level()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.get(RiskType.INFECTION).confidence()).isEqualTo(1.0);
        assertThat(result.get(RiskType.MEDICATION).level()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(result.get(RiskType.MEDICATION).contributingFactors()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an unknown risk type")
    void shouldRejectUnknownRiskType() {
        RiskScoresRequest request = new RiskScoresRequest(
            Map.of("sepsis", new RiskScoresRequest.RiskScoreRequest(50.0, null, null, null)));

        assertThatThrownBy(() -> mapper.toRiskScores(request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should carry milestones into the goal draft")
    void shouldMapGoalRequest() {
        GoalRequest request = new GoalRequest("Walk", "mobility", null, null, null, null, null, null,
            100.0, 10.0, "meters", List.of(new GoalRequest.MilestoneRequest("halfway", 50)));

        GoalDraft draft = mapper.toGoalDraft(request);

        assertThat(draft.targetValue()).isEqualTo(100.0);
        assertThat(draft.milestones()).singleElement()
            .satisfies(m -> assertThat(m.threshold()).isEqualTo(50.0));
        assertThat(mapper.toGoalDrafts(null)).isEmpty();
    }

    @Test
    @DisplayName("Should convert a page with its paging metadata")
    void shouldMapPage() {
        PageImpl<Integer> page = new PageImpl<>(List.of(1, 2), PageRequest.of(1, 2), 5);

        PageDto<String> dto = mapper.toPageDto(page, String::valueOf);

        assertThat(dto.items()).containsExactly("1", "2");
        assertThat(dto.page()).isEqualTo(1);
        assertThat(dto.totalItems()).isEqualTo(5);
        assertThat(dto.totalPages()).isEqualTo(3);
    }
}
