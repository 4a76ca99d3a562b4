package com.carescore.dto.mapper;

import com.carescore.dto.request.GoalRequest;
import com.carescore.dto.request.RecordInterventionRequest;
import com.carescore.dto.request.RiskScoresRequest;
import com.carescore.dto.response.AssessmentDto;
import com.carescore.dto.response.AssessmentSummaryDto;
import com.carescore.dto.response.GoalUpdateDto;
import com.carescore.dto.response.InterventionResultDto;
import com.carescore.dto.response.PageDto;
import com.carescore.dto.response.ProgressRecordDto;
import com.carescore.model.assessment.Assessment;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.RiskType;
import com.carescore.model.progress.Milestone;
import com.carescore.model.progress.ProgressRecord;
import com.carescore.service.GoalUpdateResult;
import com.carescore.service.InterventionResult;
import com.carescore.service.progress.GoalDraft;
import com.carescore.service.progress.InterventionDraft;
import com.carescore.service.progress.MilestoneDraft;
import com.carescore.service.risk.RiskScore;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mapper for converting between clinical records and DTOs.
 */
@Component
public class ClinicalRecordMapper {

    // ========================================================================
    // Entity -> DTO Conversions
    // ========================================================================

    public AssessmentDto toDto(Assessment entity) {
        if (entity == null) {
            return null;
        }
        return new AssessmentDto(
            entity.getId(),
            entity.getPatientId(),
            entity.getAuthorId(),
            entity.getAssessmentType() != null ? entity.getAssessmentType().getValue() : null,
            entity.getToolType() != null ? entity.getToolType().getValue() : null,
            entity.getCategories(),
            entity.getTotalScore(),
            entity.getRiskLevel(),
            entity.getNormalizedRisk() != null ? entity.getNormalizedRisk().getValue() : null,
            entity.getStatus().getValue(),
            entity.getVersion(),
            entity.getWarnings(),
            entity.getHistory(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    public AssessmentSummaryDto toSummaryDto(Assessment entity) {
        return new AssessmentSummaryDto(
            entity.getId(),
            entity.getPatientId(),
            entity.getToolType() != null ? entity.getToolType().getValue() : null,
            entity.getTotalScore(),
            entity.getRiskLevel(),
            entity.getStatus().getValue(),
            entity.getVersion(),
            entity.getCreatedAt()
        );
    }

    public ProgressRecordDto toDto(ProgressRecord entity) {
        if (entity == null) {
            return null;
        }
        return new ProgressRecordDto(
            entity.getId(),
            entity.getPatientId(),
            entity.getAuthorId(),
            entity.getStatus().getValue(),
            entity.getVersion(),
            entity.getGoals(),
            entity.getInterventions(),
            entity.getMetrics(),
            entity.getHistory(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    public GoalUpdateDto toDto(GoalUpdateResult result) {
        return new GoalUpdateDto(
            toDto(result.record()),
            result.update().goal().getId(),
            result.update().goal().getProgress(),
            result.update().goal().getStatus().getValue(),
            result.update().statusChanged(),
            result.update().reachedMilestones().stream()
                .map(Milestone::getDescription)
                .collect(Collectors.toList())
        );
    }

    public InterventionResultDto toDto(InterventionResult result) {
        return new InterventionResultDto(
            toDto(result.record()),
            result.outcome().intervention(),
            result.outcome().warnings()
        );
    }

    public <E, D> PageDto<D> toPageDto(Page<E> page, Function<E, D> converter) {
        return new PageDto<>(
            page.getContent().stream().map(converter).collect(Collectors.toList()),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages()
        );
    }

    // ========================================================================
    // Request -> Domain Conversions
    // ========================================================================

    public List<GoalDraft> toGoalDrafts(List<GoalRequest> requests) {
        if (requests == null) {
            return Collections.emptyList();
        }
        return requests.stream().map(this::toGoalDraft).collect(Collectors.toList());
    }

    public GoalDraft toGoalDraft(GoalRequest request) {
        if (request == null) {
            return null;
        }
        List<MilestoneDraft> milestones = request.milestones() == null ? null : request.milestones().stream()
            .map(m -> new MilestoneDraft(m.description(), m.threshold()))
            .collect(Collectors.toList());
        return new GoalDraft(
            request.description(),
            request.category(),
            request.priority(),
            request.specific(),
            request.measurable(),
            request.achievable(),
            request.relevant(),
            request.timeBound(),
            request.targetValue(),
            request.currentValue(),
            request.unit(),
            milestones
        );
    }

    public InterventionDraft toInterventionDraft(RecordInterventionRequest request) {
        return new InterventionDraft(
            request.type(),
            request.description(),
            request.effectiveness(),
            request.goalIds()
        );
    }

    /**
     * Parses externally computed scores. Unknown risk types or levels are rejected with
     * {@link IllegalArgumentException}. A missing level is derived from the value.
     */
    public Map<RiskType, RiskScore> toRiskScores(RiskScoresRequest request) {
        Map<RiskType, RiskScore> scores = new EnumMap<>(RiskType.class);
        if (request == null || request.scores() == null) {
            return scores;
        }
        request.scores().forEach((key, score) -> {
            RiskType type = RiskType.fromValue(key);
            if (type == null || score == null) {
                return;
            }
            double value = score.value();
            RiskLevel level = score.level() != null ? RiskLevel.fromValue(score.level()) : RiskLevel.forScore(value);
            scores.put(type, new RiskScore(
                type,
                value,
                level,
                score.contributingFactors(),
                score.confidence() != null ? score.confidence() : 1.0
            ));
        });
        return scores;
    }
}
