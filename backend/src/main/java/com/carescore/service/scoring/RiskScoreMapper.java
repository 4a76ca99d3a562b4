package com.carescore.service.scoring;

import com.carescore.service.risk.RiskScore;
import org.springframework.stereotype.Component;

/**
 * Turns a tool score into a normalized {@link RiskScore} the aggregator can compare across tools.
 */
@Component
public class RiskScoreMapper {

    private final AssessmentScoringEngine scoringEngine;

    public RiskScoreMapper(AssessmentScoringEngine scoringEngine) {
        this.scoringEngine = scoringEngine;
    }

    public RiskScore toRiskScore(ToolScore score) {
        ScoringTool tool = scoringEngine.toolFor(score.tool());
        return new RiskScore(
            score.tool().getRiskType(),
            tool.normalize(score.total()),
            score.riskLevel(),
            tool.contributingFactors(score.values()),
            score.completeness()
        );
    }
}
