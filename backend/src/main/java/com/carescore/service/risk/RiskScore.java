package com.carescore.service.risk;

import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.RiskType;

import java.util.List;

/**
 * Normalized risk for one risk type.
 *
 * @param value      0..100, higher is riskier
 * @param confidence 0..1
 */
public record RiskScore(
    RiskType type,
    double value,
    RiskLevel level,
    List<String> contributingFactors,
    double confidence
) {

    public RiskScore {
        value = Math.max(0.0, Math.min(100.0, value));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        contributingFactors = contributingFactors == null ? List.of() : List.copyOf(contributingFactors);
    }
}
