package com.carescore.service.scoring;

import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.ToolType;

import java.util.List;
import java.util.Map;

/**
 * Result of scoring one assessment.
 *
 * @param values       validated category values that were supplied
 * @param completeness share of the tool's categories that were supplied, 0..1
 */
public record ToolScore(
    ToolType tool,
    int total,
    String level,
    RiskLevel riskLevel,
    List<String> warnings,
    double completeness,
    Map<String, Integer> values
) {}
