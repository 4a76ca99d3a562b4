package com.carescore.service.risk;

import com.carescore.model.enums.RecommendationPriority;
import com.carescore.model.enums.RiskType;

import java.util.List;

/**
 * A mitigation recommendation and every risk type that asked for it.
 */
public record Recommendation(
    String text,
    RecommendationPriority priority,
    List<RiskType> sources
) {}
