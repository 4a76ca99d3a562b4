package com.carescore.service.analytics;

import com.carescore.model.enums.TrendDirection;

import java.util.List;
import java.util.Map;

public record TrendReport(
    Map<String, TrendResult> trends,
    TrendDirection overallDirection,
    List<TrendProjection> projections,
    List<SignificantChange> significantChanges
) {}
