package com.carescore.service.analytics;

import com.carescore.model.enums.ConfidenceLevel;
import com.carescore.model.enums.TrendDirection;
import com.carescore.model.enums.TrendSignificance;

public record TrendResult(
    String metric,
    double slope,
    double correlation,
    TrendSignificance significance,
    TrendDirection direction,
    ConfidenceLevel confidence,
    int sampleSize
) {

    public static TrendResult insufficient(String metric, int sampleSize) {
        return new TrendResult(metric, 0.0, 0.0, TrendSignificance.INSUFFICIENT_DATA,
            TrendDirection.STABLE, ConfidenceLevel.LOW, sampleSize);
    }

    public boolean isSignificant() {
        return significance == TrendSignificance.SIGNIFICANT;
    }
}
