package com.carescore.integration;

/**
 * Used when no insight provider is configured.
 */
public class DisabledInsightGenerator implements InsightGenerator {

    @Override
    public ClinicalInsights generateInsights(InsightRequest request) {
        return ClinicalInsights.empty();
    }
}
