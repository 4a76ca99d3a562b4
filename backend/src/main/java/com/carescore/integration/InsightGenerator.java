package com.carescore.integration;

/**
 * Optional text enrichment for clinical results. Callers must treat every failure as
 * "no insights" and carry on.
 */
public interface InsightGenerator {

    ClinicalInsights generateInsights(InsightRequest request);
}
