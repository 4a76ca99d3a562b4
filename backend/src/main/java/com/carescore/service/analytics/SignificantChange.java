package com.carescore.service.analytics;

/**
 * A jump between two consecutive points larger than the configured change threshold.
 *
 * @param magnitude "high" above twice the threshold, otherwise "moderate"
 */
public record SignificantChange(
    String metric,
    int fromIndex,
    int toIndex,
    double change,
    String magnitude
) {}
