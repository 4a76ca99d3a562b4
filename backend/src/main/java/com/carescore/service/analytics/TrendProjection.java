package com.carescore.service.analytics;

/**
 * Linear extrapolation of a significant trend {@code horizon} periods past the last point.
 */
public record TrendProjection(
    String metric,
    int horizon,
    double projectedChange,
    double projectedValue
) {}
