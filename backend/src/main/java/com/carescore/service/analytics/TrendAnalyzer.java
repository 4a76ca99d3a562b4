package com.carescore.service.analytics;

import com.carescore.config.CareScoreProperties;
import com.carescore.model.enums.ConfidenceLevel;
import com.carescore.model.enums.TrendDirection;
import com.carescore.model.enums.TrendPeriod;
import com.carescore.model.enums.TrendSignificance;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Trend Analyzer
 *
 * Least-squares slope and Pearson correlation over index/value pairs. Series are analyzed in
 * the order given; grouping by period is the step that decides temporal order.
 *
 * Significance: |r| above the significance threshold (0.5).
 * Confidence:   |r| >= 0.8 HIGH, above the significance threshold MEDIUM, else LOW.
 */
@Service
public class TrendAnalyzer {

    private final CareScoreProperties.Trend settings;

    public TrendAnalyzer(CareScoreProperties properties) {
        this.settings = properties.getTrend();
    }

    public TrendResult analyzeTrend(String metric, List<SeriesPoint> series) {
        int n = series == null ? 0 : series.size();
        if (n < 2) {
            return TrendResult.insufficient(metric, n);
        }

        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double sumX = 0;
        double sumY = 0;
        for (SeriesPoint point : series) {
            sumX += point.index();
            sumY += point.value();
            minY = Math.min(minY, point.value());
            maxY = Math.max(maxY, point.value());
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        for (SeriesPoint point : series) {
            double dx = point.index() - meanX;
            double dy = point.value() - meanY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }

        double slope;
        double correlation;
        if (sxx == 0 || minY == maxY) {
            // Constant series: no trend, regardless of rounding in the mean
            slope = 0.0;
            correlation = 0.0;
        } else {
            slope = sxy / sxx;
            correlation = syy == 0 ? 0.0 : Math.max(-1.0, Math.min(1.0, sxy / Math.sqrt(sxx * syy)));
        }

        double absR = Math.abs(correlation);
        TrendSignificance significance = absR > settings.getSignificanceThreshold()
            ? TrendSignificance.SIGNIFICANT
            : TrendSignificance.NOT_SIGNIFICANT;

        return new TrendResult(metric, slope, correlation, significance, directionOf(slope), confidenceOf(absR), n);
    }

    public TrendDirection directionOf(double slope) {
        double epsilon = settings.getEpsilon();
        if (slope > epsilon) return TrendDirection.IMPROVING;
        if (slope < -epsilon) return TrendDirection.DECLINING;
        return TrendDirection.STABLE;
    }

    private ConfidenceLevel confidenceOf(double absR) {
        if (absR >= settings.getHighConfidenceThreshold()) return ConfidenceLevel.HIGH;
        if (absR > settings.getSignificanceThreshold()) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    // ========================================================================
    // Period grouping
    // ========================================================================

    /**
     * Averages values per UTC day, week (Monday start) or month and returns the buckets in
     * ascending order with consecutive indices.
     */
    public List<SeriesPoint> groupByPeriod(List<TimedValue> values, TrendPeriod period) {
        TrendPeriod bucketSize = period == null ? TrendPeriod.DAY : period;
        TreeMap<LocalDate, double[]> buckets = new TreeMap<>();
        if (values != null) {
            for (TimedValue value : values) {
                if (value == null || value.timestamp() == null) {
                    continue;
                }
                double[] acc = buckets.computeIfAbsent(bucketSize.bucketStart(value.timestamp()), d -> new double[2]);
                acc[0] += value.value();
                acc[1]++;
            }
        }

        List<SeriesPoint> series = new ArrayList<>();
        int index = 0;
        for (Map.Entry<LocalDate, double[]> bucket : buckets.entrySet()) {
            double average = bucket.getValue()[0] / bucket.getValue()[1];
            Instant start = bucket.getKey().atStartOfDay(ZoneOffset.UTC).toInstant();
            series.add(new SeriesPoint(index++, average, start));
        }
        return series;
    }

    // ========================================================================
    // Multi-metric reports
    // ========================================================================

    public TrendReport analyzeMetrics(Map<String, List<SeriesPoint>> metrics) {
        Map<String, TrendResult> trends = new LinkedHashMap<>();
        List<TrendProjection> projections = new ArrayList<>();
        List<SignificantChange> changes = new ArrayList<>();

        if (metrics != null) {
            metrics.forEach((metric, series) -> {
                TrendResult trend = analyzeTrend(metric, series);
                trends.put(metric, trend);
                if (trend.isSignificant()) {
                    projections.add(project(trend, series));
                }
                changes.addAll(significantChanges(metric, series));
            });
        }

        return new TrendReport(trends, overallDirection(trends.values()), projections, changes);
    }

    /**
     * Majority vote over metric directions. A tie for first place is STABLE.
     */
    public TrendDirection overallDirection(Iterable<TrendResult> trends) {
        Map<TrendDirection, Integer> votes = new EnumMap<>(TrendDirection.class);
        for (TrendResult trend : trends) {
            votes.merge(trend.direction(), 1, Integer::sum);
        }
        TrendDirection winner = TrendDirection.STABLE;
        int best = 0;
        boolean tie = false;
        for (Map.Entry<TrendDirection, Integer> vote : votes.entrySet()) {
            if (vote.getValue() > best) {
                winner = vote.getKey();
                best = vote.getValue();
                tie = false;
            } else if (vote.getValue() == best) {
                tie = true;
            }
        }
        return tie ? TrendDirection.STABLE : winner;
    }

    public List<SignificantChange> significantChanges(String metric, List<SeriesPoint> series) {
        List<SignificantChange> changes = new ArrayList<>();
        if (series == null) {
            return changes;
        }
        double threshold = settings.getChangeThreshold();
        for (int i = 1; i < series.size(); i++) {
            SeriesPoint previous = series.get(i - 1);
            SeriesPoint current = series.get(i);
            double delta = current.value() - previous.value();
            if (Math.abs(delta) > threshold) {
                String magnitude = Math.abs(delta) > threshold * 2 ? "high" : "moderate";
                changes.add(new SignificantChange(metric, previous.index(), current.index(), delta, magnitude));
            }
        }
        return changes;
    }

    private TrendProjection project(TrendResult trend, List<SeriesPoint> series) {
        int horizon = settings.getProjectionHorizon();
        double change = trend.slope() * horizon;
        double last = series.get(series.size() - 1).value();
        return new TrendProjection(trend.metric(), horizon, change, last + change);
    }
}
