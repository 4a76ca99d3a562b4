package com.carescore.service.risk;

import com.carescore.model.enums.RecommendationPriority;
import com.carescore.model.enums.RiskLevel;
import com.carescore.model.enums.RiskType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Risk Assessment Aggregator
 *
 * Combines per-type risk scores into one patient picture:
 * - overall level = highest level present
 * - an alert for every score at HIGH or above, or with a value of 75 or more
 * - recommendations for every score at MEDIUM or above, merged by normalized text
 */
@Service
public class RiskAssessmentAggregator {

    static final double ALERT_SCORE_THRESHOLD = 75.0;

    private final MitigationCatalog catalog;

    public RiskAssessmentAggregator(MitigationCatalog catalog) {
        this.catalog = catalog;
    }

    public RiskAggregation aggregate(Map<RiskType, RiskScore> scores) {
        // Fixed iteration order keeps output deterministic
        Map<RiskType, RiskScore> ordered = new EnumMap<>(RiskType.class);
        if (scores != null) {
            scores.forEach((type, score) -> {
                if (type != null && score != null) {
                    ordered.put(type, score);
                }
            });
        }

        RiskLevel overall = RiskLevel.LOW;
        double sum = 0;
        List<RiskAlert> alerts = new ArrayList<>();
        for (Map.Entry<RiskType, RiskScore> entry : ordered.entrySet()) {
            RiskScore score = entry.getValue();
            overall = RiskLevel.max(overall, score.level());
            sum += score.value();
            if (score.level().isAtLeast(RiskLevel.HIGH) || score.value() >= ALERT_SCORE_THRESHOLD) {
                alerts.add(buildAlert(entry.getKey(), score));
            }
        }

        double average = ordered.isEmpty() ? 0.0 : Math.round(sum / ordered.size() * 10.0) / 10.0;

        List<RiskType> highestRiskAreas = ordered.entrySet().stream()
            .filter(e -> e.getValue().level().isAtLeast(RiskLevel.HIGH))
            .sorted(Comparator.comparingDouble((Map.Entry<RiskType, RiskScore> e) -> e.getValue().value()).reversed())
            .map(Map.Entry::getKey)
            .toList();

        return new RiskAggregation(overall, average, ordered, alerts, recommendations(ordered), highestRiskAreas);
    }

    private RiskAlert buildAlert(RiskType type, RiskScore score) {
        boolean critical = score.level() == RiskLevel.CRITICAL;
        return new RiskAlert(
            type,
            score.level(),
            score.value(),
            catalog.immediateAction(type, score.contributingFactors()),
            catalog.alertCriteria(type, critical)
        );
    }

    // ========================================================================
    // Recommendations
    // ========================================================================

    List<Recommendation> recommendations(Map<RiskType, RiskScore> scores) {
        Map<String, MergedRecommendation> merged = new LinkedHashMap<>();

        for (Map.Entry<RiskType, RiskScore> entry : scores.entrySet()) {
            RiskLevel level = entry.getValue().level();
            if (!level.isAtLeast(RiskLevel.MEDIUM)) {
                continue;
            }
            RecommendationPriority priority = priorityFor(level);
            List<String> texts = level.isAtLeast(RiskLevel.HIGH)
                ? catalog.highRiskRecommendations(entry.getKey())
                : catalog.moderateRiskRecommendations(entry.getKey());

            for (String text : texts) {
                merged.computeIfAbsent(normalize(text), k -> new MergedRecommendation(text, priority))
                    .merge(priority, entry.getKey());
            }
        }

        List<Recommendation> result = new ArrayList<>();
        merged.values().forEach(m -> result.add(m.toRecommendation()));
        // List.sort is stable, so first-seen order is kept within a priority
        result.sort(Comparator.comparingInt(r -> r.priority().ordinal()));
        return result;
    }

    static RecommendationPriority priorityFor(RiskLevel level) {
        return switch (level) {
            case CRITICAL -> RecommendationPriority.URGENT;
            case HIGH -> RecommendationPriority.HIGH;
            case MEDIUM -> RecommendationPriority.MEDIUM;
            case LOW -> RecommendationPriority.LOW;
        };
    }

    /**
     * Lower-case, single spaces, no trailing punctuation.
     */
    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT)
            .trim()
            .replaceAll("\\s+", " ")
            .replaceAll("[\\p{Punct}\\s]+$", "");
    }

    private static final class MergedRecommendation {
        private final String text;
        private RecommendationPriority priority;
        private final List<RiskType> sources = new ArrayList<>();

        MergedRecommendation(String text, RecommendationPriority priority) {
            this.text = text;
            this.priority = priority;
        }

        void merge(RecommendationPriority other, RiskType source) {
            if (other.ordinal() < priority.ordinal()) {
                priority = other;
            }
            if (!sources.contains(source)) {
                sources.add(source);
            }
        }

        Recommendation toRecommendation() {
            return new Recommendation(text, priority, List.copyOf(sources));
        }
    }
}
