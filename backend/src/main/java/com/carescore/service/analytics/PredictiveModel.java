package com.carescore.service.analytics;

import com.carescore.config.CareScoreProperties;
import com.carescore.model.enums.TrendDirection;
import com.carescore.model.progress.Goal;
import com.carescore.model.progress.ProgressObservation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Predictive Model
 *
 * Achievement probability = latest progress / 100, nudged by the progress trend:
 *   improving: + slope/100 * improvingDamping (0.5)
 *   declining: - |slope|/100 * decliningDamping (0.3)
 * then clamped to [0, 1]. Confidence is |r| of the same trend.
 */
@Service
public class PredictiveModel {

    private final TrendAnalyzer trendAnalyzer;
    private final CareScoreProperties.Prediction settings;

    public PredictiveModel(TrendAnalyzer trendAnalyzer, CareScoreProperties properties) {
        this.trendAnalyzer = trendAnalyzer;
        this.settings = properties.getPrediction();
    }

    public AchievementPrediction predictGoalAchievement(List<SeriesPoint> series, Goal goal) {
        TrendResult trend = trendAnalyzer.analyzeTrend("progress:" + goal.getId(), series);
        double probability = goal.getProgress() / 100.0;

        if (trend.direction() == TrendDirection.IMPROVING) {
            probability += trend.slope() / 100.0 * settings.getImprovingDamping();
        } else if (trend.direction() == TrendDirection.DECLINING) {
            probability -= Math.abs(trend.slope()) / 100.0 * settings.getDecliningDamping();
        }
        probability = Math.max(0.0, Math.min(1.0, probability));

        return new AchievementPrediction(
            goal.getId(),
            probability,
            Math.abs(trend.correlation()),
            trend.direction(),
            estimateTimeToCompletion(trend, goal),
            recommendationsFor(probability)
        );
    }

    /**
     * Periods until the goal reaches 100%, or null when it already has or is not moving forward.
     */
    public Integer estimateTimeToCompletion(List<SeriesPoint> series, Goal goal) {
        return estimateTimeToCompletion(trendAnalyzer.analyzeTrend("progress:" + goal.getId(), series), goal);
    }

    private Integer estimateTimeToCompletion(TrendResult trend, Goal goal) {
        if (goal.getProgress() >= 100.0 || trend.slope() <= 0) {
            return null;
        }
        double remaining = 100.0 - goal.getProgress();
        return (int) Math.max(1, Math.ceil(remaining / trend.slope()));
    }

    /**
     * Progress series of a goal, one point per recorded observation.
     */
    public List<SeriesPoint> progressSeries(Goal goal) {
        List<SeriesPoint> series = new ArrayList<>();
        List<ProgressObservation> observations = goal.getObservations();
        for (int i = 0; i < observations.size(); i++) {
            ProgressObservation observation = observations.get(i);
            series.add(new SeriesPoint(i, observation.getProgress(), observation.getTimestamp()));
        }
        return series;
    }

    private List<String> recommendationsFor(double probability) {
        if (probability < 0.3) {
            return List.of(
                "Revise intervention strategy",
                "Consider adjusting the goal target or timeline",
                "Increase monitoring frequency");
        }
        if (probability < 0.7) {
            return List.of(
                "Maintain current interventions",
                "Monitor progress closely");
        }
        return List.of("On track, continue the current care plan");
    }
}
