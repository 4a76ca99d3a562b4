package com.carescore.service.analytics;

import com.carescore.config.CareScoreProperties;
import com.carescore.model.enums.TrendDirection;
import com.carescore.model.progress.Goal;
import com.carescore.model.progress.ProgressObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PredictiveModel Unit Tests")
class PredictiveModelTest {

    private PredictiveModel model;

    @BeforeEach
    void setUp() {
        CareScoreProperties properties = new CareScoreProperties();
        model = new PredictiveModel(new TrendAnalyzer(properties), properties);
    }

    private static Goal goalAt(double progress) {
        return Goal.builder().id("goal-1").description("Walk").targetValue(100).progress(progress).build();
    }

    private static List<SeriesPoint> series(double... values) {
        SeriesPoint[] points = new SeriesPoint[values.length];
        for (int i = 0; i < values.length; i++) {
            points[i] = SeriesPoint.of(i, values[i]);
        }
        return List.of(points);
    }

    @Test
    @DisplayName("Should raise the probability for an improving goal")
    void shouldBoostImprovingGoal() {
        // Given: slope 20 per period, currently at 70
        AchievementPrediction prediction = model.predictGoalAchievement(series(30, 50, 70), goalAt(70));

        // Then: 0.7 + 20/100 * 0.5
        assertThat(prediction.probability()).isCloseTo(0.8, within(1e-9));
        assertThat(prediction.direction()).isEqualTo(TrendDirection.IMPROVING);
        assertThat(prediction.confidence()).isCloseTo(1.0, within(1e-9));
        assertThat(prediction.estimatedPeriods()).isEqualTo(2);
        assertThat(prediction.recommendations()).containsExactly("On track, continue the current care plan");
    }

    @Test
    @DisplayName("Should lower the probability for a declining goal and give no ETA")
    void shouldPenalizeDecliningGoal() {
        AchievementPrediction prediction = model.predictGoalAchievement(series(50, 40, 30), goalAt(30));

        // 0.3 - 10/100 * 0.3
        assertThat(prediction.probability()).isCloseTo(0.27, within(1e-9));
        assertThat(prediction.estimatedPeriods()).isNull();
        assertThat(prediction.recommendations()).contains("Revise intervention strategy");
    }

    @Test
    @DisplayName("Should keep the probability within 0..1")
    void shouldClampProbability() {
        AchievementPrediction prediction = model.predictGoalAchievement(series(0, 90, 180), goalAt(95));

        assertThat(prediction.probability()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should give no ETA for a flat series or a completed goal")
    void shouldReturnNullEta() {
        assertThat(model.estimateTimeToCompletion(series(40, 40, 40), goalAt(40))).isNull();
        assertThat(model.estimateTimeToCompletion(series(80, 90, 100), goalAt(100))).isNull();
        assertThat(model.estimateTimeToCompletion(series(10), goalAt(10))).isNull();
    }

    @Test
    @DisplayName("Should round the ETA up to whole periods")
    void shouldRoundEtaUp() {
        // 70 remaining at 30 per period
        assertThat(model.estimateTimeToCompletion(series(0, 30), goalAt(30))).isEqualTo(3);
    }

    @Test
    @DisplayName("Should build the progress series from recorded observations")
    void shouldBuildProgressSeries() {
        Goal goal = goalAt(50);
        goal.getObservations().add(new ProgressObservation(Instant.parse("2026-03-01T00:00:00Z"), 10, 10));
        goal.getObservations().add(new ProgressObservation(Instant.parse("2026-03-02T00:00:00Z"), 50, 50));

        List<SeriesPoint> series = model.progressSeries(goal);

        assertThat(series).extracting(SeriesPoint::index).containsExactly(0, 1);
        assertThat(series).extracting(SeriesPoint::value).containsExactly(10.0, 50.0);
    }
}
