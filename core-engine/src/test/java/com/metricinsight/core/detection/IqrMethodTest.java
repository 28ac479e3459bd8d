package com.metricinsight.core.detection;

import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IqrMethod}.
 */
class IqrMethodTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final int SPIKE_INDEX = 49;

    private final IqrMethod method = new IqrMethod();

    @Test
    @DisplayName("Score should grow with the distance beyond the upper fence")
    void scoreShouldGrowWithMagnitude() {
        // q1 = 100, q3 = 101, multiplier 2.0 at sensitivity 0.5 -> fences [98, 103]
        double small = singleScore(103.5);
        double medium = singleScore(104.0);
        double large = singleScore(104.5);

        assertThat(small).isCloseTo(0.25, within(1e-9));
        assertThat(medium).isCloseTo(0.5, within(1e-9));
        assertThat(large).isCloseTo(0.75, within(1e-9));
        assertThat(small).isLessThan(medium);
        assertThat(medium).isLessThan(large);
    }

    @Test
    @DisplayName("Should flag values below the lower fence")
    void shouldFlagLowOutlier() {
        List<Anomaly> anomalies = method.detect(jitterWithSpike(96.5), 0.5);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getScore()).isCloseTo(0.75, within(1e-9));
        assertThat(anomalies.get(0).getMessage()).contains("outside IQR bounds");
    }

    @Test
    @DisplayName("Values inside the fences should not be flagged")
    void shouldIgnoreValuesInsideFences() {
        assertThat(method.detect(jitterWithSpike(102.5), 0.5)).isEmpty();
    }

    @Test
    @DisplayName("Zero IQR should score any off-quartile value as 1")
    void zeroIqrShouldScoreOne() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            points.add(TimeSeriesPoint.of(at(i), i == 7 ? 11 : 10));
        }

        List<Anomaly> anomalies = method.detect(points, 0.5);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getTimestamp()).isEqualTo(at(7));
        assertThat(anomalies.get(0).getScore()).isEqualTo(1.0);
        assertThat(anomalies.get(0).getType()).isEqualTo("iqr");
    }

    @Test
    @DisplayName("Empty series should yield no candidates")
    void emptySeriesShouldYieldNothing() {
        assertThat(method.detect(List.of(), 0.5)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private double singleScore(double spike) {
        List<Anomaly> anomalies = method.detect(jitterWithSpike(spike), 0.5);
        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getTimestamp()).isEqualTo(at(SPIKE_INDEX));
        return anomalies.get(0).getScore();
    }

    /** 50 samples alternating 100 / 101 with the last one replaced by {@code spike}. */
    private static List<TimeSeriesPoint> jitterWithSpike(double spike) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            double value = i == SPIKE_INDEX ? spike : (i % 2 == 0 ? 100 : 101);
            points.add(TimeSeriesPoint.of(at(i), value));
        }
        return points;
    }

    private static Instant at(int index) {
        return T0.plus(Duration.ofMinutes(5L * index));
    }
}
