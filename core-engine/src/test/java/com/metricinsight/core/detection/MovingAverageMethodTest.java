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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MovingAverageMethod}.
 */
class MovingAverageMethodTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final MovingAverageMethod method = new MovingAverageMethod(12);

    @Test
    @DisplayName("Should reject a window smaller than two samples")
    void shouldRejectTinyWindow() {
        assertThatThrownBy(() -> new MovingAverageMethod(1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    @DisplayName("Should NOT evaluate a series no longer than the window")
    void shouldSkipShortSeries() {
        assertThat(method.detect(jitter(12, -1, 0), 1.0)).isEmpty();
    }

    @Test
    @DisplayName("Should skip windows with zero standard deviation")
    void shouldSkipFlatWindows() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            points.add(TimeSeriesPoint.of(at(i), i == 20 ? 100 : 10));
        }

        assertThat(method.detect(points, 0.5)).isEmpty();
    }

    @Test
    @DisplayName("Should flag a spike against a noisy window")
    void shouldFlagSpike() {
        List<Anomaly> anomalies = method.detect(jitter(50, 30, 110), 0.5);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getTimestamp()).isEqualTo(at(30));
        assertThat(anomalies.get(0).getScore()).isEqualTo(1.0);
        assertThat(anomalies.get(0).getType()).isEqualTo("moving-average");
    }

    @Test
    @DisplayName("Score should be the deviation over three window standard deviations")
    void shouldScoreRelativeToWindowSpread() {
        // Window mean 100.5, stddev 0.5; deviation 1.0 = 2 stddevs
        List<Anomaly> anomalies = method.detect(jitter(50, 30, 101.5), 0.5);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getScore()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Alternating 100 / 101 samples, with {@code spike} at {@code spikeIndex} (if non-negative). */
    private static List<TimeSeriesPoint> jitter(int size, int spikeIndex, double spike) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            double value = i == spikeIndex ? spike : (i % 2 == 0 ? 100 : 101);
            points.add(TimeSeriesPoint.of(at(i), value));
        }
        return points;
    }

    private static Instant at(int index) {
        return T0.plus(Duration.ofMinutes(5L * index));
    }
}
