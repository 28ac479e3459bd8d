package com.metricinsight.core.detection;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.AnomalyReport;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private AnalysisConfig config;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        config = new AnalysisConfig();
        detector = new AnomalyDetector(config);
    }

    // ---------------------------------------------------------------
    // detect
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Flat series with one spike should yield exactly one anomaly at the spike")
    void shouldFindSingleSpikeInFlatSeries() {
        AnalysisResult<AnomalyReport> result = detector.detect(flatWithSpike(20, 100));

        assertThat(result.isSufficient()).isTrue();
        List<Anomaly> anomalies = result.get().getAnomalies();
        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getTimestamp()).isEqualTo(at(20));
        assertThat(anomalies.get(0).getValue()).isEqualTo(100.0);
        assertThat(anomalies.get(0).getType()).isEqualTo("multi-detection (2 methods)");
        assertThat(anomalies.get(0).getScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Score should strictly increase with spike magnitude for a fixed method")
    void scoreShouldIncreaseWithMagnitude() {
        AnomalyDetector iqrOnly = new AnomalyDetector(config, List.of(new IqrMethod()));

        double previous = -1;
        for (double spike : new double[] {103.5, 104.0, 104.5}) {
            List<Anomaly> anomalies = iqrOnly.detect(jitterWithSpike(spike)).get().getAnomalies();

            assertThat(anomalies).hasSize(1);
            assertThat(anomalies.get(0).getTimestamp()).isEqualTo(at(49));
            assertThat(anomalies.get(0).getScore()).isGreaterThan(previous);
            previous = anomalies.get(0).getScore();
        }
    }

    @Test
    @DisplayName("Report should carry the normal range and severity counts")
    void reportShouldSummariseSeries() {
        AnomalyReport report = detector.detect(flatWithSpike(20, 100)).get();

        Statistics stats = report.getStatistics();
        assertThat(stats.getCount()).isEqualTo(50);
        assertThat(stats.getMean()).isCloseTo(11.8, within(1e-9));
        assertThat(report.getNormalRangeLower()).isCloseTo(stats.getMean() - 2 * stats.getStdDev(), within(1e-9));
        assertThat(report.getNormalRangeUpper()).isCloseTo(stats.getMean() + 2 * stats.getStdDev(), within(1e-9));
        assertThat(report.getSevereCount()).isEqualTo(1);
        assertThat(report.getModerateCount()).isZero();
    }

    @Test
    @DisplayName("Should accept unordered input")
    void shouldSortInput() {
        List<TimeSeriesPoint> shuffled = new ArrayList<>(flatWithSpike(20, 100));
        Collections.reverse(shuffled);

        List<Anomaly> anomalies = detector.detect(shuffled).get().getAnomalies();

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getTimestamp()).isEqualTo(at(20));
    }

    @Test
    @DisplayName("Empty series should report insufficient data")
    void emptySeriesShouldBeInsufficient() {
        AnalysisResult<AnomalyReport> result = detector.detect(List.of());

        assertThat(result.isSufficient()).isFalse();
        assertThat(result.getInsufficientData()).hasValueSatisfying(d -> {
            assertThat(d.getRequired()).isEqualTo(1);
            assertThat(d.getActual()).isZero();
        });
    }

    @Test
    @DisplayName("Should reject sensitivity outside [0, 1]")
    void shouldRejectOutOfRangeSensitivity() {
        assertThatThrownBy(() -> detector.detect(flatWithSpike(3, 20), 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sensitivity");
        assertThatThrownBy(() -> detector.detect(flatWithSpike(3, 20), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject duplicate timestamps")
    void shouldRejectDuplicateTimestamps() {
        List<TimeSeriesPoint> points = List.of(TimeSeriesPoint.of(T0, 1), TimeSeriesPoint.of(T0, 2));

        assertThatThrownBy(() -> detector.detect(points))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate timestamp");
    }

    @Test
    @DisplayName("Should require at least one detection method")
    void shouldRequireMethods() {
        assertThatThrownBy(() -> new AnomalyDetector(config, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // deduplicateAndScore
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Candidates sharing a timestamp should merge with an amplified score")
    void shouldMergeSameTimestamp() {
        List<Anomaly> merged = AnomalyDetector.deduplicateAndScore(List.of(
                anomaly(1, 0.5, "z-score"),
                anomaly(1, 0.4, "iqr"),
                anomaly(2, 0.9, "iqr")));

        assertThat(merged).hasSize(2);
        assertThat(merged.get(0).getTimestamp()).isEqualTo(at(2));
        assertThat(merged.get(0).getType()).isEqualTo("iqr");

        Anomaly combined = merged.get(1);
        assertThat(combined.getTimestamp()).isEqualTo(at(1));
        assertThat(combined.getScore()).isCloseTo(0.5 * Math.sqrt(2), within(1e-9));
        assertThat(combined.getType()).isEqualTo("multi-detection (2 methods)");
        assertThat(combined.getMessage()).isEqualTo("Detected by 2 methods: z-score, iqr");
    }

    @Test
    @DisplayName("Merged score should be capped at 1")
    void mergedScoreShouldBeCapped() {
        List<Anomaly> merged = AnomalyDetector.deduplicateAndScore(List.of(
                anomaly(1, 0.9, "z-score"),
                anomaly(1, 0.8, "iqr"),
                anomaly(1, 0.7, "moving-average")));

        assertThat(merged).singleElement().satisfies(a -> {
            assertThat(a.getScore()).isEqualTo(1.0);
            assertThat(a.getType()).isEqualTo("multi-detection (3 methods)");
        });
    }

    @Test
    @DisplayName("Equal scores should be ordered by ascending timestamp")
    void tiesShouldOrderByTimestamp() {
        List<Anomaly> merged = AnomalyDetector.deduplicateAndScore(List.of(
                anomaly(7, 0.5, "iqr"),
                anomaly(3, 0.5, "iqr"),
                anomaly(5, 0.5, "iqr")));

        assertThat(merged).extracting(Anomaly::getTimestamp).containsExactly(at(3), at(5), at(7));
    }

    @Test
    @DisplayName("No candidates should produce an empty list")
    void noCandidatesShouldProduceEmptyList() {
        assertThat(AnomalyDetector.deduplicateAndScore(List.of())).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Instant at(int index) {
        return T0.plus(Duration.ofMinutes(5L * index));
    }

    private static Anomaly anomaly(int index, double score, String type) {
        return Anomaly.builder().timestamp(at(index)).value(index).score(score).type(type).build();
    }

    /** 50 samples at 10 with {@code spike} at {@code index}. */
    private static List<TimeSeriesPoint> flatWithSpike(int index, double spike) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            points.add(TimeSeriesPoint.of(at(i), i == index ? spike : 10));
        }
        return points;
    }

    /** 50 samples alternating 100 / 101 with the last one replaced by {@code spike}. */
    // Jittered so the IQR is non-zero; on a flat series every spike scores 1.0.
    private static List<TimeSeriesPoint> jitterWithSpike(double spike) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            points.add(TimeSeriesPoint.of(at(i), i == 49 ? spike : (i % 2 == 0 ? 100 : 101)));
        }
        return points;
    }
}
