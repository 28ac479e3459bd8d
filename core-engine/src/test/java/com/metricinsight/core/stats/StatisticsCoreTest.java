package com.metricinsight.core.stats;

import com.metricinsight.core.model.DistributionStats;
import com.metricinsight.core.model.DistributionType;
import com.metricinsight.core.model.HistogramBucket;
import com.metricinsight.core.model.Statistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticsCore}.
 */
class StatisticsCoreTest {

    private static final double EPS = 1e-9;

    // ---------------------------------------------------------------
    // Distribution statistics
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Constant sample should have zero spread, skewness and kurtosis")
    void constantSampleShouldBeDegenerate() {
        DistributionStats stats = StatisticsCore.computeDistributionStats(new double[] {10, 10, 10, 10, 10});

        assertThat(stats.getMean()).isEqualTo(10.0);
        assertThat(stats.getStdDev()).isZero();
        assertThat(stats.getVariance()).isZero();
        assertThat(stats.getSkewness()).isZero();
        assertThat(stats.getKurtosis()).isZero();
        assertThat(stats.getMedian()).isEqualTo(10.0);
        assertThat(stats.getMode()).isEqualTo(10.0);
        assertThat(StatisticsCore.detectDistributionType(stats)).isEqualTo(DistributionType.NORMAL);
    }

    @Test
    @DisplayName("Should use population moments and excess kurtosis")
    void shouldComputePopulationMoments() {
        DistributionStats stats = StatisticsCore.computeDistributionStats(new double[] {1, 2, 3, 4, 5});

        assertThat(stats.getMean()).isEqualTo(3.0);
        assertThat(stats.getVariance()).isCloseTo(2.0, within(EPS));
        assertThat(stats.getStdDev()).isCloseTo(Math.sqrt(2.0), within(EPS));
        assertThat(stats.getSkewness()).isCloseTo(0.0, within(EPS));
        assertThat(stats.getKurtosis()).isCloseTo(-1.3, within(EPS));
        assertThat(stats.getMin()).isEqualTo(1.0);
        assertThat(stats.getMax()).isEqualTo(5.0);
        assertThat(stats.getCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Empty sample should yield zero-valued statistics")
    void emptySampleShouldBeZero() {
        DistributionStats stats = StatisticsCore.computeDistributionStats(new double[0]);

        assertThat(stats).isEqualTo(DistributionStats.empty());
        assertThat(stats.getCount()).isZero();
    }

    @Test
    @DisplayName("Should reject unsorted input")
    void shouldRejectUnsortedInput() {
        assertThatThrownBy(() -> StatisticsCore.computeDistributionStats(new double[] {3, 1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sorted");
    }

    @Test
    @DisplayName("describe() should sort before computing")
    void describeShouldSortFirst() {
        DistributionStats stats = StatisticsCore.describe(new double[] {5, 1, 4, 2, 3});

        assertThat(stats.getMedian()).isEqualTo(3.0);
        assertThat(stats.getMin()).isEqualTo(1.0);
        assertThat(stats.getMax()).isEqualTo(5.0);
    }

    // ---------------------------------------------------------------
    // Percentile and mode
    // ---------------------------------------------------------------

    @ParameterizedTest(name = "p{0} of [1,2,3,4] = {1}")
    @CsvSource({"0, 1.0", "25, 1.75", "50, 2.5", "75, 3.25", "100, 4.0"})
    @DisplayName("Should interpolate percentiles linearly")
    void shouldInterpolatePercentiles(double p, double expected) {
        assertThat(StatisticsCore.percentile(new double[] {1, 2, 3, 4}, p)).isCloseTo(expected, within(EPS));
    }

    @Test
    @DisplayName("Percentile of an empty sample should be 0")
    void percentileOfEmptyShouldBeZero() {
        assertThat(StatisticsCore.percentile(new double[0], 50)).isZero();
    }

    @Test
    @DisplayName("Should reject percentile ranks outside [0, 100]")
    void shouldRejectOutOfRangePercentile() {
        assertThatThrownBy(() -> StatisticsCore.percentile(new double[] {1, 2}, 101))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StatisticsCore.percentile(new double[] {1, 2}, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Mode should pick the most frequent value")
    void modeShouldPickMostFrequent() {
        assertThat(StatisticsCore.mode(new double[] {1, 2, 2, 3})).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Mode ties should resolve to the lowest value")
    void modeTieShouldPickLowest() {
        assertThat(StatisticsCore.mode(new double[] {1, 1, 2, 2, 3, 3})).isEqualTo(1.0);
        assertThat(StatisticsCore.mode(new double[] {4, 7, 9})).isEqualTo(4.0);
    }

    // ---------------------------------------------------------------
    // Histogram
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Histogram counts should sum to n and cover [min, max]")
    void histogramShouldCoverRange() {
        double[] values = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

        List<HistogramBucket> buckets = StatisticsCore.createHistogram(values, 5);

        assertThat(buckets).hasSize(5);
        assertThat(buckets).extracting(HistogramBucket::getCount).containsExactly(2, 2, 2, 2, 2);
        assertThat(buckets.get(0).getStart()).isEqualTo(0.0);
        assertThat(buckets.get(4).getEnd()).isEqualTo(9.0);
        assertThat(buckets).extracting(HistogramBucket::getPercentage).containsOnly(20.0);
    }

    @Test
    @DisplayName("Maximum value should land in the last bucket")
    void maxShouldLandInLastBucket() {
        List<HistogramBucket> buckets = StatisticsCore.createHistogram(new double[] {0, 10}, 2);

        assertThat(buckets.get(0).getCount()).isEqualTo(1);
        assertThat(buckets.get(1).getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Constant sample should put every value in the last bucket")
    void constantHistogramShouldFillLastBucket() {
        List<HistogramBucket> buckets = StatisticsCore.createHistogram(new double[] {5, 5, 5}, 4);

        assertThat(buckets).extracting(HistogramBucket::getCount).containsExactly(0, 0, 0, 3);
    }

    @Test
    @DisplayName("Empty sample should produce no buckets")
    void emptyHistogramShouldBeEmpty() {
        assertThat(StatisticsCore.createHistogram(new double[0], 10)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive bucket count")
    void shouldRejectNonPositiveBuckets() {
        assertThatThrownBy(() -> StatisticsCore.createHistogram(new double[] {1}, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numBuckets");
    }

    // ---------------------------------------------------------------
    // Shape classification
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Long right tail should be classified right-skewed")
    void shouldDetectRightSkew() {
        DistributionStats stats = StatisticsCore.describe(new double[] {1, 1, 1, 1, 1, 1, 1, 1, 1, 10});

        assertThat(stats.getSkewness()).isGreaterThan(1.0);
        assertThat(StatisticsCore.detectDistributionType(stats)).isEqualTo(DistributionType.RIGHT_SKEWED);
    }

    @Test
    @DisplayName("Long left tail should be classified left-skewed")
    void shouldDetectLeftSkew() {
        DistributionStats stats = StatisticsCore.describe(new double[] {10, 10, 10, 10, 10, 10, 10, 10, 10, 1});

        assertThat(StatisticsCore.detectDistributionType(stats)).isEqualTo(DistributionType.LEFT_SKEWED);
    }

    @Test
    @DisplayName("Uniform spread should be classified platykurtic")
    void shouldDetectPlatykurtic() {
        DistributionStats stats = StatisticsCore.describe(new double[] {1, 2, 3, 4, 5});

        assertThat(StatisticsCore.detectDistributionType(stats)).isEqualTo(DistributionType.PLATYKURTIC);
    }

    @Test
    @DisplayName("Values between the normal band and the shape thresholds should be non-normal")
    void shouldFallThroughToNonNormal() {
        DistributionStats stats = DistributionStats.builder().skewness(0.7).kurtosis(0.0).build();

        assertThat(StatisticsCore.detectDistributionType(stats)).isEqualTo(DistributionType.NON_NORMAL);
        assertThat(StatisticsCore.detectDistributionType(stats, 1.0, 1.0, 2.0, 2.0))
                .isEqualTo(DistributionType.NORMAL);
    }

    // ---------------------------------------------------------------
    // Window statistics
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Window statistics should use the population standard deviation")
    void windowStatsShouldUsePopulationStdDev() {
        Statistics stats = StatisticsCore.windowStats(new double[] {2, 4, 4, 4, 5, 5, 7, 9});

        assertThat(stats.getMean()).isEqualTo(5.0);
        assertThat(stats.getStdDev()).isCloseTo(2.0, within(EPS));
        assertThat(stats.getMin()).isEqualTo(2.0);
        assertThat(stats.getMax()).isEqualTo(9.0);
        assertThat(stats.getCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Sub-range window statistics should ignore values outside the range")
    void windowStatsShouldHonourRange() {
        Statistics stats = StatisticsCore.windowStats(new double[] {100, 1, 2, 3, 100}, 1, 4);

        assertThat(stats.getMean()).isEqualTo(2.0);
        assertThat(stats.getCount()).isEqualTo(3);
        assertThat(stats.getMax()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Empty window should yield empty statistics")
    void emptyWindowShouldBeEmpty() {
        assertThat(StatisticsCore.windowStats(new double[0])).isEqualTo(Statistics.empty());
    }
}
