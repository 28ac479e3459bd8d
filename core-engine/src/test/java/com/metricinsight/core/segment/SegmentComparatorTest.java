package com.metricinsight.core.segment;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.RankedSegment;
import com.metricinsight.core.model.SegmentDifferences;
import com.metricinsight.core.model.SegmentStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SegmentComparator}.
 */
class SegmentComparatorTest {

    private SegmentComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new SegmentComparator(new AnalysisConfig());
    }

    // ---------------------------------------------------------------
    // rankSegments
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should rank by descending average with relative and share of total")
    void shouldRankByAverage() {
        List<RankedSegment> ranked = comparator.rankSegments(List.of(
                segment("a", 10, 100), segment("b", 30, 300), segment("c", 20, 100)));

        assertThat(ranked).extracting(RankedSegment::getName).containsExactly("b", "c", "a");
        assertThat(ranked).extracting(RankedSegment::getRank).containsExactly(1, 2, 3);
        assertThat(ranked.get(0).getRelative()).isEqualTo(1.0);
        assertThat(ranked.get(1).getRelative()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(ranked.get(0).getPercentOfTotal()).isCloseTo(60.0, within(1e-9));
        assertThat(ranked.get(2).getPercentOfTotal()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("Equal averages should be ordered by name")
    void tiesShouldOrderByName() {
        List<RankedSegment> ranked = comparator.rankSegments(List.of(
                segment("zeta", 5, 1), segment("alpha", 5, 1)));

        assertThat(ranked).extracting(RankedSegment::getName).containsExactly("alpha", "zeta");
    }

    @Test
    @DisplayName("Non-positive top average and zero counts should yield zero ratios")
    void degenerateInputsShouldYieldZeroRatios() {
        List<RankedSegment> ranked = comparator.rankSegments(List.of(
                segment("a", 0, 0), segment("b", -5, 0)));

        assertThat(ranked).extracting(RankedSegment::getRelative).containsOnly(0.0);
        assertThat(ranked).extracting(RankedSegment::getPercentOfTotal).containsOnly(0.0);
    }

    @Test
    @DisplayName("No segments should rank to an empty list")
    void emptyInputShouldRankToNothing() {
        assertThat(comparator.rankSegments(List.of())).isEmpty();
    }

    // ---------------------------------------------------------------
    // analyzeSegmentDifferences
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should flag a segment more than two stddevs from the mean of means")
    void shouldFlagOutlierSegment() {
        List<SegmentStats> segments = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            segments.add(segment("s" + i, 10, 1000));
        }
        segments.add(segment("hot", 100, 1));

        SegmentDifferences differences = comparator.analyzeSegmentDifferences(segments).get();

        assertThat(differences.getOverallMean()).isCloseTo(19.0, within(1e-9));
        assertThat(differences.getOverallStddev()).isCloseTo(27.0, within(1e-9));
        assertThat(differences.getOutliers()).containsExactly("hot");
        assertThat(differences.getCoefficientOfVariation()).isCloseTo(27.0 / 19.0 * 100, within(1e-9));
        assertThat(differences.getMinSegmentAvg()).isEqualTo(10.0);
        assertThat(differences.getMaxSegmentAvg()).isEqualTo(100.0);
        assertThat(differences.getRange()).isEqualTo(90.0);
        assertThat(differences.getRangeRatio()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Identical segments should have no outliers")
    void identicalSegmentsShouldHaveNoOutliers() {
        SegmentDifferences differences = comparator.analyzeSegmentDifferences(List.of(
                segment("a", 7, 1), segment("b", 7, 1))).get();

        assertThat(differences.getOverallStddev()).isZero();
        assertThat(differences.getOutliers()).isEmpty();
        assertThat(differences.getCoefficientOfVariation()).isZero();
        assertThat(differences.getRangeRatio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Non-positive minimum should give a range ratio of 0")
    void nonPositiveMinimumShouldGuardRangeRatio() {
        SegmentDifferences differences = comparator.analyzeSegmentDifferences(List.of(
                segment("a", -5, 1), segment("b", 5, 1))).get();

        assertThat(differences.getRangeRatio()).isZero();
        assertThat(differences.getCoefficientOfVariation()).isZero();
    }

    @Test
    @DisplayName("No segments should be insufficient")
    void emptyInputShouldBeInsufficient() {
        AnalysisResult<SegmentDifferences> result = comparator.analyzeSegmentDifferences(List.of());

        assertThat(result.isSufficient()).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SegmentStats segment(String name, double avg, double count) {
        return SegmentStats.builder().name(name).avg(avg).count(count).build();
    }
}
