package com.metricinsight.core.segment;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.RankedSegment;
import com.metricinsight.core.model.SegmentDifferences;
import com.metricinsight.core.model.SegmentStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks pre-aggregated segments and flags those whose average stands apart.
 *
 * <p>
 * Cross-segment statistics are computed over the segment averages with equal
 * weight per segment, regardless of how many samples each segment holds.
 * </p>
 *
 * @since 1.0.0
 */
public class SegmentComparator {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentComparator.class);

    static final int MIN_SEGMENTS = 1;

    private static final Comparator<SegmentStats> BY_AVG_THEN_NAME =
            Comparator.comparingDouble(SegmentStats::getAvg).reversed()
                    .thenComparing(SegmentStats::getName);

    private final double outlierSigma;

    public SegmentComparator(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.outlierSigma = config.getSegmentOutlierSigma();
    }

    /**
     * Rank segments by descending average, ties by name.
     *
     * @param segments segments in any order; must not be {@code null}
     * @return ranked segments, rank 1 first
     */
    public List<RankedSegment> rankSegments(List<SegmentStats> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            return List.of();
        }

        List<SegmentStats> sorted = new ArrayList<>(segments);
        sorted.sort(BY_AVG_THEN_NAME);

        double topAvg = sorted.get(0).getAvg();
        double totalCount = 0;
        for (SegmentStats segment : sorted) {
            totalCount += segment.getCount();
        }

        List<RankedSegment> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            SegmentStats segment = sorted.get(i);
            double relative = topAvg > 0 ? segment.getAvg() / topAvg : 0;
            double percentOfTotal = totalCount != 0 ? segment.getCount() / totalCount * 100 : 0;
            ranked.add(new RankedSegment(segment, i + 1, relative, percentOfTotal));
        }
        return ranked;
    }

    /**
     * Compare segment averages against each other.
     *
     * @param segments segments in any order; must not be {@code null}
     * @return the comparison, or insufficient data when there are no segments
     */
    public AnalysisResult<SegmentDifferences> analyzeSegmentDifferences(List<SegmentStats> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        int n = segments.size();
        if (n < MIN_SEGMENTS) {
            return AnalysisResult.insufficientData(MIN_SEGMENTS, n,
                    "segment comparison needs at least one segment");
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (SegmentStats segment : segments) {
            sum += segment.getAvg();
            min = Math.min(min, segment.getAvg());
            max = Math.max(max, segment.getAvg());
        }
        double mean = sum / n;

        double sumSquares = 0;
        for (SegmentStats segment : segments) {
            double diff = segment.getAvg() - mean;
            sumSquares += diff * diff;
        }
        double stddev = Math.sqrt(sumSquares / n);

        List<String> outliers = new ArrayList<>();
        if (stddev > 0) {
            for (SegmentStats segment : segments) {
                if (Math.abs(segment.getAvg() - mean) > outlierSigma * stddev) {
                    outliers.add(segment.getName());
                }
            }
        }

        double cv = mean == 0 ? 0 : stddev / Math.abs(mean) * 100;
        double rangeRatio = min > 0 ? max / min : 0;

        LOG.debug("Compared {} segments: mean={} stddev={} outliers={}", n, mean, stddev, outliers);
        return AnalysisResult.of(new SegmentDifferences(mean, stddev, cv, outliers, min, max, rangeRatio));
    }
}
