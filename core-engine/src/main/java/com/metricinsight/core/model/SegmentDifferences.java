package com.metricinsight.core.model;

import java.util.List;

/**
 * Spread of the per-segment averages.
 *
 * <p>
 * {@code overallMean} and {@code overallStddev} are the unweighted mean and
 * population standard deviation of the segment averages (a mean of means;
 * segment counts play no part).
 * </p>
 *
 * @since 1.0.0
 */
public final class SegmentDifferences {

    private final double overallMean;
    private final double overallStddev;
    private final double coefficientOfVariation;
    private final List<String> outliers;
    private final double minSegmentAvg;
    private final double maxSegmentAvg;
    private final double range;
    private final double rangeRatio;

    public SegmentDifferences(double overallMean, double overallStddev, double coefficientOfVariation,
                              List<String> outliers, double minSegmentAvg, double maxSegmentAvg,
                              double rangeRatio) {
        this.overallMean = overallMean;
        this.overallStddev = overallStddev;
        this.coefficientOfVariation = coefficientOfVariation;
        this.outliers = List.copyOf(outliers);
        this.minSegmentAvg = minSegmentAvg;
        this.maxSegmentAvg = maxSegmentAvg;
        this.range = maxSegmentAvg - minSegmentAvg;
        this.rangeRatio = rangeRatio;
    }

    public double getOverallMean() {
        return overallMean;
    }

    public double getOverallStddev() {
        return overallStddev;
    }

    public double getCoefficientOfVariation() {
        return coefficientOfVariation;
    }

    /** @return names of outlier segments, in descending-average order */
    public List<String> getOutliers() {
        return outliers;
    }

    public double getMinSegmentAvg() {
        return minSegmentAvg;
    }

    public double getMaxSegmentAvg() {
        return maxSegmentAvg;
    }

    public double getRange() {
        return range;
    }

    /** @return {@code max / min} of the segment averages; 0 when the minimum is not positive */
    public double getRangeRatio() {
        return rangeRatio;
    }

    @Override
    public String toString() {
        return "SegmentDifferences{" +
                "overallMean=" + overallMean +
                ", overallStddev=" + overallStddev +
                ", coefficientOfVariation=" + coefficientOfVariation +
                ", outliers=" + outliers +
                ", range=" + range +
                ", rangeRatio=" + rangeRatio +
                '}';
    }
}
