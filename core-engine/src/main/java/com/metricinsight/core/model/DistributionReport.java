package com.metricinsight.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Shape, spread and histogram of a sample.
 *
 * @since 1.0.0
 */
public final class DistributionReport {

    private final DistributionStats stats;
    private final DistributionType distributionType;
    private final List<HistogramBucket> histogram;

    /** {@code stddev / |mean| · 100}; 0 when the mean is 0. */
    private final double coefficientOfVariation;

    private final Variability variability;

    /** Percentile rank (0–100) to value. */
    private final SortedMap<Double, Double> percentiles;

    private final HistogramBucket modalBucket;

    public DistributionReport(DistributionStats stats, DistributionType distributionType,
                              List<HistogramBucket> histogram, double coefficientOfVariation,
                              Variability variability, Map<Double, Double> percentiles,
                              HistogramBucket modalBucket) {
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.distributionType = Objects.requireNonNull(distributionType, "distributionType must not be null");
        this.histogram = List.copyOf(histogram);
        this.coefficientOfVariation = coefficientOfVariation;
        this.variability = Objects.requireNonNull(variability, "variability must not be null");
        this.percentiles = Collections.unmodifiableSortedMap(new TreeMap<>(percentiles));
        this.modalBucket = Objects.requireNonNull(modalBucket, "modalBucket must not be null");
    }

    public DistributionStats getStats() {
        return stats;
    }

    public DistributionType getDistributionType() {
        return distributionType;
    }

    public List<HistogramBucket> getHistogram() {
        return histogram;
    }

    public double getCoefficientOfVariation() {
        return coefficientOfVariation;
    }

    public Variability getVariability() {
        return variability;
    }

    public SortedMap<Double, Double> getPercentiles() {
        return percentiles;
    }

    /** @return the most populated histogram bucket (lowest bucket on ties) */
    public HistogramBucket getModalBucket() {
        return modalBucket;
    }

    @Override
    public String toString() {
        return "DistributionReport{" +
                "stats=" + stats +
                ", distributionType=" + distributionType +
                ", coefficientOfVariation=" + coefficientOfVariation +
                ", variability=" + variability +
                '}';
    }
}
