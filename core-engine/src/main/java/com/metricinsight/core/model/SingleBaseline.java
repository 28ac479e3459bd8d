package com.metricinsight.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Summary statistics and requested percentiles of one metric (or of one
 * group within a {@link GroupedBaseline}, in which case {@code metric} holds
 * the group name).
 *
 * @since 1.0.0
 */
public final class SingleBaseline implements BaselineResult {

    private final String metric;
    private final double avg;
    private final double stddev;
    private final double min;
    private final double max;
    private final int count;
    private final SortedMap<Double, Double> percentiles;

    public SingleBaseline(String metric, Statistics statistics, Map<Double, Double> percentiles) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        this.avg = statistics.getMean();
        this.stddev = statistics.getStdDev();
        this.min = statistics.getMin();
        this.max = statistics.getMax();
        this.count = statistics.getCount();
        this.percentiles = Collections.unmodifiableSortedMap(new TreeMap<>(percentiles));
    }

    @Override
    public String getMetric() {
        return metric;
    }

    @Override
    public boolean isGrouped() {
        return false;
    }

    public double getAvg() {
        return avg;
    }

    public double getStddev() {
        return stddev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public int getCount() {
        return count;
    }

    public SortedMap<Double, Double> getPercentiles() {
        return percentiles;
    }

    /**
     * @param rank percentile rank, e.g. {@code 95}
     * @return the value, or empty if that rank was not requested
     */
    public OptionalDouble percentile(double rank) {
        Double value = percentiles.get(rank);
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "SingleBaseline{" +
                "metric='" + metric + '\'' +
                ", avg=" + avg +
                ", stddev=" + stddev +
                ", min=" + min +
                ", max=" + max +
                ", count=" + count +
                ", percentiles=" + percentiles +
                '}';
    }
}
