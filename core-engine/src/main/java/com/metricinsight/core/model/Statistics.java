package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Population summary of a window or series: mean, standard deviation,
 * extremes and sample count.
 *
 * @since 1.0.0
 */
public final class Statistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Statistics EMPTY = new Statistics(0, 0, 0, 0, 0);

    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final int count;

    public Statistics(double mean, double stdDev, double min, double max, int count) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.count = count;
    }

    /**
     * @return zero-valued statistics for an empty input
     */
    public static Statistics empty() {
        return EMPTY;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
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

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Statistics that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && count == that.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, min, max, count);
    }

    @Override
    public String toString() {
        return "Statistics{" +
                "mean=" + mean +
                ", stdDev=" + stdDev +
                ", min=" + min +
                ", max=" + max +
                ", count=" + count +
                '}';
    }
}
