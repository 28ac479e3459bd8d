package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Moment and order statistics of a sample.
 *
 * <p>
 * Variance, skewness and kurtosis use the population divisor {@code n}.
 * Kurtosis is <em>excess</em> kurtosis (zero for a normal distribution).
 * Instances satisfy {@code variance >= 0}, {@code stdDev == sqrt(variance)}
 * and {@code min <= median <= max}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DistributionStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double median;
    private final double mode;
    private final double stdDev;
    private final double variance;
    private final double skewness;
    private final double kurtosis;
    private final double min;
    private final double max;
    private final int count;

    private DistributionStats(Builder b) {
        this.mean = b.mean;
        this.median = b.median;
        this.mode = b.mode;
        this.stdDev = b.stdDev;
        this.variance = b.variance;
        this.skewness = b.skewness;
        this.kurtosis = b.kurtosis;
        this.min = b.min;
        this.max = b.max;
        this.count = b.count;
    }

    /**
     * @return zero-valued statistics for an empty sample
     */
    public static DistributionStats empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DistributionStats}. Unset fields default to 0.
     */
    public static class Builder {
        private double mean;
        private double median;
        private double mode;
        private double stdDev;
        private double variance;
        private double skewness;
        private double kurtosis;
        private double min;
        private double max;
        private int count;

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder median(double median) {
            this.median = median;
            return this;
        }

        public Builder mode(double mode) {
            this.mode = mode;
            return this;
        }

        public Builder stdDev(double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        public Builder variance(double variance) {
            this.variance = variance;
            return this;
        }

        public Builder skewness(double skewness) {
            this.skewness = skewness;
            return this;
        }

        public Builder kurtosis(double kurtosis) {
            this.kurtosis = kurtosis;
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public DistributionStats build() {
            return new DistributionStats(this);
        }
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getMode() {
        return mode;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getVariance() {
        return variance;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
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
        if (!(o instanceof DistributionStats that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(mode, that.mode) == 0
                && Double.compare(variance, that.variance) == 0
                && Double.compare(skewness, that.skewness) == 0
                && Double.compare(kurtosis, that.kurtosis) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && count == that.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, median, mode, variance, skewness, kurtosis, min, max, count);
    }

    @Override
    public String toString() {
        return "DistributionStats{" +
                "mean=" + mean +
                ", median=" + median +
                ", mode=" + mode +
                ", stdDev=" + stdDev +
                ", variance=" + variance +
                ", skewness=" + skewness +
                ", kurtosis=" + kurtosis +
                ", min=" + min +
                ", max=" + max +
                ", count=" + count +
                '}';
    }
}
