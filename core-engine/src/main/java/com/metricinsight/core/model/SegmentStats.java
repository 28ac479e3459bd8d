package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Pre-aggregated statistics for one segment (one facet value) of a metric.
 * Percentiles are optional because not every upstream query returns them.
 *
 * @since 1.0.0
 */
public final class SegmentStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double avg;
    private final double count;
    private final double stddev;
    private final double min;
    private final double max;
    private final Double p50;
    private final Double p90;
    private final Double p95;

    private SegmentStats(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.avg = b.avg;
        this.count = b.count;
        this.stddev = b.stddev;
        this.min = b.min;
        this.max = b.max;
        this.p50 = b.p50;
        this.p90 = b.p90;
        this.p95 = b.p95;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SegmentStats}; {@code name} is required.
     */
    public static class Builder {
        private String name;
        private double avg;
        private double count;
        private double stddev;
        private double min;
        private double max;
        private Double p50;
        private Double p90;
        private Double p95;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder avg(double avg) {
            this.avg = avg;
            return this;
        }

        public Builder count(double count) {
            this.count = count;
            return this;
        }

        public Builder stddev(double stddev) {
            this.stddev = stddev;
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

        public Builder p50(Double p50) {
            this.p50 = p50;
            return this;
        }

        public Builder p90(Double p90) {
            this.p90 = p90;
            return this;
        }

        public Builder p95(Double p95) {
            this.p95 = p95;
            return this;
        }

        public SegmentStats build() {
            return new SegmentStats(this);
        }
    }

    public String getName() {
        return name;
    }

    public double getAvg() {
        return avg;
    }

    public double getCount() {
        return count;
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

    public OptionalDouble getP50() {
        return p50 != null ? OptionalDouble.of(p50) : OptionalDouble.empty();
    }

    public OptionalDouble getP90() {
        return p90 != null ? OptionalDouble.of(p90) : OptionalDouble.empty();
    }

    public OptionalDouble getP95() {
        return p95 != null ? OptionalDouble.of(p95) : OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SegmentStats that))
            return false;
        return name.equals(that.name)
                && Double.compare(avg, that.avg) == 0
                && Double.compare(count, that.count) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, avg, count);
    }

    @Override
    public String toString() {
        return "SegmentStats{" +
                "name='" + name + '\'' +
                ", avg=" + avg +
                ", count=" + count +
                ", stddev=" + stddev +
                '}';
    }
}
