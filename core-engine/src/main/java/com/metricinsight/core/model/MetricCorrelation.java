package com.metricinsight.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Correlation between a primary metric and one candidate metric.
 *
 * <p>
 * {@code coefficient} is the zero-lag Pearson coefficient. {@code lag} and
 * {@code laggedCoeff} describe the strongest shifted correlation found; when
 * no shift beats the zero-lag coefficient, {@code lag} is 0 and
 * {@code laggedCoeff == coefficient}. {@code lagOffset} converts the lag to
 * wall-clock time using the configured sample interval.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricCorrelation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final double coefficient;
    private final int lag;
    private final double laggedCoeff;
    private final int dataPoints;
    private final String relationship;
    private final Duration lagOffset;

    private MetricCorrelation(Builder b) {
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        this.relationship = Objects.requireNonNull(b.relationship, "relationship must not be null");
        this.lagOffset = Objects.requireNonNull(b.lagOffset, "lagOffset must not be null");
        this.coefficient = b.coefficient;
        this.lag = b.lag;
        this.laggedCoeff = b.laggedCoeff;
        this.dataPoints = b.dataPoints;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricCorrelation}; {@code metric},
     * {@code relationship} and {@code lagOffset} are required.
     */
    public static class Builder {
        private String metric;
        private double coefficient;
        private int lag;
        private double laggedCoeff;
        private int dataPoints;
        private String relationship;
        private Duration lagOffset = Duration.ZERO;

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder coefficient(double coefficient) {
            this.coefficient = coefficient;
            return this;
        }

        public Builder lag(int lag) {
            this.lag = lag;
            return this;
        }

        public Builder laggedCoeff(double laggedCoeff) {
            this.laggedCoeff = laggedCoeff;
            return this;
        }

        public Builder dataPoints(int dataPoints) {
            this.dataPoints = dataPoints;
            return this;
        }

        public Builder relationship(String relationship) {
            this.relationship = relationship;
            return this;
        }

        public Builder lagOffset(Duration lagOffset) {
            this.lagOffset = lagOffset;
            return this;
        }

        public MetricCorrelation build() {
            return new MetricCorrelation(this);
        }
    }

    public String getMetric() {
        return metric;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public int getLag() {
        return lag;
    }

    public double getLaggedCoeff() {
        return laggedCoeff;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public String getRelationship() {
        return relationship;
    }

    public Duration getLagOffset() {
        return lagOffset;
    }

    @Override
    public String toString() {
        return "MetricCorrelation{" +
                "metric='" + metric + '\'' +
                ", coefficient=" + coefficient +
                ", lag=" + lag +
                ", laggedCoeff=" + laggedCoeff +
                ", dataPoints=" + dataPoints +
                ", relationship='" + relationship + '\'' +
                '}';
    }
}
