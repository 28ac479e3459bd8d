package com.metricinsight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A sample flagged as anomalous by one or more detection methods.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp} and {@code type} are required;
 * the score is clamped to {@code [0, 1]} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /** Severity in {@code [0, 1]}; higher is more anomalous. */
    private final double score;

    /** Detection method name, or a multi-detection label after merging. */
    private final String type;

    private final String message;

    private Anomaly(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.value = builder.value;
        this.score = clamp(builder.score);
        this.message = builder.message;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private double value;
        private double score;
        private String type;
        private String message;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException if {@code timestamp} or {@code type} is
         *                              {@code null}
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    private static double clamp(double score) {
        if (Double.isNaN(score) || score < 0) {
            return 0;
        }
        return Math.min(1.0, score);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getScore() {
        return score;
    }

    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && timestamp.equals(that.timestamp)
                && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, score, type);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                ", score=" + score +
                ", type='" + type + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
