package com.metricinsight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single metric sample: a value observed at an instant.
 *
 * <p>
 * A series of points is conceptually keyed by timestamp. Duplicate
 * timestamps must be resolved before a series reaches an analyzer (see
 * {@link com.metricinsight.core.extract.TimeSeriesExtractor}).
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp sample instant; must not be {@code null}
     * @param value     sample value
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public TimeSeriesPoint(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public static TimeSeriesPoint of(Instant timestamp, double value) {
        return new TimeSeriesPoint(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "TimeSeriesPoint{" + timestamp + "=" + value + '}';
    }
}
