package com.metricinsight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Forecast uncertainty band at one future timestamp.
 *
 * @since 1.0.0
 */
public final class ConfidenceInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double lower;
    private final double upper;

    public ConfidenceInterval(Instant timestamp, double lower, double upper) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.lower = lower;
        this.upper = upper;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public double width() {
        return upper - lower;
    }

    @Override
    public String toString() {
        return "ConfidenceInterval{" + timestamp + " [" + lower + ", " + upper + "]}";
    }
}
