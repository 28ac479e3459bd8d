package com.metricinsight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A timestamp at which the local mean shifts: {@code oldValue} is the mean
 * of the window before it, {@code newValue} the mean of the window starting
 * at it.
 *
 * @since 1.0.0
 */
public final class ChangePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double oldValue;
    private final double newValue;
    private final double confidence;
    private final ChangeType type;

    public ChangePoint(Instant timestamp, double oldValue, double newValue,
                       double confidence, ChangeType type) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.confidence = confidence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getOldValue() {
        return oldValue;
    }

    public double getNewValue() {
        return newValue;
    }

    public double getConfidence() {
        return confidence;
    }

    public ChangeType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "ChangePoint{" +
                "timestamp=" + timestamp +
                ", oldValue=" + oldValue +
                ", newValue=" + newValue +
                ", confidence=" + confidence +
                ", type=" + type +
                '}';
    }
}
