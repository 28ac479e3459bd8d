package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Describes why an analysis could not run on the data it was given.
 *
 * @since 1.0.0
 */
public final class InsufficientData implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Minimum number of samples the analysis needs. */
    private final int required;

    /** Number of usable samples actually supplied. */
    private final int actual;

    private final String reason;

    public InsufficientData(int required, int actual, String reason) {
        this.required = required;
        this.actual = actual;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InsufficientData that))
            return false;
        return required == that.required && actual == that.actual && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(required, actual, reason);
    }

    @Override
    public String toString() {
        return "InsufficientData{required=" + required
                + ", actual=" + actual
                + ", reason='" + reason + '\'' + '}';
    }
}
