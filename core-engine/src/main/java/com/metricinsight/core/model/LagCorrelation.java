package com.metricinsight.core.model;

import java.io.Serializable;

/**
 * Pearson coefficient of two series after shifting one by {@code lag}
 * samples. A positive lag means the second series trails the first.
 *
 * @since 1.0.0
 */
public final class LagCorrelation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int lag;
    private final double coefficient;

    /** Number of sample pairs that overlapped after the shift. */
    private final int overlap;

    public LagCorrelation(int lag, double coefficient, int overlap) {
        this.lag = lag;
        this.coefficient = coefficient;
        this.overlap = overlap;
    }

    public int getLag() {
        return lag;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public int getOverlap() {
        return overlap;
    }

    @Override
    public String toString() {
        return "LagCorrelation{lag=" + lag + ", coefficient=" + coefficient
                + ", overlap=" + overlap + '}';
    }
}
