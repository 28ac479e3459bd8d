package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Ordinary least-squares fit of value against sample index
 * ({@code 0..n-1}): {@code value ≈ slope·i + intercept}.
 *
 * @since 1.0.0
 */
public final class LinearTrend implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double slope;
    private final double intercept;
    private final TrendDirection direction;
    private final TrendStrength strength;
    private final double rSquared;

    /** Change of the fitted line from the first to the last sample, in percent. */
    private final double percentChange;

    public LinearTrend(double slope, double intercept, TrendDirection direction,
                       TrendStrength strength, double rSquared, double percentChange) {
        this.slope = slope;
        this.intercept = intercept;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.strength = Objects.requireNonNull(strength, "strength must not be null");
        this.rSquared = rSquared;
        this.percentChange = percentChange;
    }

    /**
     * Evaluate the fitted line at a sample index.
     *
     * @param index sample index; may lie beyond the fitted range
     * @return fitted value
     */
    public double valueAt(double index) {
        return slope * index + intercept;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public TrendStrength getStrength() {
        return strength;
    }

    public double getRSquared() {
        return rSquared;
    }

    public double getPercentChange() {
        return percentChange;
    }

    @Override
    public String toString() {
        return "LinearTrend{" +
                "slope=" + slope +
                ", intercept=" + intercept +
                ", direction=" + direction +
                ", strength=" + strength +
                ", rSquared=" + rSquared +
                ", percentChange=" + percentChange +
                '}';
    }
}
