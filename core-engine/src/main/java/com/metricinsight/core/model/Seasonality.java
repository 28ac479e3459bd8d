package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of a periodicity search.
 *
 * <p>
 * {@code period} is expressed in samples and {@code strength} is the
 * autocorrelation coefficient at that lag. When nothing is detected the
 * period is 0 and the pattern is {@code "none"}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Seasonality implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String NO_PATTERN = "none";

    private final boolean detected;
    private final int period;
    private final double strength;
    private final String pattern;

    public Seasonality(boolean detected, int period, double strength, String pattern) {
        this.detected = detected;
        this.period = period;
        this.strength = strength;
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
    }

    /**
     * @param bestStrength strongest autocorrelation seen, or 0 if no candidate
     *                     was tested
     * @return a not-detected result
     */
    public static Seasonality notDetected(double bestStrength) {
        return new Seasonality(false, 0, bestStrength, NO_PATTERN);
    }

    public boolean isDetected() {
        return detected;
    }

    public int getPeriod() {
        return period;
    }

    public double getStrength() {
        return strength;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "Seasonality{" +
                "detected=" + detected +
                ", period=" + period +
                ", strength=" + strength +
                ", pattern='" + pattern + '\'' +
                '}';
    }
}
