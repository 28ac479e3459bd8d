package com.metricinsight.core.model;

/**
 * Coefficient-of-variation band of a sample.
 *
 * @since 1.0.0
 */
public enum Variability {

    VERY_HIGH("very_high"),
    HIGH("high"),
    MODERATE("moderate"),
    LOW("low");

    private final String label;

    Variability(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
