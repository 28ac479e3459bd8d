package com.metricinsight.core.model;

/**
 * Bucketed goodness of fit of a linear trend.
 *
 * @since 1.0.0
 */
public enum TrendStrength {

    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String label;

    TrendStrength(String label) {
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
