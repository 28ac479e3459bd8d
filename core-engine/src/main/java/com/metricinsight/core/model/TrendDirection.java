package com.metricinsight.core.model;

/**
 * Sign of a fitted linear trend.
 *
 * @since 1.0.0
 */
public enum TrendDirection {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String label;

    TrendDirection(String label) {
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
