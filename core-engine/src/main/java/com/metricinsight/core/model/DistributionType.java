package com.metricinsight.core.model;

/**
 * Shape classification derived from skewness and excess kurtosis.
 *
 * @since 1.0.0
 */
public enum DistributionType {

    NORMAL("normal"),
    RIGHT_SKEWED("right-skewed"),
    LEFT_SKEWED("left-skewed"),
    /** Heavy tails. */
    LEPTOKURTIC("leptokurtic"),
    /** Light tails. */
    PLATYKURTIC("platykurtic"),
    NON_NORMAL("non-normal");

    private final String label;

    DistributionType(String label) {
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
