package com.metricinsight.core.model;

/**
 * Baseline of a metric, either over the whole series
 * ({@link SingleBaseline}) or per group ({@link GroupedBaseline}).
 *
 * @since 1.0.0
 */
public interface BaselineResult {

    /**
     * @return name of the metric the baseline describes
     */
    String getMetric();

    /**
     * @return {@code true} for a {@link GroupedBaseline}
     */
    boolean isGrouped();
}
