package com.metricinsight.core.model;

import java.util.List;

/**
 * Linear extrapolation of a trend: one predicted point and one confidence
 * interval per forecast step, in step order.
 *
 * @since 1.0.0
 */
public final class Forecast {

    private static final Forecast EMPTY = new Forecast(List.of(), List.of());

    private final List<TimeSeriesPoint> values;
    private final List<ConfidenceInterval> confidence;

    public Forecast(List<TimeSeriesPoint> values, List<ConfidenceInterval> confidence) {
        if (values.size() != confidence.size()) {
            throw new IllegalArgumentException("Forecast needs one interval per value, got "
                    + values.size() + " values and " + confidence.size() + " intervals");
        }
        this.values = List.copyOf(values);
        this.confidence = List.copyOf(confidence);
    }

    public static Forecast empty() {
        return EMPTY;
    }

    public List<TimeSeriesPoint> getValues() {
        return values;
    }

    public List<ConfidenceInterval> getConfidence() {
        return confidence;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "Forecast{steps=" + values.size() + '}';
    }
}
