package com.metricinsight.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Static helpers for working with {@link TimeSeriesPoint} lists.
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    private static final Comparator<TimeSeriesPoint> BY_TIMESTAMP =
            Comparator.comparing(TimeSeriesPoint::getTimestamp);

    private TimeSeries() {
        // utility class — not instantiable
    }

    /**
     * Return a copy of {@code series} sorted by ascending timestamp.
     *
     * @param series input points; must not be {@code null} or contain
     *               {@code null} elements
     * @return new, unmodifiable, ascending list
     * @throws IllegalArgumentException if two points share a timestamp
     */
    public static List<TimeSeriesPoint> sortedCopy(List<TimeSeriesPoint> series) {
        Objects.requireNonNull(series, "series must not be null");
        List<TimeSeriesPoint> sorted = new ArrayList<>(series.size());
        for (TimeSeriesPoint point : series) {
            sorted.add(Objects.requireNonNull(point, "series must not contain null points"));
        }
        sorted.sort(BY_TIMESTAMP);

        for (int i = 1; i < sorted.size(); i++) {
            Instant previous = sorted.get(i - 1).getTimestamp();
            if (previous.equals(sorted.get(i).getTimestamp())) {
                throw new IllegalArgumentException(
                        "Duplicate timestamp in series: " + previous);
            }
        }
        return List.copyOf(sorted);
    }

    /**
     * Extract the values of {@code series} in list order.
     *
     * @param series input points; must not be {@code null}
     * @return new array of values
     */
    public static double[] values(List<TimeSeriesPoint> series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        return values;
    }
}
