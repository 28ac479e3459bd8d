package com.metricinsight.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Two series reduced to their common timestamps, in ascending order.
 * {@code first[i]} and {@code second[i]} were both observed at
 * {@code timestamps.get(i)}.
 *
 * @since 1.0.0
 */
public final class AlignedSeries {

    private final List<Instant> timestamps;
    private final double[] first;
    private final double[] second;

    public AlignedSeries(List<Instant> timestamps, double[] first, double[] second) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        if (first.length != timestamps.size() || second.length != timestamps.size()) {
            throw new IllegalArgumentException("Aligned arrays must match timestamp count "
                    + timestamps.size() + ", got " + first.length + " and " + second.length);
        }
        this.timestamps = List.copyOf(timestamps);
        this.first = first.clone();
        this.second = second.clone();
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    /** @return copy of the first series' aligned values */
    public double[] getFirst() {
        return first.clone();
    }

    /** @return copy of the second series' aligned values */
    public double[] getSecond() {
        return second.clone();
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    @Override
    public String toString() {
        return "AlignedSeries{size=" + timestamps.size() + '}';
    }
}
