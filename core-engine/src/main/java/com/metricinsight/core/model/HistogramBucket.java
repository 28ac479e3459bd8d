package com.metricinsight.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One equal-width histogram bucket. Buckets are half-open
 * {@code [start, end)} except the last, which also contains {@code end}.
 *
 * @since 1.0.0
 */
public final class HistogramBucket implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double start;
    private final double end;
    private final int count;
    private final double percentage;

    public HistogramBucket(double start, double end, int count, double percentage) {
        this.start = start;
        this.end = end;
        this.count = count;
        this.percentage = percentage;
    }

    public double getStart() {
        return start;
    }

    public double getEnd() {
        return end;
    }

    public int getCount() {
        return count;
    }

    /** @return share of all values that fell in this bucket, 0–100 */
    public double getPercentage() {
        return percentage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HistogramBucket that))
            return false;
        return Double.compare(start, that.start) == 0
                && Double.compare(end, that.end) == 0
                && count == that.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, count);
    }

    @Override
    public String toString() {
        return "HistogramBucket{[" + start + ", " + end + "): " + count + '}';
    }
}
