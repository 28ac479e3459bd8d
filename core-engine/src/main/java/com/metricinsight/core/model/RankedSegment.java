package com.metricinsight.core.model;

import java.util.Objects;

/**
 * A segment with its position in the ranking by average.
 *
 * @since 1.0.0
 */
public final class RankedSegment {

    private final SegmentStats segment;

    /** 1-based; rank 1 has the highest average. */
    private final int rank;

    /** {@code avg / topSegmentAvg}; 0 when the top average is not positive. */
    private final double relative;

    private final double percentOfTotal;

    public RankedSegment(SegmentStats segment, int rank, double relative, double percentOfTotal) {
        this.segment = Objects.requireNonNull(segment, "segment must not be null");
        this.rank = rank;
        this.relative = relative;
        this.percentOfTotal = percentOfTotal;
    }

    public SegmentStats getSegment() {
        return segment;
    }

    public String getName() {
        return segment.getName();
    }

    public int getRank() {
        return rank;
    }

    public double getRelative() {
        return relative;
    }

    public double getPercentOfTotal() {
        return percentOfTotal;
    }

    @Override
    public String toString() {
        return "RankedSegment{" +
                "name='" + segment.getName() + '\'' +
                ", rank=" + rank +
                ", relative=" + relative +
                ", percentOfTotal=" + percentOfTotal +
                '}';
    }
}
