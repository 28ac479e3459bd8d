package com.metricinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-group baselines of one metric.
 *
 * <p>
 * {@code groupSpread} is the largest absolute deviation of a group average
 * from the mean of group averages, relative to that mean. It is 0 when the
 * mean is not positive.
 * </p>
 *
 * @since 1.0.0
 */
public final class GroupedBaseline implements BaselineResult {

    private final String metric;
    private final String groupedBy;
    private final List<SingleBaseline> groups;
    private final double groupSpread;

    public GroupedBaseline(String metric, String groupedBy, List<SingleBaseline> groups, double groupSpread) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.groupedBy = Objects.requireNonNull(groupedBy, "groupedBy must not be null");
        this.groups = List.copyOf(groups);
        this.groupSpread = groupSpread;
    }

    @Override
    public String getMetric() {
        return metric;
    }

    @Override
    public boolean isGrouped() {
        return true;
    }

    public String getGroupedBy() {
        return groupedBy;
    }

    /** @return group baselines ordered by group name */
    public List<SingleBaseline> getGroups() {
        return groups;
    }

    public double getGroupSpread() {
        return groupSpread;
    }

    @Override
    public String toString() {
        return "GroupedBaseline{" +
                "metric='" + metric + '\'' +
                ", groupedBy='" + groupedBy + '\'' +
                ", groups=" + groups.size() +
                ", groupSpread=" + groupSpread +
                '}';
    }
}
