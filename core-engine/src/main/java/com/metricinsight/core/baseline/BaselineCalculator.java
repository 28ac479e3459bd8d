package com.metricinsight.core.baseline;

import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.GroupedBaseline;
import com.metricinsight.core.model.SingleBaseline;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Summarises what "normal" looks like for a metric, either over the whole
 * series or per group.
 *
 * <p>
 * A baseline is the population mean, standard deviation and extremes plus a
 * set of percentiles. A grouped baseline additionally reports how far the
 * group averages drift apart.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineCalculator.class);

    /** Percentile ranks used when the caller does not name any. */
    public static final List<Double> DEFAULT_PERCENTILES = List.of(10.0, 50.0, 90.0, 95.0, 99.0);

    /**
     * Baseline of a whole series.
     *
     * @param metric      metric name; must not be {@code null}
     * @param series      points in any order; must not be {@code null}
     * @param percentiles percentile ranks in {@code [0, 100]}
     * @return the baseline, or insufficient data for an empty series
     * @throws IllegalArgumentException if a percentile rank is out of range
     */
    public AnalysisResult<SingleBaseline> baseline(String metric, List<TimeSeriesPoint> series,
                                                   List<Double> percentiles) {
        Objects.requireNonNull(metric, "metric must not be null");
        List<Double> ranks = checkedRanks(percentiles);
        double[] values = TimeSeries.values(series);
        if (values.length == 0) {
            return AnalysisResult.insufficientData(1, 0, "baseline needs at least one sample");
        }
        return AnalysisResult.of(compute(metric, values, ranks));
    }

    /**
     * Baseline of a whole series with {@link #DEFAULT_PERCENTILES}.
     */
    public AnalysisResult<SingleBaseline> baseline(String metric, List<TimeSeriesPoint> series) {
        return baseline(metric, series, DEFAULT_PERCENTILES);
    }

    /**
     * One baseline per group.
     *
     * @param metric      metric name; must not be {@code null}
     * @param groupBy     name of the grouping attribute; must not be
     *                    {@code null}
     * @param groups      series keyed by group value; empty groups are skipped
     * @param percentiles percentile ranks in {@code [0, 100]}
     * @return per-group baselines sorted by group name, or insufficient data
     *         when no group has samples
     */
    public AnalysisResult<GroupedBaseline> groupedBaseline(String metric, String groupBy,
                                                           Map<String, List<TimeSeriesPoint>> groups,
                                                           List<Double> percentiles) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(groupBy, "groupBy must not be null");
        Objects.requireNonNull(groups, "groups must not be null");
        List<Double> ranks = checkedRanks(percentiles);

        List<SingleBaseline> baselines = new ArrayList<>();
        for (Map.Entry<String, List<TimeSeriesPoint>> group : new TreeMap<>(groups).entrySet()) {
            double[] values = TimeSeries.values(group.getValue());
            if (values.length == 0) {
                LOG.trace("Group '{}={}' has no samples – skipping", groupBy, group.getKey());
                continue;
            }
            baselines.add(compute(group.getKey(), values, ranks));
        }
        if (baselines.isEmpty()) {
            return AnalysisResult.insufficientData(1, 0, "grouped baseline needs at least one non-empty group");
        }

        double spread = groupSpread(baselines);
        LOG.debug("Baseline of '{}' by '{}': {} group(s), spread={}", metric, groupBy, baselines.size(), spread);
        return AnalysisResult.of(new GroupedBaseline(metric, groupBy, baselines, spread));
    }

    /**
     * {@code max|avg − mean(avgs)| / mean(avgs)}; 0 when the mean is not
     * positive.
     */
    static double groupSpread(List<SingleBaseline> groups) {
        double sum = 0;
        for (SingleBaseline group : groups) {
            sum += group.getAvg();
        }
        double mean = sum / groups.size();
        if (mean <= 0) {
            return 0;
        }
        double maxDiff = 0;
        for (SingleBaseline group : groups) {
            maxDiff = Math.max(maxDiff, Math.abs(group.getAvg() - mean));
        }
        return maxDiff / mean;
    }

    private static List<Double> checkedRanks(List<Double> percentiles) {
        Objects.requireNonNull(percentiles, "percentiles must not be null");
        for (Double rank : percentiles) {
            Objects.requireNonNull(rank, "percentile ranks must not contain null");
        }
        return List.copyOf(percentiles);
    }

    private static SingleBaseline compute(String name, double[] values, List<Double> percentiles) {
        Statistics stats = StatisticsCore.windowStats(values);
        double[] sorted = StatisticsCore.sortedCopy(values);
        Map<Double, Double> byRank = new LinkedHashMap<>();
        for (Double rank : percentiles) {
            byRank.put(rank, StatisticsCore.percentile(sorted, rank));
        }
        return new SingleBaseline(name, stats, byRank);
    }
}
