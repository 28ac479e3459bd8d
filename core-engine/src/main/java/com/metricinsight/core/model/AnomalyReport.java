package com.metricinsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of running every configured detection method over one series.
 *
 * <p>
 * Anomalies are deduplicated per timestamp and ordered by descending score.
 * The normal range is {@code mean ± k·stddev} of the whole series.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyReport {

    private final Statistics statistics;
    private final List<Anomaly> anomalies;
    private final double normalRangeLower;
    private final double normalRangeUpper;
    private final int severeCount;
    private final int moderateCount;

    public AnomalyReport(Statistics statistics, List<Anomaly> anomalies,
                         double normalRangeLower, double normalRangeUpper,
                         int severeCount, int moderateCount) {
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
        this.anomalies = List.copyOf(anomalies);
        this.normalRangeLower = normalRangeLower;
        this.normalRangeUpper = normalRangeUpper;
        this.severeCount = severeCount;
        this.moderateCount = moderateCount;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    /** @return unmodifiable list, highest score first */
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public double getNormalRangeLower() {
        return normalRangeLower;
    }

    public double getNormalRangeUpper() {
        return normalRangeUpper;
    }

    public int getSevereCount() {
        return severeCount;
    }

    public int getModerateCount() {
        return moderateCount;
    }

    @Override
    public String toString() {
        return "AnomalyReport{" +
                "statistics=" + statistics +
                ", anomalies=" + anomalies.size() +
                ", normalRange=[" + normalRangeLower + ", " + normalRangeUpper + ']' +
                ", severe=" + severeCount +
                ", moderate=" + moderateCount +
                '}';
    }
}
