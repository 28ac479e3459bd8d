package com.metricinsight.core.detection;

import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Global z-score detector.
 *
 * <p>
 * A sample is anomalous when its distance from the series mean exceeds
 * {@code (3 − 2·sensitivity)} population standard deviations. The score is
 * {@code z / 3}, capped at 1.
 * </p>
 *
 * <p>
 * A series with zero standard deviation has no outliers by this measure and
 * yields no candidates.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreMethod implements DetectionMethod {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ZScoreMethod.class);

    public static final String NAME = "zscore";

    /** Anomaly type label. */
    static final String TYPE = "z-score";

    @Override
    public List<Anomaly> detect(List<TimeSeriesPoint> sortedSeries, double sensitivity) {
        Objects.requireNonNull(sortedSeries, "series must not be null");

        Statistics stats = StatisticsCore.computeStatistics(sortedSeries);
        if (stats.getStdDev() == 0) {
            LOG.trace("z-score: zero standard deviation over {} samples – skipping", stats.getCount());
            return List.of();
        }

        double threshold = 3.0 - sensitivity * 2.0;
        List<Anomaly> anomalies = new ArrayList<>();
        for (TimeSeriesPoint point : sortedSeries) {
            double z = Math.abs(point.getValue() - stats.getMean()) / stats.getStdDev();
            if (z > threshold) {
                anomalies.add(Anomaly.builder()
                        .timestamp(point.getTimestamp())
                        .value(point.getValue())
                        .score(Math.min(1.0, z / 3.0))
                        .type(TYPE)
                        .message(String.format(
                                "Value %.2f is %.1f standard deviations from mean", point.getValue(), z))
                        .build());
            }
        }
        LOG.debug("z-score: {} candidate(s) at threshold {}", anomalies.size(), threshold);
        return anomalies;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
