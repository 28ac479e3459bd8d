package com.metricinsight.core.detection;

import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interquartile-range fence detector.
 *
 * <p>
 * Fences sit at {@code q1 − m·iqr} and {@code q3 + m·iqr} with
 * {@code m = 1.5 + (1 − sensitivity)}. A sample outside the fences scores
 * its distance beyond the fence divided by {@code m·iqr}, capped at 1. When
 * the IQR is zero every sample off the quartile value scores 1.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrMethod implements DetectionMethod {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IqrMethod.class);

    public static final String NAME = "iqr";

    static final String TYPE = "iqr";

    @Override
    public List<Anomaly> detect(List<TimeSeriesPoint> sortedSeries, double sensitivity) {
        Objects.requireNonNull(sortedSeries, "series must not be null");
        if (sortedSeries.isEmpty()) {
            return List.of();
        }

        double[] sorted = StatisticsCore.sortedCopy(TimeSeries.values(sortedSeries));
        double q1 = StatisticsCore.percentile(sorted, 25);
        double q3 = StatisticsCore.percentile(sorted, 75);
        double iqr = q3 - q1;

        double multiplier = 1.5 + (1.0 - sensitivity);
        double fenceWidth = multiplier * iqr;
        double lowerBound = q1 - fenceWidth;
        double upperBound = q3 + fenceWidth;

        List<Anomaly> anomalies = new ArrayList<>();
        for (TimeSeriesPoint point : sortedSeries) {
            double value = point.getValue();
            if (value >= lowerBound && value <= upperBound) {
                continue;
            }
            double distance = value < lowerBound ? lowerBound - value : value - upperBound;
            double score = fenceWidth == 0 ? 1.0 : Math.min(1.0, distance / fenceWidth);

            anomalies.add(Anomaly.builder()
                    .timestamp(point.getTimestamp())
                    .value(value)
                    .score(score)
                    .type(TYPE)
                    .message(String.format("Value %.2f is outside IQR bounds [%.2f, %.2f]",
                            value, lowerBound, upperBound))
                    .build());
        }
        LOG.debug("iqr: {} candidate(s) outside [{}, {}]", anomalies.size(), lowerBound, upperBound);
        return anomalies;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
