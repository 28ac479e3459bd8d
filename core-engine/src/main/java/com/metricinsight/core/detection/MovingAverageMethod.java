package com.metricinsight.core.detection;

import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Windowed-mean deviation detector.
 *
 * <p>
 * Each sample from index {@code windowSize} onwards is compared with the mean
 * of the preceding {@code windowSize} samples. It is anomalous when the
 * deviation exceeds {@code (2 − 1.5·sensitivity)} window standard deviations;
 * the score is {@code deviation / (3·windowStd)}, capped at 1.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * The first {@code windowSize} samples are never evaluated, and a window with
 * zero standard deviation is skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageMethod implements DetectionMethod {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageMethod.class);

    public static final String NAME = "moving_average";

    static final String TYPE = "moving-average";

    /** Smallest window for which a standard deviation is meaningful. */
    static final int MIN_WINDOW_SIZE = 2;

    private final int windowSize;

    /**
     * @param windowSize trailing window length in samples
     * @throws IllegalArgumentException if {@code windowSize} is too small
     */
    public MovingAverageMethod(int windowSize) {
        if (windowSize < MIN_WINDOW_SIZE) {
            throw new IllegalArgumentException(
                    "windowSize must be >= " + MIN_WINDOW_SIZE + ", got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    @Override
    public List<Anomaly> detect(List<TimeSeriesPoint> sortedSeries, double sensitivity) {
        Objects.requireNonNull(sortedSeries, "series must not be null");
        if (sortedSeries.size() <= windowSize) {
            LOG.trace("moving-average: {} samples do not exceed window {} – skipping",
                    sortedSeries.size(), windowSize);
            return List.of();
        }

        double[] values = TimeSeries.values(sortedSeries);
        double threshold = 2.0 - sensitivity * 1.5;
        List<Anomaly> anomalies = new ArrayList<>();

        for (int i = windowSize; i < values.length; i++) {
            // The window excludes the current sample.
            Statistics window = StatisticsCore.windowStats(values, i - windowSize, i);
            double windowStd = window.getStdDev();
            if (windowStd == 0) {
                continue;
            }
            double diff = Math.abs(values[i] - window.getMean());
            if (diff > threshold * windowStd) {
                anomalies.add(Anomaly.builder()
                        .timestamp(sortedSeries.get(i).getTimestamp())
                        .value(values[i])
                        .score(Math.min(1.0, diff / (3 * windowStd)))
                        .type(TYPE)
                        .message(String.format(
                                "Value %.2f deviates from moving average %.2f by %.1f std devs",
                                values[i], window.getMean(), diff / windowStd))
                        .build());
            }
        }
        LOG.debug("moving-average: {} candidate(s) with window {}", anomalies.size(), windowSize);
        return anomalies;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
