package com.metricinsight.core.detection;

import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.TimeSeriesPoint;

import java.io.Serializable;
import java.util.List;

/**
 * Contract for all anomaly detection methods.
 * <p>
 * Implementations are <strong>stateless</strong>: every call receives the
 * whole series and emits its candidate anomalies independently of other
 * methods. Candidates from several methods are merged afterwards by
 * {@link AnomalyDetector#deduplicateAndScore(List)}.
 * </p>
 * <p>
 * Sensitivity is a value in {@code [0, 1]}; higher sensitivity lowers the
 * method's threshold and therefore flags more points.
 * </p>
 */
public interface DetectionMethod extends Serializable {

    /**
     * Scan a series for anomalous samples.
     *
     * @param sortedSeries points in ascending timestamp order
     * @param sensitivity  sensitivity in {@code [0, 1]}
     * @return candidate anomalies in series order; empty if none
     */
    List<Anomaly> detect(List<TimeSeriesPoint> sortedSeries, double sensitivity);

    /**
     * Return the configuration name of this method.
     *
     * @return method name, e.g. {@code zscore}
     */
    String getName();
}
