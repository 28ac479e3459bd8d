/**
 * Anomaly detection: the {@link com.metricinsight.core.detection.DetectionMethod}
 * contract, its z-score, IQR and moving-average implementations, and the
 * {@link com.metricinsight.core.detection.AnomalyDetector} that merges their
 * candidates.
 */
package com.metricinsight.core.detection;
