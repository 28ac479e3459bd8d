package com.metricinsight.core.detection;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.Anomaly;
import com.metricinsight.core.model.AnomalyReport;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs every configured {@link DetectionMethod} over a series and merges
 * their candidates into one scored, ordered report.
 *
 * <h3>Merging</h3>
 * <p>
 * Candidates are grouped by exact timestamp. A group of one passes through
 * unchanged; a group of {@code k} becomes a single anomaly scored
 * {@code min(1, maxScore·√k)}. The merged list is ordered by descending score,
 * ties by ascending timestamp.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Instances hold only immutable configuration and may be shared.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    static final String MULTI_DETECTION_TYPE = "multi-detection (%d methods)";

    private static final Comparator<Anomaly> BY_SCORE_THEN_TIME =
            Comparator.comparingDouble(Anomaly::getScore).reversed()
                    .thenComparing(Anomaly::getTimestamp);

    private final List<DetectionMethod> methods;
    private final double defaultSensitivity;
    private final double normalRangeSigma;
    private final double severeScore;
    private final double moderateScore;

    /**
     * @param config validated analysis configuration; must not be {@code null}
     * @throws IllegalArgumentException if a configured method name is unknown
     */
    public AnomalyDetector(AnalysisConfig config) {
        this(config, DetectionMethodFactory.createAll(config.getAnomalyMethods(), config));
    }

    /**
     * @param config  supplies sensitivity and report thresholds
     * @param methods methods to run, in order; must not be empty
     */
    public AnomalyDetector(AnalysisConfig config, List<DetectionMethod> methods) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        Objects.requireNonNull(methods, "Detection methods must not be null");
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("At least one detection method is required");
        }
        this.methods = List.copyOf(methods);
        this.defaultSensitivity = config.getAnomalySensitivity();
        this.normalRangeSigma = config.getNormalRangeSigma();
        this.severeScore = config.getSevereScore();
        this.moderateScore = config.getModerateScore();
    }

    /**
     * Detect anomalies at the configured default sensitivity.
     *
     * @see #detect(List, double)
     */
    public AnalysisResult<AnomalyReport> detect(List<TimeSeriesPoint> series) {
        return detect(series, defaultSensitivity);
    }

    /**
     * Detect anomalies in {@code series}.
     *
     * @param series      points in any order; duplicate timestamps are rejected
     * @param sensitivity sensitivity in {@code [0, 1]}
     * @return the report, or insufficient data for an empty series
     * @throws IllegalArgumentException if {@code sensitivity} is out of range
     *                                  or the series has duplicate timestamps
     */
    public AnalysisResult<AnomalyReport> detect(List<TimeSeriesPoint> series, double sensitivity) {
        if (!(sensitivity >= 0 && sensitivity <= 1)) {
            throw new IllegalArgumentException("Sensitivity must be in [0, 1], got: " + sensitivity);
        }
        List<TimeSeriesPoint> sorted = TimeSeries.sortedCopy(series);
        if (sorted.isEmpty()) {
            return AnalysisResult.insufficientData(1, 0, "anomaly detection needs at least one sample");
        }

        List<Anomaly> candidates = new ArrayList<>();
        for (DetectionMethod method : methods) {
            candidates.addAll(method.detect(sorted, sensitivity));
        }
        List<Anomaly> anomalies = deduplicateAndScore(candidates);

        Statistics stats = calculateWindowStats(TimeSeries.values(sorted));
        int severe = 0;
        int moderate = 0;
        for (Anomaly anomaly : anomalies) {
            if (anomaly.getScore() > severeScore) {
                severe++;
            } else if (anomaly.getScore() > moderateScore) {
                moderate++;
            }
        }

        LOG.debug("Detected {} anomalies ({} severe, {} moderate) in {} samples",
                anomalies.size(), severe, moderate, sorted.size());
        return AnalysisResult.of(new AnomalyReport(stats, anomalies,
                stats.getMean() - normalRangeSigma * stats.getStdDev(),
                stats.getMean() + normalRangeSigma * stats.getStdDev(),
                severe, moderate));
    }

    // ---------------------------------------------------------------
    // Merging
    // ---------------------------------------------------------------

    /**
     * Merge candidates that share a timestamp and order the result.
     *
     * @param anomalies candidates from any number of methods; must not be
     *                  {@code null}
     * @return merged anomalies, highest score first, ties by ascending
     *         timestamp
     */
    public static List<Anomaly> deduplicateAndScore(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");

        Map<Instant, List<Anomaly>> byTimestamp = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            byTimestamp.computeIfAbsent(anomaly.getTimestamp(), t -> new ArrayList<>()).add(anomaly);
        }

        List<Anomaly> merged = new ArrayList<>(byTimestamp.size());
        for (Map.Entry<Instant, List<Anomaly>> entry : byTimestamp.entrySet()) {
            List<Anomaly> group = entry.getValue();
            if (group.size() == 1) {
                merged.add(group.get(0));
            } else {
                merged.add(combine(entry.getKey(), group));
            }
        }
        merged.sort(BY_SCORE_THEN_TIME);
        return merged;
    }

    private static Anomaly combine(Instant timestamp, List<Anomaly> group) {
        double maxScore = 0;
        for (Anomaly anomaly : group) {
            maxScore = Math.max(maxScore, anomaly.getScore());
        }
        int k = group.size();
        String types = group.stream().map(Anomaly::getType).collect(Collectors.joining(", "));

        return Anomaly.builder()
                .timestamp(timestamp)
                .value(group.get(0).getValue())
                .score(Math.min(1.0, maxScore * Math.sqrt(k)))
                .type(String.format(MULTI_DETECTION_TYPE, k))
                .message("Detected by " + k + " methods: " + types)
                .build();
    }

    /**
     * Population statistics of a window of values.
     *
     * @param window values in any order; must not be {@code null}
     * @return statistics; all zero for an empty window
     */
    public static Statistics calculateWindowStats(double[] window) {
        return StatisticsCore.windowStats(window);
    }

    public List<DetectionMethod> getMethods() {
        return methods;
    }
}
