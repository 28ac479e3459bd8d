package com.metricinsight.core.correlation;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AlignedSeries;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.LagCorrelation;
import com.metricinsight.core.model.MetricCorrelation;
import com.metricinsight.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pearson and lagged correlation between metric series.
 *
 * <p>
 * Two series are first aligned on the timestamps they share exactly. The
 * zero-lag coefficient is then compared against shifted coefficients for
 * lags {@code −maxLag..maxLag}; a shift is reported only when it is strictly
 * stronger in magnitude than the unshifted correlation.
 * </p>
 *
 * <h3>Lag direction</h3>
 * <p>
 * A positive lag pairs {@code x[i]} with {@code y[i + lag]}: the second
 * series follows the first by {@code lag} samples. Negative lags are the
 * mirror image.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    static final String NO_RELATIONSHIP = "none";

    /** Minimum number of paired samples for a coefficient. */
    static final int MIN_OVERLAP = 2;

    private static final Comparator<MetricCorrelation> BY_STRENGTH_THEN_NAME =
            Comparator.comparingDouble((MetricCorrelation c) -> Math.abs(c.getCoefficient())).reversed()
                    .thenComparing(MetricCorrelation::getMetric);

    private final int maxLag;
    private final Duration sampleInterval;

    public CorrelationAnalyzer(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.maxLag = config.getMaxLag();
        this.sampleInterval = config.getSampleInterval();
    }

    // ---------------------------------------------------------------
    // Primitives
    // ---------------------------------------------------------------

    /**
     * Pair two series on their common timestamps.
     *
     * @param first  points in any order; must not be {@code null}
     * @param second points in any order; must not be {@code null}
     * @return aligned values in ascending timestamp order
     */
    public static AlignedSeries alignTimeSeries(List<TimeSeriesPoint> first, List<TimeSeriesPoint> second) {
        Objects.requireNonNull(first, "first series must not be null");
        Objects.requireNonNull(second, "second series must not be null");

        Map<Instant, Double> secondByTime = new TreeMap<>();
        for (TimeSeriesPoint point : second) {
            secondByTime.put(point.getTimestamp(), point.getValue());
        }
        Map<Instant, Double> firstByTime = new TreeMap<>();
        for (TimeSeriesPoint point : first) {
            firstByTime.put(point.getTimestamp(), point.getValue());
        }

        List<Instant> timestamps = new ArrayList<>();
        List<double[]> pairs = new ArrayList<>();
        for (Map.Entry<Instant, Double> entry : firstByTime.entrySet()) {
            Double other = secondByTime.get(entry.getKey());
            if (other != null) {
                timestamps.add(entry.getKey());
                pairs.add(new double[] {entry.getValue(), other});
            }
        }

        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return new AlignedSeries(timestamps, x, y);
    }

    /**
     * Pearson product-moment coefficient.
     *
     * @param x first sample; must not be {@code null}
     * @param y second sample, same length as {@code x}
     * @return coefficient in {@code [-1, 1]}; 0 when fewer than two samples or
     *         when either sample is constant
     * @throws IllegalArgumentException if the lengths differ
     */
    public static double calculatePearsonCorrelation(double[] x, double[] y) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    "Samples must have equal length, got " + x.length + " and " + y.length);
        }
        int n = x.length;
        if (n < MIN_OVERLAP) {
            return 0;
        }

        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }

        double denominator = Math.sqrt(sxx * syy);
        if (denominator == 0 || !Double.isFinite(denominator)) {
            return 0;
        }
        double r = sxy / denominator;
        if (!Double.isFinite(r)) {
            return 0;
        }
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Coefficients for every non-zero lag in {@code [−maxLag, maxLag]} that
     * leaves at least two overlapping samples.
     *
     * @return coefficients in ascending lag order
     * @throws IllegalArgumentException if the lengths differ or
     *                                  {@code maxLag < 0}
     */
    public static List<LagCorrelation> calculateLagCorrelations(double[] x, double[] y, int maxLag) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    "Samples must have equal length, got " + x.length + " and " + y.length);
        }
        if (maxLag < 0) {
            throw new IllegalArgumentException("maxLag must be >= 0, got: " + maxLag);
        }

        int n = x.length;
        List<LagCorrelation> result = new ArrayList<>();
        for (int lag = -maxLag; lag <= maxLag; lag++) {
            if (lag == 0) {
                continue;
            }
            int overlap = n - Math.abs(lag);
            if (overlap < MIN_OVERLAP) {
                continue;
            }
            double[] shiftedX;
            double[] shiftedY;
            if (lag > 0) {
                shiftedX = Arrays.copyOfRange(x, 0, overlap);
                shiftedY = Arrays.copyOfRange(y, lag, n);
            } else {
                shiftedX = Arrays.copyOfRange(x, -lag, n);
                shiftedY = Arrays.copyOfRange(y, 0, overlap);
            }
            result.add(new LagCorrelation(lag, calculatePearsonCorrelation(shiftedX, shiftedY), overlap));
        }
        return result;
    }

    /**
     * @param lags lag coefficients; must not be {@code null}
     * @return the entry with the largest {@code |coefficient|}; the earliest
     *         in list order on ties
     */
    public static Optional<LagCorrelation> dominantLag(List<LagCorrelation> lags) {
        Objects.requireNonNull(lags, "lags must not be null");
        LagCorrelation best = null;
        for (LagCorrelation candidate : lags) {
            if (best == null || Math.abs(candidate.getCoefficient()) > Math.abs(best.getCoefficient())) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Describe a coefficient as {@code "<strength> <direction>"}, e.g.
     * {@code "strong negative"}; {@code "none"} for exactly 0.
     */
    public static String interpretCorrelation(double coefficient) {
        if (coefficient == 0) {
            return NO_RELATIONSHIP;
        }
        double abs = Math.abs(coefficient);
        String strength;
        if (abs >= 0.9) {
            strength = "very strong";
        } else if (abs >= 0.7) {
            strength = "strong";
        } else if (abs >= 0.5) {
            strength = "moderate";
        } else if (abs >= 0.3) {
            strength = "weak";
        } else {
            strength = "very weak";
        }
        return strength + (coefficient < 0 ? " negative" : " positive");
    }

    // ---------------------------------------------------------------
    // Metric-level analysis
    // ---------------------------------------------------------------

    /**
     * Correlate a candidate metric against the primary series.
     *
     * @param metric    candidate metric name; must not be {@code null}
     * @param primary   primary series
     * @param candidate candidate series
     * @return the correlation, or insufficient data when fewer than two
     *         timestamps are shared
     */
    public AnalysisResult<MetricCorrelation> correlate(String metric,
                                                       List<TimeSeriesPoint> primary,
                                                       List<TimeSeriesPoint> candidate) {
        Objects.requireNonNull(metric, "metric must not be null");
        AlignedSeries aligned = alignTimeSeries(primary, candidate);
        if (aligned.size() < MIN_OVERLAP) {
            LOG.trace("Metric '{}': only {} shared timestamp(s) – skipping", metric, aligned.size());
            return AnalysisResult.insufficientData(MIN_OVERLAP, aligned.size(),
                    "correlation needs at least two shared timestamps");
        }

        double[] x = aligned.getFirst();
        double[] y = aligned.getSecond();
        double coefficient = calculatePearsonCorrelation(x, y);

        int bestLag = 0;
        double bestCoefficient = coefficient;
        Optional<LagCorrelation> dominant = dominantLag(calculateLagCorrelations(x, y, maxLag));
        if (dominant.isPresent() && Math.abs(dominant.get().getCoefficient()) > Math.abs(coefficient)) {
            bestLag = dominant.get().getLag();
            bestCoefficient = dominant.get().getCoefficient();
        }

        MetricCorrelation correlation = MetricCorrelation.builder()
                .metric(metric)
                .coefficient(coefficient)
                .lag(bestLag)
                .laggedCoeff(bestCoefficient)
                .dataPoints(aligned.size())
                .relationship(interpretCorrelation(coefficient))
                .lagOffset(sampleInterval.multipliedBy(bestLag))
                .build();
        LOG.debug("Metric '{}': r={} lag={} ({} points)", metric, coefficient, bestLag, aligned.size());
        return AnalysisResult.of(correlation);
    }

    /**
     * Correlate every candidate against the primary series.
     *
     * @param primaryName name of the primary metric, excluded from candidates
     * @param primary     primary series
     * @param candidates  candidate series keyed by metric name
     * @return sufficient correlations, strongest {@code |coefficient|} first,
     *         ties by metric name
     */
    public List<MetricCorrelation> findCorrelations(String primaryName,
                                                    List<TimeSeriesPoint> primary,
                                                    Map<String, List<TimeSeriesPoint>> candidates) {
        Objects.requireNonNull(primary, "primary series must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");

        List<MetricCorrelation> correlations = new ArrayList<>();
        for (Map.Entry<String, List<TimeSeriesPoint>> entry : candidates.entrySet()) {
            if (entry.getKey().equals(primaryName)) {
                continue;
            }
            correlate(entry.getKey(), primary, entry.getValue()).value().ifPresent(correlations::add);
        }
        correlations.sort(BY_STRENGTH_THEN_NAME);
        LOG.debug("Primary '{}': {} of {} candidate(s) correlated",
                primaryName, correlations.size(), candidates.size());
        return correlations;
    }

    public int getMaxLag() {
        return maxLag;
    }
}
