package com.metricinsight.core.trend;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.ChangePoint;
import com.metricinsight.core.model.ChangeType;
import com.metricinsight.core.model.ConfidenceInterval;
import com.metricinsight.core.model.Forecast;
import com.metricinsight.core.model.LinearTrend;
import com.metricinsight.core.model.Seasonality;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.model.TrendDirection;
import com.metricinsight.core.model.TrendReport;
import com.metricinsight.core.model.TrendStrength;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trend, seasonality, change-point and forecast analysis of a single series.
 *
 * <h3>Linear trend</h3>
 * <p>
 * Ordinary least squares of value against sample index. The trend is
 * {@code stable} when the slope is negligible relative to the mean level.
 * </p>
 *
 * <h3>Seasonality</h3>
 * <p>
 * Candidate periods are one hour, one day and one week expressed in samples
 * of the configured interval (12, 288 and 2016 at five minutes). A candidate
 * is tested only when the series spans at least two full periods. The
 * candidate with the highest lag autocorrelation wins if it reaches the
 * configured threshold. By default a candidate must also be an
 * autocorrelation peak, i.e. score higher at its period than at half its
 * period; otherwise a slow daily cycle would be reported at the hourly lag,
 * where neighbouring samples are still strongly correlated.
 * </p>
 *
 * <h3>Change points</h3>
 * <p>
 * Adjacent windows are compared with a two-sample t statistic; after a hit
 * the scan skips half a window.
 * </p>
 *
 * <p>
 * Every order-dependent operation sorts its input first; duplicate
 * timestamps are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    static final int MIN_TREND_SAMPLES = 2;

    /** Confidence cap for change points. */
    static final double MAX_CONFIDENCE = 0.99;

    /** t statistic that maps to the confidence cap. */
    private static final double CONFIDENCE_SCALE = 4.0;

    private final Duration sampleInterval;
    private final double slopeEpsilon;
    private final double strongRSquared;
    private final double moderateRSquared;
    private final int seasonalityMinSamples;
    private final double seasonalityThreshold;
    private final boolean requireAutocorrelationPeak;
    private final int changePointWindow;
    private final double changePointThreshold;
    private final int forecastHorizon;
    private final double forecastZ;
    private final double forecastUncertaintyGrowth;

    /** Candidate period in samples to pattern name, shortest first. */
    private final Map<Integer, String> candidatePeriods;

    public TrendAnalyzer(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.sampleInterval = config.getSampleInterval();
        this.slopeEpsilon = config.getSlopeEpsilon();
        this.strongRSquared = config.getStrongRSquared();
        this.moderateRSquared = config.getModerateRSquared();
        this.seasonalityMinSamples = config.getSeasonalityMinSamples();
        this.seasonalityThreshold = config.getSeasonalityThreshold();
        this.requireAutocorrelationPeak = config.isRequireAutocorrelationPeak();
        this.changePointWindow = config.getChangePointWindow();
        this.changePointThreshold = config.getChangePointThreshold();
        this.forecastHorizon = config.getForecastHorizon();
        this.forecastZ = config.getForecastZ();
        this.forecastUncertaintyGrowth = config.getForecastUncertaintyGrowth();
        this.candidatePeriods = candidatePeriods(sampleInterval);
    }

    private static Map<Integer, String> candidatePeriods(Duration interval) {
        Map<Integer, String> periods = new LinkedHashMap<>();
        addPeriod(periods, Duration.ofHours(1), interval, "hourly");
        addPeriod(periods, Duration.ofDays(1), interval, "daily");
        addPeriod(periods, Duration.ofDays(7), interval, "weekly");
        return periods;
    }

    private static void addPeriod(Map<Integer, String> periods, Duration cycle, Duration interval, String pattern) {
        long cycleMillis = cycle.toMillis();
        long intervalMillis = interval.toMillis();
        if (cycleMillis % intervalMillis != 0) {
            return;
        }
        long samples = cycleMillis / intervalMillis;
        if (samples >= 2 && samples <= Integer.MAX_VALUE) {
            periods.put((int) samples, pattern);
        }
    }

    // ---------------------------------------------------------------
    // Full report
    // ---------------------------------------------------------------

    /**
     * Run every trend analysis over {@code series}.
     *
     * @param series points in any order
     * @return the report, or insufficient data for fewer than two samples
     */
    public AnalysisResult<TrendReport> analyze(List<TimeSeriesPoint> series) {
        List<TimeSeriesPoint> sorted = TimeSeries.sortedCopy(series);
        AnalysisResult<LinearTrend> trend = linearTrend(sorted);
        if (!trend.isSufficient()) {
            return AnalysisResult.insufficientData(MIN_TREND_SAMPLES, sorted.size(),
                    "trend analysis needs at least two samples");
        }
        LinearTrend linear = trend.get();
        return AnalysisResult.of(new TrendReport(linear,
                detectSeasonality(sorted),
                detectChangePoints(sorted),
                forecast(sorted, linear)));
    }

    // ---------------------------------------------------------------
    // Linear trend
    // ---------------------------------------------------------------

    /**
     * Fit a least-squares line to {@code series}.
     *
     * @param series points in any order
     * @return the fit, or insufficient data for fewer than two samples
     */
    public AnalysisResult<LinearTrend> linearTrend(List<TimeSeriesPoint> series) {
        double[] values = TimeSeries.values(TimeSeries.sortedCopy(series));
        int n = values.length;
        if (n < MIN_TREND_SAMPLES) {
            return AnalysisResult.insufficientData(MIN_TREND_SAMPLES, n,
                    "linear trend needs at least two samples");
        }

        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double v : values) {
            meanY += v;
        }
        meanY /= n;

        double sxx = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            sxx += dx * dx;
            sxy += dx * (values[i] - meanY);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssTotal = 0;
        double ssResidual = 0;
        for (int i = 0; i < n; i++) {
            double residual = values[i] - (slope * i + intercept);
            ssTotal += (values[i] - meanY) * (values[i] - meanY);
            ssResidual += residual * residual;
        }
        double rSquared = ssTotal == 0 ? 0 : Math.max(0, Math.min(1, 1 - ssResidual / ssTotal));

        double first = intercept;
        double last = slope * (n - 1) + intercept;
        double percentChange = first == 0 ? 0 : (last - first) / first * 100;
        if (!Double.isFinite(percentChange)) {
            percentChange = 0;
        }

        LinearTrend result = new LinearTrend(slope, intercept, direction(slope, meanY),
                strength(rSquared), rSquared, percentChange);
        LOG.debug("Linear trend over {} samples: {}", n, result);
        return AnalysisResult.of(result);
    }

    private TrendDirection direction(double slope, double mean) {
        double relative = mean == 0 ? Math.abs(slope) : Math.abs(slope) / Math.abs(mean);
        if (relative < slopeEpsilon) {
            return TrendDirection.STABLE;
        }
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    private TrendStrength strength(double rSquared) {
        if (rSquared >= strongRSquared) {
            return TrendStrength.STRONG;
        } else if (rSquared >= moderateRSquared) {
            return TrendStrength.MODERATE;
        }
        return TrendStrength.WEAK;
    }

    // ---------------------------------------------------------------
    // Seasonality
    // ---------------------------------------------------------------

    /**
     * Search for an hourly, daily or weekly cycle.
     *
     * @param series points in any order
     * @return the strongest qualifying period, or not detected
     */
    public Seasonality detectSeasonality(List<TimeSeriesPoint> series) {
        double[] values = TimeSeries.values(TimeSeries.sortedCopy(series));
        int n = values.length;
        if (n < seasonalityMinSamples) {
            LOG.trace("Seasonality: {} samples below minimum {} – skipping", n, seasonalityMinSamples);
            return Seasonality.notDetected(0);
        }

        int bestPeriod = 0;
        double bestStrength = 0;
        for (Map.Entry<Integer, String> candidate : candidatePeriods.entrySet()) {
            int period = candidate.getKey();
            if (n < period * 2) {
                continue;
            }
            double strength = autocorrelation(values, period);
            if (requireAutocorrelationPeak && strength <= autocorrelation(values, period / 2)) {
                LOG.trace("Seasonality: period {} is not an autocorrelation peak", period);
                continue;
            }
            if (strength > bestStrength) {
                bestPeriod = period;
                bestStrength = strength;
            }
        }

        if (bestPeriod == 0 || bestStrength < seasonalityThreshold) {
            return Seasonality.notDetected(bestStrength);
        }
        String pattern = candidatePeriods.get(bestPeriod);
        LOG.debug("Seasonality: {} pattern, period {} samples, strength {}", pattern, bestPeriod, bestStrength);
        return new Seasonality(true, bestPeriod, bestStrength, pattern);
    }

    /**
     * Sample autocorrelation at {@code lag}, normalised by the total sum of
     * squares.
     *
     * @return coefficient, or 0 for a constant series or a lag beyond the data
     */
    static double autocorrelation(double[] values, int lag) {
        int n = values.length;
        if (lag < 0 || n < lag + 1) {
            return 0;
        }
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= n;

        double numerator = 0;
        for (int i = lag; i < n; i++) {
            numerator += (values[i] - mean) * (values[i - lag] - mean);
        }
        double denominator = 0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        return denominator == 0 ? 0 : numerator / denominator;
    }

    // ---------------------------------------------------------------
    // Change points
    // ---------------------------------------------------------------

    /**
     * Locate level shifts between adjacent windows.
     *
     * @param series points in any order
     * @return change points in time order; empty for fewer than two windows of
     *         data
     */
    public List<ChangePoint> detectChangePoints(List<TimeSeriesPoint> series) {
        List<TimeSeriesPoint> sorted = TimeSeries.sortedCopy(series);
        double[] values = TimeSeries.values(sorted);
        int window = changePointWindow;
        int n = values.length;
        if (n < 2 * window) {
            LOG.trace("Change points: {} samples below two windows of {} – skipping", n, window);
            return List.of();
        }

        List<ChangePoint> changePoints = new ArrayList<>();
        for (int i = window; i < n - window; i++) {
            Statistics before = StatisticsCore.windowStats(values, i - window, i);
            Statistics after = StatisticsCore.windowStats(values, i, i + window);
            if (before.getMean() == after.getMean()) {
                continue;
            }

            double pooledStd = Math.sqrt((before.getStdDev() * before.getStdDev()
                    + after.getStdDev() * after.getStdDev()) / 2);
            double confidence;
            if (pooledStd == 0) {
                confidence = MAX_CONFIDENCE;
            } else {
                double t = Math.abs(before.getMean() - after.getMean())
                        / (pooledStd * Math.sqrt(2.0 / window));
                if (t <= changePointThreshold) {
                    continue;
                }
                confidence = Math.min(MAX_CONFIDENCE, t / CONFIDENCE_SCALE);
            }

            ChangeType type = after.getMean() > before.getMean()
                    ? ChangeType.LEVEL_SHIFT_UP
                    : ChangeType.LEVEL_SHIFT_DOWN;
            changePoints.add(new ChangePoint(sorted.get(i).getTimestamp(),
                    before.getMean(), after.getMean(), confidence, type));

            // Skip past the shift so it is not reported again.
            i += window / 2;
        }
        LOG.debug("Change points: {} found in {} samples", changePoints.size(), n);
        return changePoints;
    }

    // ---------------------------------------------------------------
    // Forecast
    // ---------------------------------------------------------------

    /**
     * Extrapolate {@code trend} beyond the end of {@code series}.
     *
     * <p>
     * Step {@code i} (1-based) is placed {@code i} sample intervals after the
     * last timestamp. Its margin is
     * {@code z·residualStd·(1 + growth·i)}, so intervals widen with the
     * horizon.
     * </p>
     *
     * @param series points in any order
     * @param trend  fit of the same series; must not be {@code null}
     * @return the forecast; empty for an empty series
     */
    public Forecast forecast(List<TimeSeriesPoint> series, LinearTrend trend) {
        Objects.requireNonNull(trend, "trend must not be null");
        List<TimeSeriesPoint> sorted = TimeSeries.sortedCopy(series);
        if (sorted.isEmpty()) {
            return Forecast.empty();
        }

        int n = sorted.size();
        double residualStd = residualStdDev(TimeSeries.values(sorted), trend);
        Instant last = sorted.get(n - 1).getTimestamp();

        List<TimeSeriesPoint> values = new ArrayList<>(forecastHorizon);
        List<ConfidenceInterval> intervals = new ArrayList<>(forecastHorizon);
        for (int i = 1; i <= forecastHorizon; i++) {
            Instant timestamp = last.plus(sampleInterval.multipliedBy(i));
            double predicted = trend.valueAt(n + i - 1);
            double margin = forecastZ * residualStd * (1 + forecastUncertaintyGrowth * i);
            values.add(TimeSeriesPoint.of(timestamp, predicted));
            intervals.add(new ConfidenceInterval(timestamp, predicted - margin, predicted + margin));
        }
        return new Forecast(values, intervals);
    }

    /** Population standard deviation of the fit residuals. */
    static double residualStdDev(double[] values, LinearTrend trend) {
        if (values.length == 0) {
            return 0;
        }
        double sumSquares = 0;
        for (int i = 0; i < values.length; i++) {
            double residual = values[i] - trend.valueAt(i);
            sumSquares += residual * residual;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    public Duration getSampleInterval() {
        return sampleInterval;
    }
}
