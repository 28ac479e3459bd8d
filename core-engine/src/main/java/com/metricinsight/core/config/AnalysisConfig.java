package com.metricinsight.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tunable thresholds and defaults for every analyzer.
 *
 * <p>
 * Expected YAML structure (every property is optional and falls back to the
 * default shown):
 * </p>
 *
 * <pre>
 * sampleIntervalMinutes: 5
 * legacyZeroFill: false
 * anomalyMethods: [zscore, iqr, moving_average]
 * anomalySensitivity: 0.5
 * seasonalityThreshold: 0.3
 * changePointThreshold: 2.0
 * </pre>
 *
 * <p>
 * This class is a mutable JavaBean so SnakeYAML can populate it. Analyzers
 * copy the values they need at construction time and never hold on to the
 * config instance. Call {@link #validate()} after construction /
 * deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig {

    /** Detection method names understood by the detection method factory. */
    public static final Set<String> KNOWN_METHODS = Set.of("zscore", "iqr", "moving_average");

    // --- Sampling ---
    /** Fixed spacing between consecutive samples, in minutes. */
    private int sampleIntervalMinutes = 5;

    /** Substitute 0 for missing raw samples instead of dropping them. */
    private boolean legacyZeroFill = false;

    // --- Anomaly detection ---
    private List<String> anomalyMethods = new ArrayList<>(List.of("zscore", "iqr", "moving_average"));

    /** Default sensitivity in [0, 1]; higher flags more points. */
    private double anomalySensitivity = 0.5;

    /** Trailing window of the moving-average method, in samples. */
    private int movingAverageWindow = 12;

    /** Width of the reported normal range, in standard deviations. */
    private double normalRangeSigma = 2.0;

    private double severeScore = 0.8;
    private double moderateScore = 0.5;

    // --- Correlation ---
    private int maxLag = 5;

    // --- Trend ---
    /** Slope relative to mean magnitude below which a trend is stable. */
    private double slopeEpsilon = 0.0001;

    private double strongRSquared = 0.7;
    private double moderateRSquared = 0.4;

    // --- Seasonality ---
    private int seasonalityMinSamples = 48;
    private double seasonalityThreshold = 0.3;
    private boolean requireAutocorrelationPeak = true;

    // --- Change points ---
    private int changePointWindow = 10;
    private double changePointThreshold = 2.0;

    // --- Forecast ---
    private int forecastHorizon = 12;
    private double forecastZ = 1.96;

    /** Per-step linear widening of the forecast margin. */
    private double forecastUncertaintyGrowth = 0.1;

    // --- Distribution ---
    private int histogramBuckets = 10;
    private double normalSkewness = 0.5;
    private double normalKurtosis = 0.5;
    private double skewnessThreshold = 1.0;
    private double kurtosisThreshold = 1.0;
    private double veryHighCv = 100;
    private double highCv = 50;
    private double lowCv = 20;

    // --- Segments ---
    private double segmentOutlierSigma = 2.0;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every property holds a legal value.
     *
     * @throws IllegalStateException listing every invalid property
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (sampleIntervalMinutes <= 0) {
            errors.add("'sampleIntervalMinutes' must be > 0");
        }
        if (anomalyMethods == null || anomalyMethods.isEmpty()) {
            errors.add("'anomalyMethods' must name at least one method");
        } else {
            for (String method : anomalyMethods) {
                if (method == null || !KNOWN_METHODS.contains(method.toLowerCase(Locale.ROOT))) {
                    errors.add("Unknown anomaly method: '" + method
                            + "'. Supported: zscore, iqr, moving_average");
                }
            }
        }
        if (anomalySensitivity < 0 || anomalySensitivity > 1) {
            errors.add("'anomalySensitivity' must be in [0, 1]");
        }
        if (movingAverageWindow < 2) {
            errors.add("'movingAverageWindow' must be >= 2");
        }
        if (normalRangeSigma <= 0) {
            errors.add("'normalRangeSigma' must be > 0");
        }
        if (moderateScore < 0 || severeScore > 1 || moderateScore > severeScore) {
            errors.add("'moderateScore' <= 'severeScore' must both lie in [0, 1]");
        }
        if (maxLag < 0) {
            errors.add("'maxLag' must be >= 0");
        }
        if (slopeEpsilon < 0) {
            errors.add("'slopeEpsilon' must be >= 0");
        }
        if (moderateRSquared > strongRSquared) {
            errors.add("'moderateRSquared' must not exceed 'strongRSquared'");
        }
        if (seasonalityMinSamples < 2) {
            errors.add("'seasonalityMinSamples' must be >= 2");
        }
        if (changePointWindow < 2) {
            errors.add("'changePointWindow' must be >= 2");
        }
        if (changePointThreshold <= 0) {
            errors.add("'changePointThreshold' must be > 0");
        }
        if (forecastHorizon < 0) {
            errors.add("'forecastHorizon' must be >= 0");
        }
        if (forecastZ < 0 || forecastUncertaintyGrowth < 0) {
            errors.add("'forecastZ' and 'forecastUncertaintyGrowth' must be >= 0");
        }
        if (histogramBuckets < 1) {
            errors.add("'histogramBuckets' must be >= 1");
        }
        if (normalSkewness < 0 || normalKurtosis < 0) {
            errors.add("'normalSkewness' and 'normalKurtosis' must be >= 0");
        }
        if (!(lowCv <= highCv && highCv <= veryHighCv)) {
            errors.add("CV bands must satisfy lowCv <= highCv <= veryHighCv");
        }
        if (segmentOutlierSigma <= 0) {
            errors.add("'segmentOutlierSigma' must be > 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return the sample interval as a {@link Duration}
     */
    public Duration getSampleInterval() {
        return Duration.ofMinutes(sampleIntervalMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getSampleIntervalMinutes() {
        return sampleIntervalMinutes;
    }

    public void setSampleIntervalMinutes(int sampleIntervalMinutes) {
        this.sampleIntervalMinutes = sampleIntervalMinutes;
    }

    public boolean isLegacyZeroFill() {
        return legacyZeroFill;
    }

    public void setLegacyZeroFill(boolean legacyZeroFill) {
        this.legacyZeroFill = legacyZeroFill;
    }

    /**
     * @return unmodifiable list of detection method names
     */
    public List<String> getAnomalyMethods() {
        return anomalyMethods != null ? Collections.unmodifiableList(anomalyMethods) : List.of();
    }

    public void setAnomalyMethods(List<String> anomalyMethods) {
        this.anomalyMethods = anomalyMethods != null ? new ArrayList<>(anomalyMethods) : null;
    }

    public double getAnomalySensitivity() {
        return anomalySensitivity;
    }

    public void setAnomalySensitivity(double anomalySensitivity) {
        this.anomalySensitivity = anomalySensitivity;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    public void setMovingAverageWindow(int movingAverageWindow) {
        this.movingAverageWindow = movingAverageWindow;
    }

    public double getNormalRangeSigma() {
        return normalRangeSigma;
    }

    public void setNormalRangeSigma(double normalRangeSigma) {
        this.normalRangeSigma = normalRangeSigma;
    }

    public double getSevereScore() {
        return severeScore;
    }

    public void setSevereScore(double severeScore) {
        this.severeScore = severeScore;
    }

    public double getModerateScore() {
        return moderateScore;
    }

    public void setModerateScore(double moderateScore) {
        this.moderateScore = moderateScore;
    }

    public int getMaxLag() {
        return maxLag;
    }

    public void setMaxLag(int maxLag) {
        this.maxLag = maxLag;
    }

    public double getSlopeEpsilon() {
        return slopeEpsilon;
    }

    public void setSlopeEpsilon(double slopeEpsilon) {
        this.slopeEpsilon = slopeEpsilon;
    }

    public double getStrongRSquared() {
        return strongRSquared;
    }

    public void setStrongRSquared(double strongRSquared) {
        this.strongRSquared = strongRSquared;
    }

    public double getModerateRSquared() {
        return moderateRSquared;
    }

    public void setModerateRSquared(double moderateRSquared) {
        this.moderateRSquared = moderateRSquared;
    }

    public int getSeasonalityMinSamples() {
        return seasonalityMinSamples;
    }

    public void setSeasonalityMinSamples(int seasonalityMinSamples) {
        this.seasonalityMinSamples = seasonalityMinSamples;
    }

    public double getSeasonalityThreshold() {
        return seasonalityThreshold;
    }

    public void setSeasonalityThreshold(double seasonalityThreshold) {
        this.seasonalityThreshold = seasonalityThreshold;
    }

    public boolean isRequireAutocorrelationPeak() {
        return requireAutocorrelationPeak;
    }

    public void setRequireAutocorrelationPeak(boolean requireAutocorrelationPeak) {
        this.requireAutocorrelationPeak = requireAutocorrelationPeak;
    }

    public int getChangePointWindow() {
        return changePointWindow;
    }

    public void setChangePointWindow(int changePointWindow) {
        this.changePointWindow = changePointWindow;
    }

    public double getChangePointThreshold() {
        return changePointThreshold;
    }

    public void setChangePointThreshold(double changePointThreshold) {
        this.changePointThreshold = changePointThreshold;
    }

    public int getForecastHorizon() {
        return forecastHorizon;
    }

    public void setForecastHorizon(int forecastHorizon) {
        this.forecastHorizon = forecastHorizon;
    }

    public double getForecastZ() {
        return forecastZ;
    }

    public void setForecastZ(double forecastZ) {
        this.forecastZ = forecastZ;
    }

    public double getForecastUncertaintyGrowth() {
        return forecastUncertaintyGrowth;
    }

    public void setForecastUncertaintyGrowth(double forecastUncertaintyGrowth) {
        this.forecastUncertaintyGrowth = forecastUncertaintyGrowth;
    }

    public int getHistogramBuckets() {
        return histogramBuckets;
    }

    public void setHistogramBuckets(int histogramBuckets) {
        this.histogramBuckets = histogramBuckets;
    }

    public double getNormalSkewness() {
        return normalSkewness;
    }

    public void setNormalSkewness(double normalSkewness) {
        this.normalSkewness = normalSkewness;
    }

    public double getNormalKurtosis() {
        return normalKurtosis;
    }

    public void setNormalKurtosis(double normalKurtosis) {
        this.normalKurtosis = normalKurtosis;
    }

    public double getSkewnessThreshold() {
        return skewnessThreshold;
    }

    public void setSkewnessThreshold(double skewnessThreshold) {
        this.skewnessThreshold = skewnessThreshold;
    }

    public double getKurtosisThreshold() {
        return kurtosisThreshold;
    }

    public void setKurtosisThreshold(double kurtosisThreshold) {
        this.kurtosisThreshold = kurtosisThreshold;
    }

    public double getVeryHighCv() {
        return veryHighCv;
    }

    public void setVeryHighCv(double veryHighCv) {
        this.veryHighCv = veryHighCv;
    }

    public double getHighCv() {
        return highCv;
    }

    public void setHighCv(double highCv) {
        this.highCv = highCv;
    }

    public double getLowCv() {
        return lowCv;
    }

    public void setLowCv(double lowCv) {
        this.lowCv = lowCv;
    }

    public double getSegmentOutlierSigma() {
        return segmentOutlierSigma;
    }

    public void setSegmentOutlierSigma(double segmentOutlierSigma) {
        this.segmentOutlierSigma = segmentOutlierSigma;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "sampleIntervalMinutes=" + sampleIntervalMinutes +
                ", legacyZeroFill=" + legacyZeroFill +
                ", anomalyMethods=" + anomalyMethods +
                ", anomalySensitivity=" + anomalySensitivity +
                ", maxLag=" + maxLag +
                ", seasonalityThreshold=" + seasonalityThreshold +
                ", changePointWindow=" + changePointWindow +
                ", changePointThreshold=" + changePointThreshold +
                ", forecastHorizon=" + forecastHorizon +
                ", histogramBuckets=" + histogramBuckets +
                '}';
    }
}
