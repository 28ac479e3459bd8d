package com.metricinsight.core.distribution;

import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.DistributionReport;
import com.metricinsight.core.model.DistributionStats;
import com.metricinsight.core.model.DistributionType;
import com.metricinsight.core.model.HistogramBucket;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.model.Variability;
import com.metricinsight.core.stats.StatisticsCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Characterises the value distribution of a sample: moments, shape,
 * histogram, coefficient of variation and a fixed set of percentiles.
 *
 * <h3>Variability bands</h3>
 * <p>
 * The coefficient of variation ({@code stddev / |mean| · 100}) maps to
 * {@code very_high} above the very-high bound, {@code high} above the high
 * bound, {@code low} below the low bound and {@code moderate} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public class DistributionAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(DistributionAnalyzer.class);

    /** Percentile ranks included in every report. */
    static final double[] REPORTED_PERCENTILES = {25, 50, 75, 90, 95, 99};

    private final int histogramBuckets;
    private final double normalSkewness;
    private final double normalKurtosis;
    private final double skewnessThreshold;
    private final double kurtosisThreshold;
    private final double veryHighCv;
    private final double highCv;
    private final double lowCv;

    public DistributionAnalyzer(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.histogramBuckets = config.getHistogramBuckets();
        this.normalSkewness = config.getNormalSkewness();
        this.normalKurtosis = config.getNormalKurtosis();
        this.skewnessThreshold = config.getSkewnessThreshold();
        this.kurtosisThreshold = config.getKurtosisThreshold();
        this.veryHighCv = config.getVeryHighCv();
        this.highCv = config.getHighCv();
        this.lowCv = config.getLowCv();
    }

    /**
     * Analyse the values of a series; timestamps are ignored.
     *
     * @see #analyze(double[])
     */
    public AnalysisResult<DistributionReport> analyze(List<TimeSeriesPoint> series) {
        return analyze(TimeSeries.values(series));
    }

    /**
     * Analyse a sample.
     *
     * @param values values in any order; must not be {@code null}
     * @return the report, or insufficient data for an empty sample
     */
    public AnalysisResult<DistributionReport> analyze(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return AnalysisResult.insufficientData(1, 0, "distribution analysis needs at least one sample");
        }

        double[] sorted = StatisticsCore.sortedCopy(values);
        DistributionStats stats = StatisticsCore.computeDistributionStats(sorted);
        DistributionType type = StatisticsCore.detectDistributionType(stats,
                normalSkewness, normalKurtosis, skewnessThreshold, kurtosisThreshold);
        List<HistogramBucket> histogram = StatisticsCore.createHistogram(sorted, histogramBuckets);

        double cv = stats.getMean() == 0 ? 0 : stats.getStdDev() / Math.abs(stats.getMean()) * 100;

        Map<Double, Double> percentiles = new LinkedHashMap<>();
        for (double rank : REPORTED_PERCENTILES) {
            percentiles.put(rank, StatisticsCore.percentile(sorted, rank));
        }

        DistributionReport report = new DistributionReport(stats, type, histogram, cv,
                variability(cv), percentiles, modalBucket(histogram));
        LOG.debug("Distribution of {} samples: type={} cv={}", values.length, type, cv);
        return AnalysisResult.of(report);
    }

    Variability variability(double cv) {
        if (cv > veryHighCv) {
            return Variability.VERY_HIGH;
        } else if (cv > highCv) {
            return Variability.HIGH;
        } else if (cv < lowCv) {
            return Variability.LOW;
        }
        return Variability.MODERATE;
    }

    /** Most populated bucket; the lowest one on ties. */
    static HistogramBucket modalBucket(List<HistogramBucket> histogram) {
        HistogramBucket modal = histogram.get(0);
        for (HistogramBucket bucket : histogram) {
            if (bucket.getCount() > modal.getCount()) {
                modal = bucket;
            }
        }
        return modal;
    }
}
