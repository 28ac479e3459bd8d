package com.metricinsight.core;

import com.metricinsight.core.baseline.BaselineCalculator;
import com.metricinsight.core.config.AnalysisConfig;
import com.metricinsight.core.config.AnalysisConfigLoader;
import com.metricinsight.core.correlation.CorrelationAnalyzer;
import com.metricinsight.core.detection.AnomalyDetector;
import com.metricinsight.core.distribution.DistributionAnalyzer;
import com.metricinsight.core.extract.TimeSeriesExtractor;
import com.metricinsight.core.model.AnalysisResult;
import com.metricinsight.core.model.AnomalyReport;
import com.metricinsight.core.model.DistributionReport;
import com.metricinsight.core.model.GroupedBaseline;
import com.metricinsight.core.model.MetricCorrelation;
import com.metricinsight.core.model.RankedSegment;
import com.metricinsight.core.model.SegmentDifferences;
import com.metricinsight.core.model.SegmentStats;
import com.metricinsight.core.model.SingleBaseline;
import com.metricinsight.core.model.TimeSeriesPoint;
import com.metricinsight.core.model.TrendReport;
import com.metricinsight.core.segment.SegmentComparator;
import com.metricinsight.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point that wires every analyzer from a single {@link AnalysisConfig}.
 *
 * <p>
 * The engine is stateless after construction and safe to share across
 * threads. Each analysis call works only on the input it is given.
 * </p>
 *
 * <pre>
 * AnalysisEngine engine = AnalysisEngine.create();
 * AnalysisResult&lt;AnomalyReport&gt; anomalies = engine.detectAnomalies(series);
 * </pre>
 *
 * @since 1.0.0
 */
public class AnalysisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnomalyDetector anomalyDetector;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final TrendAnalyzer trendAnalyzer;
    private final DistributionAnalyzer distributionAnalyzer;
    private final SegmentComparator segmentComparator;
    private final BaselineCalculator baselineCalculator;
    private final TimeSeriesExtractor extractor;

    /**
     * @param config validated configuration; must not be {@code null}
     */
    public AnalysisEngine(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        config.validate();
        this.anomalyDetector = new AnomalyDetector(config);
        this.correlationAnalyzer = new CorrelationAnalyzer(config);
        this.trendAnalyzer = new TrendAnalyzer(config);
        this.distributionAnalyzer = new DistributionAnalyzer(config);
        this.segmentComparator = new SegmentComparator(config);
        this.baselineCalculator = new BaselineCalculator();
        this.extractor = new TimeSeriesExtractor(config.isLegacyZeroFill());
        LOG.info("Analysis engine ready: methods={} sampleInterval={}",
                config.getAnomalyMethods(), config.getSampleInterval());
    }

    /**
     * Create an engine from the configuration resolved by
     * {@link AnalysisConfigLoader#load()}.
     */
    public static AnalysisEngine create() {
        return new AnalysisEngine(AnalysisConfigLoader.load());
    }

    // ---------------------------------------------------------------
    // Series analysis
    // ---------------------------------------------------------------

    public AnalysisResult<AnomalyReport> detectAnomalies(List<TimeSeriesPoint> series) {
        return anomalyDetector.detect(series);
    }

    public AnalysisResult<AnomalyReport> detectAnomalies(List<TimeSeriesPoint> series, double sensitivity) {
        return anomalyDetector.detect(series, sensitivity);
    }

    public List<MetricCorrelation> findCorrelations(String primaryName, List<TimeSeriesPoint> primary,
                                                    Map<String, List<TimeSeriesPoint>> candidates) {
        return correlationAnalyzer.findCorrelations(primaryName, primary, candidates);
    }

    public AnalysisResult<TrendReport> analyzeTrends(List<TimeSeriesPoint> series) {
        return trendAnalyzer.analyze(series);
    }

    public AnalysisResult<DistributionReport> analyzeDistribution(List<TimeSeriesPoint> series) {
        return distributionAnalyzer.analyze(series);
    }

    public AnalysisResult<SingleBaseline> baseline(String metric, List<TimeSeriesPoint> series) {
        return baselineCalculator.baseline(metric, series);
    }

    public AnalysisResult<GroupedBaseline> groupedBaseline(String metric, String groupBy,
                                                           Map<String, List<TimeSeriesPoint>> groups) {
        return baselineCalculator.groupedBaseline(metric, groupBy, groups, BaselineCalculator.DEFAULT_PERCENTILES);
    }

    // ---------------------------------------------------------------
    // Segment analysis
    // ---------------------------------------------------------------

    public List<RankedSegment> rankSegments(List<SegmentStats> segments) {
        return segmentComparator.rankSegments(segments);
    }

    public AnalysisResult<SegmentDifferences> compareSegments(List<SegmentStats> segments) {
        return segmentComparator.analyzeSegmentDifferences(segments);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public AnomalyDetector getAnomalyDetector() {
        return anomalyDetector;
    }

    public CorrelationAnalyzer getCorrelationAnalyzer() {
        return correlationAnalyzer;
    }

    public TrendAnalyzer getTrendAnalyzer() {
        return trendAnalyzer;
    }

    public DistributionAnalyzer getDistributionAnalyzer() {
        return distributionAnalyzer;
    }

    public SegmentComparator getSegmentComparator() {
        return segmentComparator;
    }

    public BaselineCalculator getBaselineCalculator() {
        return baselineCalculator;
    }

    public TimeSeriesExtractor getExtractor() {
        return extractor;
    }
}
