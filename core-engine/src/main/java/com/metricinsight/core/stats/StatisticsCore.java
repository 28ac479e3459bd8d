package com.metricinsight.core.stats;

import com.metricinsight.core.model.DistributionStats;
import com.metricinsight.core.model.DistributionType;
import com.metricinsight.core.model.HistogramBucket;
import com.metricinsight.core.model.Statistics;
import com.metricinsight.core.model.TimeSeries;
import com.metricinsight.core.model.TimeSeriesPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Moment statistics, percentiles, mode, histograms and distribution-shape
 * classification.
 *
 * <h3>Conventions</h3>
 * <ul>
 * <li>Variance, skewness and kurtosis use the population divisor {@code n}
 * (no Bessel correction).</li>
 * <li>Kurtosis is excess kurtosis: {@code m4 / variance² − 3}.</li>
 * <li>Percentiles interpolate linearly between the floor and ceiling of rank
 * {@code p/100·(n−1)}.</li>
 * <li>Mode ties resolve to the lowest value.</li>
 * <li>A zero standard deviation yields skewness and kurtosis of 0.</li>
 * </ul>
 *
 * <p>
 * All methods are pure and safe for concurrent use.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticsCore {

    /** {@code |skewness|} and {@code |kurtosis|} below this are "normal". */
    public static final double DEFAULT_NORMAL_BAND = 0.5;

    /** {@code |skewness|} or {@code |kurtosis|} beyond this names the shape. */
    public static final double DEFAULT_SHAPE_THRESHOLD = 1.0;

    private StatisticsCore() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Distribution statistics
    // ---------------------------------------------------------------

    /**
     * Compute moment and order statistics of an ascending-sorted sample.
     *
     * @param sortedValues values in ascending order; must not be {@code null}
     * @return statistics; all zero for an empty sample
     * @throws IllegalArgumentException if the values are not sorted
     */
    public static DistributionStats computeDistributionStats(double[] sortedValues) {
        requireSorted(sortedValues);
        int n = sortedValues.length;
        if (n == 0) {
            return DistributionStats.empty();
        }

        double sum = 0;
        for (double v : sortedValues) {
            sum += v;
        }
        double mean = sum / n;

        double sumSquares = 0;
        double sumCubes = 0;
        double sumQuads = 0;
        for (double v : sortedValues) {
            double diff = v - mean;
            double squared = diff * diff;
            sumSquares += squared;
            sumCubes += squared * diff;
            sumQuads += squared * squared;
        }
        double variance = sumSquares / n;
        double stdDev = Math.sqrt(variance);

        double skewness = 0;
        double kurtosis = 0;
        if (stdDev > 0) {
            skewness = (sumCubes / n) / (variance * stdDev);
            kurtosis = (sumQuads / n) / (variance * variance) - 3;
        }

        return DistributionStats.builder()
                .mean(mean)
                .median(percentile(sortedValues, 50))
                .mode(mode(sortedValues))
                .stdDev(stdDev)
                .variance(variance)
                .skewness(skewness)
                .kurtosis(kurtosis)
                .min(sortedValues[0])
                .max(sortedValues[n - 1])
                .count(n)
                .build();
    }

    /**
     * Sort a copy of {@code values} and compute its distribution statistics.
     *
     * @param values values in any order; must not be {@code null}
     * @return statistics; all zero for an empty sample
     */
    public static DistributionStats describe(double[] values) {
        return computeDistributionStats(sortedCopy(values));
    }

    /**
     * Percentile by linear interpolation between neighbouring ranks.
     *
     * @param sortedValues values in ascending order; must not be {@code null}
     * @param p            percentile rank in {@code [0, 100]}
     * @return the percentile, or 0 for an empty sample
     * @throws IllegalArgumentException if {@code p} is out of range
     */
    public static double percentile(double[] sortedValues, double p) {
        Objects.requireNonNull(sortedValues, "values must not be null");
        if (!(p >= 0 && p <= 100)) {
            throw new IllegalArgumentException("Percentile must be in [0, 100], got: " + p);
        }
        int n = sortedValues.length;
        if (n == 0) {
            return 0;
        }
        double rank = p / 100 * (n - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sortedValues[lower];
        }
        return sortedValues[lower] + (rank - lower) * (sortedValues[upper] - sortedValues[lower]);
    }

    /**
     * Most frequent value. Among equally frequent values the lowest wins.
     *
     * @param sortedValues values in ascending order; must not be {@code null}
     * @return the mode, or 0 for an empty sample
     */
    public static double mode(double[] sortedValues) {
        Objects.requireNonNull(sortedValues, "values must not be null");
        if (sortedValues.length == 0) {
            return 0;
        }

        // Equal values are adjacent, so the first longest run is the lowest mode.
        double mode = sortedValues[0];
        int bestRun = 0;
        int i = 0;
        while (i < sortedValues.length) {
            int j = i;
            while (j < sortedValues.length && Double.compare(sortedValues[j], sortedValues[i]) == 0) {
                j++;
            }
            if (j - i > bestRun) {
                bestRun = j - i;
                mode = sortedValues[i];
            }
            i = j;
        }
        return mode;
    }

    // ---------------------------------------------------------------
    // Histogram
    // ---------------------------------------------------------------

    /**
     * Build equal-width buckets spanning {@code [min, max]}.
     *
     * <p>
     * Every bucket is half-open {@code [start, end)} except the last, which is
     * closed so that it contains {@code max}. Bucket counts always sum to
     * {@code values.length}. When all values are equal the width is zero and
     * every value lands in the last bucket.
     * </p>
     *
     * @param values     values in any order; must not be {@code null}
     * @param numBuckets number of buckets; must be positive
     * @return buckets in ascending order, or an empty list for empty input
     * @throws IllegalArgumentException if {@code numBuckets <= 0}
     */
    public static List<HistogramBucket> createHistogram(double[] values, int numBuckets) {
        Objects.requireNonNull(values, "values must not be null");
        if (numBuckets <= 0) {
            throw new IllegalArgumentException("numBuckets must be > 0, got: " + numBuckets);
        }
        if (values.length == 0) {
            return List.of();
        }

        double min = values[0];
        double max = values[0];
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double width = (max - min) / numBuckets;

        int[] counts = new int[numBuckets];
        for (double v : values) {
            counts[bucketIndex(v, min, width, numBuckets)]++;
        }

        List<HistogramBucket> buckets = new ArrayList<>(numBuckets);
        for (int i = 0; i < numBuckets; i++) {
            double start = min + i * width;
            double end = i == numBuckets - 1 ? max : start + width;
            double percentage = counts[i] * 100.0 / values.length;
            buckets.add(new HistogramBucket(start, end, counts[i], percentage));
        }
        return buckets;
    }

    private static int bucketIndex(double value, double min, double width, int numBuckets) {
        if (width == 0) {
            return numBuckets - 1;
        }
        int index = (int) Math.floor((value - min) / width);
        return Math.max(0, Math.min(numBuckets - 1, index));
    }

    // ---------------------------------------------------------------
    // Shape classification
    // ---------------------------------------------------------------

    /**
     * Classify the distribution shape using the default thresholds.
     *
     * @see #detectDistributionType(DistributionStats, double, double, double, double)
     */
    public static DistributionType detectDistributionType(DistributionStats stats) {
        return detectDistributionType(stats, DEFAULT_NORMAL_BAND, DEFAULT_NORMAL_BAND,
                DEFAULT_SHAPE_THRESHOLD, DEFAULT_SHAPE_THRESHOLD);
    }

    /**
     * Classify the distribution shape. Checks run in this order and the first
     * match wins:
     * <ol>
     * <li>{@code |skew| < normalSkewness ∧ |kurt| < normalKurtosis} → normal</li>
     * <li>{@code skew > skewThreshold} → right-skewed</li>
     * <li>{@code skew < −skewThreshold} → left-skewed</li>
     * <li>{@code kurt > kurtosisThreshold} → leptokurtic</li>
     * <li>{@code kurt < −kurtosisThreshold} → platykurtic</li>
     * <li>otherwise → non-normal</li>
     * </ol>
     * Values between the normal band and the shape thresholds fall through to
     * non-normal.
     *
     * @param stats statistics to classify; must not be {@code null}
     * @return the shape
     */
    public static DistributionType detectDistributionType(DistributionStats stats,
                                                          double normalSkewness,
                                                          double normalKurtosis,
                                                          double skewThreshold,
                                                          double kurtosisThreshold) {
        Objects.requireNonNull(stats, "stats must not be null");
        double skew = stats.getSkewness();
        double kurt = stats.getKurtosis();

        if (Math.abs(skew) < normalSkewness && Math.abs(kurt) < normalKurtosis) {
            return DistributionType.NORMAL;
        } else if (skew > skewThreshold) {
            return DistributionType.RIGHT_SKEWED;
        } else if (skew < -skewThreshold) {
            return DistributionType.LEFT_SKEWED;
        } else if (kurt > kurtosisThreshold) {
            return DistributionType.LEPTOKURTIC;
        } else if (kurt < -kurtosisThreshold) {
            return DistributionType.PLATYKURTIC;
        }
        return DistributionType.NON_NORMAL;
    }

    // ---------------------------------------------------------------
    // Window statistics
    // ---------------------------------------------------------------

    /**
     * Population mean, standard deviation and extremes of a window.
     *
     * @param window values in any order; must not be {@code null}
     * @return statistics; {@link Statistics#empty()} for an empty window
     */
    public static Statistics windowStats(double[] window) {
        return windowStats(window, 0, window.length);
    }

    /**
     * Population statistics of {@code values[from, to)} without copying.
     *
     * @throws IndexOutOfBoundsException if the range is invalid
     */
    public static Statistics windowStats(double[] values, int from, int to) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.checkFromToIndex(from, to, values.length);
        int n = to - from;
        if (n == 0) {
            return Statistics.empty();
        }

        double sum = 0;
        double min = values[from];
        double max = values[from];
        for (int i = from; i < to; i++) {
            sum += values[i];
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        double mean = sum / n;

        double sumSquares = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquares += diff * diff;
        }
        return new Statistics(mean, Math.sqrt(sumSquares / n), min, max, n);
    }

    /**
     * Population statistics of a whole series.
     *
     * @param series points in any order; must not be {@code null}
     * @return statistics; {@link Statistics#empty()} for an empty series
     */
    public static Statistics computeStatistics(List<TimeSeriesPoint> series) {
        return windowStats(TimeSeries.values(series));
    }

    /**
     * @param values values in any order; must not be {@code null}
     * @return a new ascending array
     */
    public static double[] sortedCopy(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    private static void requireSorted(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[i - 1]) {
                throw new IllegalArgumentException(
                        "Values must be sorted ascending; index " + i + " breaks the order");
            }
        }
    }
}
