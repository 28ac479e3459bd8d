/**
 * Pure statistical primitives shared by every analyzer: moments,
 * percentiles, mode, histograms and distribution-shape classification.
 *
 * <p>
 * All variance-based figures use the population divisor {@code n}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricinsight.core.stats;
