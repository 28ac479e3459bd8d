/**
 * Timestamp alignment, Pearson and lagged correlation between metrics.
 */
package com.metricinsight.core.correlation;
