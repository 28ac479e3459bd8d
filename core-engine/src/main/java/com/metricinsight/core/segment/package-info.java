/**
 * Ranking and outlier detection over pre-aggregated per-segment statistics.
 */
package com.metricinsight.core.segment;
