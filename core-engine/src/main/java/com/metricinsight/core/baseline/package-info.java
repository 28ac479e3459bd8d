/**
 * Whole-series and per-group baselines.
 */
package com.metricinsight.core.baseline;
