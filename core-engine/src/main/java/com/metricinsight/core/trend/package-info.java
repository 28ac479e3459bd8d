/**
 * Linear trend fitting, seasonality search, change-point detection and
 * forecasting.
 */
package com.metricinsight.core.trend;
