/**
 * Configuration loading and validation for the analysis engine.
 *
 * <p>
 * Thresholds are defined in YAML and loaded by
 * {@link com.metricinsight.core.config.AnalysisConfigLoader} into an
 * {@link com.metricinsight.core.config.AnalysisConfig} instance. Validation
 * runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricinsight.core.config;
