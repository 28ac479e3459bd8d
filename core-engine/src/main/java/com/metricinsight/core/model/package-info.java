/**
 * Immutable domain model for the analysis engine.
 *
 * <p>
 * {@link com.metricinsight.core.model.TimeSeriesPoint} is the universal
 * input. Every analyzer returns either a plain value object or an
 * {@link com.metricinsight.core.model.AnalysisResult}, which carries an
 * {@link com.metricinsight.core.model.InsufficientData} descriptor instead of
 * a value when the input is too short for the requested algorithm.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricinsight.core.model;
