/**
 * Distribution characterisation built on
 * {@link com.metricinsight.core.stats.StatisticsCore}.
 */
package com.metricinsight.core.distribution;
