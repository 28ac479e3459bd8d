/**
 * JSON query-result extraction using Jackson.
 */
package com.metricinsight.core.extract;
