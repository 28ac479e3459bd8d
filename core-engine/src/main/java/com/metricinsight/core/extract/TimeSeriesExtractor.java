package com.metricinsight.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricinsight.core.model.SegmentStats;
import com.metricinsight.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Converts raw query results (JSON) into analysis input.
 *
 * <h3>Time series</h3>
 *
 * <pre>
 * {"results": [{"timestamp": 1700000000000, "value": 12.5}, ...]}
 * </pre>
 * <p>
 * {@code timestamp} is epoch milliseconds; {@code average} is read when
 * {@code value} is absent. Entries without a timestamp are dropped. Entries
 * without a numeric value are dropped too, unless legacy zero-fill is on, in
 * which case they become 0. When two entries share a timestamp the later one
 * wins. The result is sorted by timestamp.
 * </p>
 *
 * <h3>Segments</h3>
 *
 * <pre>
 * {"facets": [{"name": ["us-east"], "results": [{"avg": 1.0, "count": 10, ...}]}]}
 * </pre>
 *
 * @since 1.0.0
 */
public class TimeSeriesExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesExtractor.class);

    private final ObjectMapper mapper;
    private final boolean legacyZeroFill;

    /**
     * @param legacyZeroFill substitute 0 for missing values instead of dropping
     *                       the sample
     */
    public TimeSeriesExtractor(boolean legacyZeroFill) {
        this(new ObjectMapper(), legacyZeroFill);
    }

    public TimeSeriesExtractor(ObjectMapper mapper, boolean legacyZeroFill) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.legacyZeroFill = legacyZeroFill;
    }

    // ---------------------------------------------------------------
    // Time series
    // ---------------------------------------------------------------

    /**
     * Parse {@code json} and extract its time series.
     *
     * @param json raw query result; must not be {@code null}
     * @return points in ascending timestamp order
     * @throws IllegalArgumentException if {@code json} is not valid JSON
     */
    public List<TimeSeriesPoint> extract(String json) {
        return extract(parse(json));
    }

    /**
     * Extract the time series from a parsed query result.
     *
     * @param root parsed query result; must not be {@code null}
     * @return points in ascending timestamp order; empty when there is no
     *         {@code results} array
     */
    public List<TimeSeriesPoint> extract(JsonNode root) {
        Objects.requireNonNull(root, "JSON root must not be null");
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            LOG.trace("No 'results' array in query result – nothing to extract");
            return List.of();
        }

        Map<Instant, Double> byTimestamp = new TreeMap<>();
        int dropped = 0;
        for (JsonNode entry : results) {
            JsonNode timestamp = entry.path("timestamp");
            if (!timestamp.isNumber()) {
                dropped++;
                continue;
            }
            JsonNode value = entry.path("value");
            if (!value.isNumber()) {
                value = entry.path("average");
            }
            if (value.isNumber()) {
                byTimestamp.put(Instant.ofEpochMilli(timestamp.asLong()), value.asDouble());
            } else if (legacyZeroFill) {
                byTimestamp.put(Instant.ofEpochMilli(timestamp.asLong()), 0.0);
            } else {
                dropped++;
            }
        }

        if (dropped > 0) {
            LOG.warn("Dropped {} of {} raw sample(s) without a timestamp or value", dropped, results.size());
        }
        List<TimeSeriesPoint> series = new ArrayList<>(byTimestamp.size());
        byTimestamp.forEach((ts, v) -> series.add(TimeSeriesPoint.of(ts, v)));
        return series;
    }

    // ---------------------------------------------------------------
    // Segments
    // ---------------------------------------------------------------

    /**
     * Parse {@code json} and extract its per-facet aggregates.
     *
     * @throws IllegalArgumentException if {@code json} is not valid JSON
     */
    public List<SegmentStats> extractSegments(String json) {
        return extractSegments(parse(json));
    }

    /**
     * Extract one {@link SegmentStats} per facet. Facets without a result
     * object or without a numeric {@code avg} are skipped.
     *
     * @param root parsed query result; must not be {@code null}
     * @return segments in facet order
     */
    public List<SegmentStats> extractSegments(JsonNode root) {
        Objects.requireNonNull(root, "JSON root must not be null");
        JsonNode facets = root.path("facets");
        if (!facets.isArray()) {
            LOG.trace("No 'facets' array in query result – nothing to extract");
            return List.of();
        }

        List<SegmentStats> segments = new ArrayList<>();
        for (JsonNode facet : facets) {
            JsonNode data = facet.path("results").path(0);
            if (!data.isObject() || !data.path("avg").isNumber()) {
                LOG.trace("Facet {} has no aggregate result – skipping", facet.path("name"));
                continue;
            }
            JsonNode percentiles = data.path("percentiles");
            segments.add(SegmentStats.builder()
                    .name(facetName(facet.path("name")))
                    .avg(data.path("avg").asDouble())
                    .count(data.path("count").asDouble())
                    .stddev(data.path("stddev").asDouble())
                    .min(data.path("min").asDouble())
                    .max(data.path("max").asDouble())
                    .p50(optionalNumber(percentiles.path("50")))
                    .p90(optionalNumber(percentiles.path("90")))
                    .p95(optionalNumber(percentiles.path("95")))
                    .build());
        }
        return segments;
    }

    private static String facetName(JsonNode name) {
        if (name.isArray()) {
            return name.size() > 0 ? name.get(0).asText() : "";
        }
        return name.isMissingNode() || name.isNull() ? "" : name.asText();
    }

    private static Double optionalNumber(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    private JsonNode parse(String json) {
        Objects.requireNonNull(json, "JSON must not be null");
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed query result: " + e.getOriginalMessage(), e);
        }
    }

    public boolean isLegacyZeroFill() {
        return legacyZeroFill;
    }
}
