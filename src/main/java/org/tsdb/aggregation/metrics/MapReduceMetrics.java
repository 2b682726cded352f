/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.metrics;

import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;

/**
 * Map and reduce phase metrics (counters and histograms).
 */
public class MapReduceMetrics {
    /** Counter for map phase invocations */
    public Counter mapInvocations;

    /** Counter for reduce phase invocations */
    public Counter reduceInvocations;

    /** Counter for shard payloads that failed to decode */
    public Counter decodeFailures;

    /** Histogram for the number of shard responses per reduce */
    public Histogram reducePartials;

    /**
     * Initialize map/reduce metrics. Called by AggregationMetrics.initialize().
     */
    public void initialize(MetricsRegistry registry) {
        mapInvocations = registry.createCounter(
            AggregationMetricsConstants.MAP_INVOCATIONS_TOTAL,
            AggregationMetricsConstants.MAP_INVOCATIONS_TOTAL_DESC,
            AggregationMetricsConstants.UNIT_COUNT
        );
        reduceInvocations = registry.createCounter(
            AggregationMetricsConstants.REDUCE_INVOCATIONS_TOTAL,
            AggregationMetricsConstants.REDUCE_INVOCATIONS_TOTAL_DESC,
            AggregationMetricsConstants.UNIT_COUNT
        );
        decodeFailures = registry.createCounter(
            AggregationMetricsConstants.DECODE_FAILURES_TOTAL,
            AggregationMetricsConstants.DECODE_FAILURES_TOTAL_DESC,
            AggregationMetricsConstants.UNIT_COUNT
        );
        reducePartials = registry.createHistogram(
            AggregationMetricsConstants.REDUCE_PARTIALS,
            AggregationMetricsConstants.REDUCE_PARTIALS_DESC,
            AggregationMetricsConstants.UNIT_COUNT
        );
    }

    /**
     * Cleanup map/reduce metrics (for tests).
     */
    public void cleanup() {
        mapInvocations = null;
        reduceInvocations = null;
        decodeFailures = null;
        reducePartials = null;
    }
}
