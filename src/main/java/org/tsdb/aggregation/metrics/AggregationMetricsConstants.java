/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.metrics;

/**
 * Names, descriptions and units of the aggregation engine metrics.
 */
public final class AggregationMetricsConstants {

    private AggregationMetricsConstants() {}

    public static final String UNIT_COUNT = "1";

    public static final String TAG_FUNCTION = "function";

    public static final String MAP_INVOCATIONS_TOTAL = "tsdb.aggregation.map.invocations.total";
    public static final String MAP_INVOCATIONS_TOTAL_DESC = "Total number of map phase invocations, one per shard and bucket";

    public static final String REDUCE_INVOCATIONS_TOTAL = "tsdb.aggregation.reduce.invocations.total";
    public static final String REDUCE_INVOCATIONS_TOTAL_DESC = "Total number of reduce phase invocations, one per bucket";

    public static final String DECODE_FAILURES_TOTAL = "tsdb.aggregation.decode.failures.total";
    public static final String DECODE_FAILURES_TOTAL_DESC = "Total number of shard payloads that could not be decoded";

    public static final String REDUCE_PARTIALS = "tsdb.aggregation.reduce.partials";
    public static final String REDUCE_PARTIALS_DESC = "Number of shard responses folded by a single reduce";
}
