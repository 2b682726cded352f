/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.metrics.tags.Tags;

import java.util.Locale;

/** Aggregation engine metrics: counters and histograms initialized once via telemetry. */
public class AggregationMetrics {
    private static final Logger logger = LogManager.getLogger(AggregationMetrics.class);
    private static volatile MetricsRegistry registry;

    public static final MapReduceMetrics MAP_REDUCE = new MapReduceMetrics();

    private AggregationMetrics() {}

    /**
     * Initialize all aggregation metrics. Safe to call once; subsequent calls are ignored.
     */
    public static synchronized void initialize(MetricsRegistry metricsRegistry) {
        if (metricsRegistry == null) {
            throw new IllegalArgumentException("MetricsRegistry cannot be null");
        }
        // Skip initialization if a Noop registry is provided.
        if (isNoopRegistry(metricsRegistry)) {
            logger.warn("Noop MetricsRegistry provided; skipping aggregation metrics initialization");
            return;
        }
        if (registry != null) {
            logger.warn("AggregationMetrics already initialized, skipping re-initialization");
            return;
        }

        MAP_REDUCE.initialize(metricsRegistry);

        // Only set registry after successful initialization
        registry = metricsRegistry;
    }

    /**
     * Check if metrics have been initialized.
     */
    public static boolean isInitialized() {
        return registry != null;
    }

    /**
     * Tags identifying the aggregate function a measurement belongs to.
     */
    public static Tags functionTags(String functionName) {
        return Tags.create().addTag(AggregationMetricsConstants.TAG_FUNCTION, functionName);
    }

    /**
     * Safely increment a counter by a specific amount with tags.
     * Provides null safety and initialization checks.
     */
    public static void incrementCounter(Counter counter, long value, Tags tags) {
        if (isInitialized() && counter != null) {
            counter.add(value, tags);
        }
    }

    /**
     * Safely record a histogram value with tags.
     * Provides null safety and initialization checks.
     */
    public static void recordHistogram(Histogram histogram, double value, Tags tags) {
        if (isInitialized() && histogram != null) {
            histogram.record(value, tags);
        }
    }

    private static boolean isNoopRegistry(MetricsRegistry r) {
        String name = r.getClass().getName();
        if (name.toLowerCase(Locale.ROOT).contains("noop")) {
            return true;
        }
        String desc = r.toString();
        return desc != null && desc.toLowerCase(Locale.ROOT).contains("noop");
    }

    /** Cleanup all metrics (for tests). */
    public static synchronized void cleanup() {
        registry = null;
        MAP_REDUCE.cleanup();
        logger.info("Aggregation metrics cleanup completed");
    }
}
