/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.client.Client;
import org.opensearch.cluster.metadata.IndexNameExpressionResolver;
import org.opensearch.cluster.service.ClusterService;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.core.common.io.stream.NamedWriteableRegistry;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.env.Environment;
import org.opensearch.env.NodeEnvironment;
import org.opensearch.plugins.Plugin;
import org.opensearch.plugins.TelemetryAwarePlugin;
import org.opensearch.repositories.RepositoriesService;
import org.opensearch.script.ScriptService;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.telemetry.tracing.Tracer;
import org.opensearch.threadpool.ThreadPool;
import org.opensearch.watcher.ResourceWatcherService;
import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.metrics.AggregationMetrics;
import org.tsdb.aggregation.query.aggregator.AggregateFunctionRegistry;
import org.tsdb.aggregation.query.aggregator.BucketAggregationExecutor;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Plugin wiring the map/reduce aggregation engine into a node: registers its settings, initializes
 * its metrics and exposes the function registry and the bucket executor as node components.
 */
public class TSDBAggregationPlugin extends Plugin implements TelemetryAwarePlugin {
    private static final Logger logger = LogManager.getLogger(TSDBAggregationPlugin.class);

    /**
     * Whether a bucket is still answered when some shard payloads fail to decode. When disabled the
     * first decode failure fails the bucket.
     */
    public static final Setting<Boolean> PARTIAL_RESULTS_ENABLED = Setting.boolSetting(
        Constants.Settings.PARTIAL_RESULTS_ENABLED,
        true,
        Setting.Property.NodeScope
    );

    /**
     * Upper bound on the points a raw query may return for one bucket. 0 disables the limit.
     */
    public static final Setting<Integer> RAW_MAX_POINTS = Setting.intSetting(Constants.Settings.RAW_MAX_POINTS, 0, 0, Setting.Property.NodeScope);

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(PARTIAL_RESULTS_ENABLED, RAW_MAX_POINTS);
    }

    @Override
    public Collection<Object> createComponents(
        Client client,
        ClusterService clusterService,
        ThreadPool threadPool,
        ResourceWatcherService resourceWatcherService,
        ScriptService scriptService,
        NamedXContentRegistry xContentRegistry,
        Environment environment,
        NodeEnvironment nodeEnvironment,
        NamedWriteableRegistry namedWriteableRegistry,
        IndexNameExpressionResolver indexNameExpressionResolver,
        Supplier<RepositoriesService> repositoriesServiceSupplier,
        Tracer tracer,
        MetricsRegistry metricsRegistry
    ) {
        Settings settings = environment.settings();
        AggregationMetrics.initialize(metricsRegistry);

        AggregateFunctionRegistry functionRegistry = AggregateFunctionRegistry.fromSettings(settings);
        BucketAggregationExecutor executor = new BucketAggregationExecutor(settings);
        logger.info(
            "Aggregation engine started with functions {}, partial results enabled: {}",
            functionRegistry.getFunctionNames(),
            executor.isPartialResultsEnabled()
        );
        return List.of(functionRegistry, executor);
    }

    @Override
    public void close() {
        AggregationMetrics.cleanup();
    }
}
