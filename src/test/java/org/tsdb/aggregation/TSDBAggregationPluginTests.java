/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation;

import org.opensearch.common.settings.Settings;
import org.opensearch.env.Environment;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;
import org.opensearch.test.OpenSearchTestCase;
import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.metrics.AggregationMetrics;
import org.tsdb.aggregation.query.aggregator.AggregateFunctionRegistry;
import org.tsdb.aggregation.query.aggregator.BucketAggregationExecutor;

import java.util.ArrayList;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TSDBAggregationPluginTests extends OpenSearchTestCase {
    private TSDBAggregationPlugin plugin;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        AggregationMetrics.cleanup();
        plugin = new TSDBAggregationPlugin();
    }

    @Override
    public void tearDown() throws Exception {
        plugin.close();
        super.tearDown();
    }

    public void testSettingsRegistered() {
        assertTrue(plugin.getSettings().contains(TSDBAggregationPlugin.PARTIAL_RESULTS_ENABLED));
        assertTrue(plugin.getSettings().contains(TSDBAggregationPlugin.RAW_MAX_POINTS));
    }

    public void testSettingDefaults() {
        assertTrue(TSDBAggregationPlugin.PARTIAL_RESULTS_ENABLED.get(Settings.EMPTY));
        assertEquals(Integer.valueOf(0), TSDBAggregationPlugin.RAW_MAX_POINTS.get(Settings.EMPTY));
    }

    public void testNegativeRawLimitRejected() {
        Settings settings = Settings.builder().put(Constants.Settings.RAW_MAX_POINTS, -1).build();
        expectThrows(IllegalArgumentException.class, () -> TSDBAggregationPlugin.RAW_MAX_POINTS.get(settings));
    }

    public void testCreateComponents() {
        Settings settings = Settings.builder().put(Constants.Settings.PARTIAL_RESULTS_ENABLED, false).build();
        Environment environment = mock(Environment.class);
        when(environment.settings()).thenReturn(settings);
        MetricsRegistry metricsRegistry = mock(MetricsRegistry.class);
        when(metricsRegistry.createCounter(anyString(), anyString(), anyString())).thenReturn(mock(Counter.class));
        when(metricsRegistry.createHistogram(anyString(), anyString(), anyString())).thenReturn(mock(Histogram.class));

        List<Object> components = new ArrayList<>(
            plugin.createComponents(null, null, null, null, null, null, environment, null, null, null, null, null, metricsRegistry)
        );

        assertEquals(2, components.size());
        assertTrue(components.get(0) instanceof AggregateFunctionRegistry);
        assertTrue(((AggregateFunctionRegistry) components.get(0)).isRegistered(Constants.Functions.MEDIAN));
        assertFalse(((BucketAggregationExecutor) components.get(1)).isPartialResultsEnabled());
        assertTrue(AggregationMetrics.isInitialized());

        plugin.close();
        assertFalse(AggregationMetrics.isInitialized());
    }
}
