/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;
import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.query.aggregator.function.CountFunction;
import org.tsdb.aggregation.query.aggregator.function.MedianFunction;
import org.tsdb.aggregation.query.aggregator.function.PercentileFunction;
import org.tsdb.aggregation.query.aggregator.function.RawFunction;
import org.tsdb.aggregation.query.aggregator.function.SumFunction;
import org.tsdb.aggregation.query.aggregator.intermediate.RawPoint;
import org.tsdb.aggregation.query.aggregator.intermediate.RawPoints;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class AggregateFunctionRegistryTests extends OpenSearchTestCase {

    private AggregateFunctionRegistry registry;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        registry = AggregateFunctionRegistry.createDefault(OpenSearchTestCase::random, 0);
    }

    public void testBuiltInFunctions() {
        assertEquals(
            Set.of("count", "sum", "mean", "min", "max", "spread", "stddev", "median", "percentile", "first", "last"),
            registry.getFunctionNames()
        );
        for (String name : registry.getFunctionNames()) {
            if (name.equals(Constants.Functions.PERCENTILE) == false) {
                assertEquals(name, registry.resolve(AggregateCall.onField(name, "value")).getName());
            }
        }
    }

    public void testResolvesSpecificImplementations() {
        assertTrue(registry.resolve(AggregateCall.onField("count", "value")) instanceof CountFunction);
        assertTrue(registry.resolve(AggregateCall.onField("median", "value")) instanceof MedianFunction);
    }

    public void testNullCallResolvesToRawPassthrough() {
        assertTrue(registry.resolve(null) instanceof RawFunction);
        assertEquals(Constants.Functions.RAW, registry.resolve(null).getName());
    }

    public void testPercentileTakesRankLiteral() {
        AggregateFunction<?, ?> function = registry.resolve(
            AggregateCall.of("percentile", new FieldReference("value"), new NumberLiteral(99.5))
        );

        assertTrue(function instanceof PercentileFunction);
        assertEquals(99.5, ((PercentileFunction) function).getPercentile(), 0.0);
    }

    public void testUnknownFunction() {
        InvalidAggregateCallException e = expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.onField("mode", "value"))
        );
        assertEquals("mode", e.getFunctionName());
        assertEquals("function not found: [mode]", e.getMessage());
    }

    public void testWrongArgumentCount() {
        InvalidAggregateCallException e = expectThrows(InvalidAggregateCallException.class, () -> registry.resolve(AggregateCall.of("sum")));
        assertEquals("expected 1 argument for sum()", e.getMessage());

        e = expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("mean", new FieldReference("a"), new FieldReference("b")))
        );
        assertEquals("expected 1 argument for mean()", e.getMessage());

        e = expectThrows(InvalidAggregateCallException.class, () -> registry.resolve(AggregateCall.onField("percentile", "value")));
        assertEquals("expected 2 arguments for percentile()", e.getMessage());
    }

    public void testFirstArgumentMustBeField() {
        InvalidAggregateCallException e = expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("max", new NumberLiteral(1)))
        );
        assertEquals("expected field argument in max()", e.getMessage());

        e = expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("percentile", new StringLiteral("value"), new NumberLiteral(50)))
        );
        assertEquals("expected field argument in percentile()", e.getMessage());
    }

    public void testPercentileRankMustBeNumericLiteral() {
        InvalidAggregateCallException e = expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("percentile", new FieldReference("value"), new StringLiteral("90")))
        );
        assertEquals("expected numeric argument in percentile()", e.getMessage());

        expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("percentile", new FieldReference("value"), new FieldReference("rank")))
        );
    }

    public void testPercentileRankRange() {
        expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("percentile", new FieldReference("value"), new NumberLiteral(101)))
        );
        expectThrows(
            InvalidAggregateCallException.class,
            () -> registry.resolve(AggregateCall.of("percentile", new FieldReference("value"), new NumberLiteral(-0.1)))
        );
    }

    public void testCustomRegistration() {
        registry.register("total", 1, call -> new SumFunction());

        assertTrue(registry.isRegistered("total"));
        assertTrue(registry.resolve(AggregateCall.onField("total", "value")) instanceof SumFunction);
    }

    public void testDuplicateRegistrationRejected() {
        expectThrows(IllegalArgumentException.class, () -> registry.register("sum", 1, call -> new SumFunction()));
        expectThrows(IllegalArgumentException.class, () -> registry.register("nothing", 0, call -> new SumFunction()));
    }

    public void testFromSettingsAppliesRawLimit() {
        AggregateFunctionRegistry configured = AggregateFunctionRegistry.fromSettings(
            Settings.builder().put(Constants.Settings.RAW_MAX_POINTS, 1).build()
        );
        @SuppressWarnings("unchecked")
        AggregateFunction<RawPoints, List<RawPoint>> raw = (AggregateFunction<RawPoints, List<RawPoint>>) configured.resolve(null);
        RawPoints twoPoints = new RawPoints(List.of(new RawPoint(1L, 1.0), new RawPoint(2L, 2.0)));

        expectThrows(IllegalArgumentException.class, () -> raw.reduce(List.of(Optional.of(twoPoints))));
    }
}
