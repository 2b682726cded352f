/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.Nullable;
import org.opensearch.common.Randomness;
import org.opensearch.common.settings.Settings;
import org.tsdb.aggregation.TSDBAggregationPlugin;
import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.query.aggregator.function.CountFunction;
import org.tsdb.aggregation.query.aggregator.function.FirstFunction;
import org.tsdb.aggregation.query.aggregator.function.LastFunction;
import org.tsdb.aggregation.query.aggregator.function.MaxFunction;
import org.tsdb.aggregation.query.aggregator.function.MeanFunction;
import org.tsdb.aggregation.query.aggregator.function.MedianFunction;
import org.tsdb.aggregation.query.aggregator.function.MinFunction;
import org.tsdb.aggregation.query.aggregator.function.PercentileFunction;
import org.tsdb.aggregation.query.aggregator.function.RawFunction;
import org.tsdb.aggregation.query.aggregator.function.SpreadFunction;
import org.tsdb.aggregation.query.aggregator.function.StddevFunction;
import org.tsdb.aggregation.query.aggregator.function.SumFunction;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps aggregate calls to the {@link AggregateFunction} serving them.
 *
 * <p>Every function is registered with a descriptor holding its name, its expected number of
 * arguments and a factory. Resolving a call validates it against the descriptor before any
 * map or reduce work happens:</p>
 * <ul>
 *   <li>the function must be registered</li>
 *   <li>the argument count must match the registered arity</li>
 *   <li>the first argument must be a {@link FieldReference}</li>
 *   <li>anything else is checked by the factory, e.g. the numeric rank of {@code percentile}</li>
 * </ul>
 * <p>Failures are reported as {@link InvalidAggregateCallException}. A {@code null} call means the
 * query wants raw points and resolves to the raw passthrough function.</p>
 *
 * <p>The returned function fixes the intermediate type for the whole query: the same instance is
 * used to map on every shard, to decode shard payloads and to reduce them.</p>
 */
public class AggregateFunctionRegistry {
    private static final Logger logger = LogManager.getLogger(AggregateFunctionRegistry.class);

    /**
     * Builds the function serving a validated call.
     */
    @FunctionalInterface
    public interface FunctionFactory {
        /**
         * @param call a call whose arity and field argument were already checked
         * @throws InvalidAggregateCallException if the remaining arguments are not acceptable
         */
        AggregateFunction<?, ?> create(AggregateCall call);
    }

    /**
     * Registration entry for one function name.
     */
    public static final class FunctionDescriptor {
        private final String name;
        private final int arity;
        private final FunctionFactory factory;

        FunctionDescriptor(String name, int arity, FunctionFactory factory) {
            this.name = name;
            this.arity = arity;
            this.factory = factory;
        }

        public String getName() {
            return name;
        }

        public int getArity() {
            return arity;
        }

        AggregateFunction<?, ?> create(AggregateCall call) {
            if (call.arguments().size() != arity) {
                throw new InvalidAggregateCallException(
                    name,
                    String.format(Locale.ROOT, "expected %d argument%s for %s()", arity, arity == 1 ? "" : "s", name)
                );
            }
            if (!(call.arguments().get(0) instanceof FieldReference)) {
                throw new InvalidAggregateCallException(name, String.format(Locale.ROOT, "expected field argument in %s()", name));
            }
            return factory.create(call);
        }
    }

    private final Map<String, FunctionDescriptor> descriptors = new ConcurrentHashMap<>();
    private final RawFunction rawFunction;

    /**
     * Creates an empty registry.
     *
     * @param rawFunction function returned for calls without an aggregate
     */
    public AggregateFunctionRegistry(RawFunction rawFunction) {
        this.rawFunction = Objects.requireNonNull(rawFunction, "rawFunction must not be null");
    }

    /**
     * Creates a registry holding every built-in function.
     *
     * @param randomSupplier pivot randomness for median selection
     * @param rawMaxPoints point limit of raw queries, 0 for none
     */
    public static AggregateFunctionRegistry createDefault(Supplier<Random> randomSupplier, int rawMaxPoints) {
        AggregateFunctionRegistry registry = new AggregateFunctionRegistry(new RawFunction(rawMaxPoints));

        CountFunction count = new CountFunction();
        SumFunction sum = new SumFunction();
        MeanFunction mean = new MeanFunction();
        MinFunction min = new MinFunction();
        MaxFunction max = new MaxFunction();
        SpreadFunction spread = new SpreadFunction();
        StddevFunction stddev = new StddevFunction();
        MedianFunction median = new MedianFunction(randomSupplier);
        FirstFunction first = new FirstFunction();
        LastFunction last = new LastFunction();

        return registry.register(Constants.Functions.COUNT, 1, call -> count)
            .register(Constants.Functions.SUM, 1, call -> sum)
            .register(Constants.Functions.MEAN, 1, call -> mean)
            .register(Constants.Functions.MIN, 1, call -> min)
            .register(Constants.Functions.MAX, 1, call -> max)
            .register(Constants.Functions.SPREAD, 1, call -> spread)
            .register(Constants.Functions.STDDEV, 1, call -> stddev)
            .register(Constants.Functions.MEDIAN, 1, call -> median)
            .register(Constants.Functions.FIRST, 1, call -> first)
            .register(Constants.Functions.LAST, 1, call -> last)
            .register(Constants.Functions.PERCENTILE, 2, AggregateFunctionRegistry::percentile);
    }

    /**
     * Creates a registry of the built-in functions configured from node settings. Median pivots come
     * from {@link Randomness#get()}.
     */
    public static AggregateFunctionRegistry fromSettings(Settings settings) {
        return createDefault(Randomness::get, TSDBAggregationPlugin.RAW_MAX_POINTS.get(settings));
    }

    /**
     * Registers a function.
     *
     * @param name function name used in queries
     * @param arity exact number of arguments, the first of which must be a field reference
     * @param factory builds the function for a call
     * @return this registry
     * @throws IllegalArgumentException if the name is already registered or the arity is below one
     */
    public AggregateFunctionRegistry register(String name, int arity, FunctionFactory factory) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (arity < 1) {
            throw new IllegalArgumentException("Arity must be at least 1, got: " + arity);
        }
        FunctionDescriptor previous = descriptors.putIfAbsent(name, new FunctionDescriptor(name, arity, factory));
        if (previous != null) {
            throw new IllegalArgumentException("Aggregate function [" + name + "] is already registered");
        }
        logger.debug("Registered aggregate function [{}] with arity {}", name, arity);
        return this;
    }

    /**
     * Resolves a call to the function serving it.
     *
     * @param call the aggregate call, or {@code null} for a raw query
     * @return the function
     * @throws InvalidAggregateCallException if the call is not valid
     */
    public AggregateFunction<?, ?> resolve(@Nullable AggregateCall call) {
        if (call == null) {
            return rawFunction;
        }
        FunctionDescriptor descriptor = descriptors.get(call.name());
        if (descriptor == null) {
            throw new InvalidAggregateCallException(call.name(), "function not found: [" + call.name() + "]");
        }
        try {
            return descriptor.create(call);
        } catch (InvalidAggregateCallException e) {
            logger.debug("Rejected aggregate call [{}]: {}", call, e.getMessage());
            throw e;
        }
    }

    public boolean isRegistered(String name) {
        return descriptors.containsKey(name);
    }

    /**
     * Registered function names, sorted.
     */
    public Set<String> getFunctionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(descriptors.keySet()));
    }

    private static AggregateFunction<?, ?> percentile(AggregateCall call) {
        if (!(call.arguments().get(1) instanceof NumberLiteral rank)) {
            throw new InvalidAggregateCallException(call.name(), "expected numeric argument in percentile()");
        }
        double value = rank.value();
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new InvalidAggregateCallException(call.name(), "percentile rank must be in range [0, 100], got: " + value);
        }
        return new PercentileFunction(value);
    }
}
