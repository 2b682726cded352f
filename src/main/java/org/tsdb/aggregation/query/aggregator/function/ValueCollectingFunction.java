/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.function;

import org.opensearch.core.common.io.stream.Writeable;
import org.tsdb.aggregation.core.model.Point;
import org.tsdb.aggregation.core.model.PointSource;
import org.tsdb.aggregation.query.aggregator.AggregateFunction;
import org.tsdb.aggregation.query.aggregator.intermediate.ValueList;

import java.util.Optional;
import java.util.stream.DoubleStream;

/**
 * Base for aggregates whose map phase ships every raw value to the coordinator, leaving all of the
 * work to the reduce phase.
 */
public abstract class ValueCollectingFunction implements AggregateFunction<ValueList, Double> {

    @Override
    public Optional<ValueList> map(PointSource source) {
        DoubleStream.Builder values = DoubleStream.builder();
        boolean hasData = false;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            values.add(point.numericValue());
            hasData = true;
        }
        return hasData ? Optional.of(new ValueList(values.build().toArray())) : Optional.empty();
    }

    @Override
    public Writeable.Reader<ValueList> intermediateReader() {
        return ValueList::new;
    }

    /**
     * Copy of {@code values} without NaN entries, for order statistics where NaN has no rank.
     */
    static double[] withoutNaN(double[] values) {
        return DoubleStream.of(values).filter(value -> !Double.isNaN(value)).toArray();
    }
}
