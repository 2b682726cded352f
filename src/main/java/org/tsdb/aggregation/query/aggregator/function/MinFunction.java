/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.function;

import org.opensearch.core.common.io.stream.Writeable;
import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.core.model.Point;
import org.tsdb.aggregation.core.model.PointSource;
import org.tsdb.aggregation.query.aggregator.AggregateFunction;
import org.tsdb.aggregation.query.aggregator.intermediate.ScalarValue;

import java.util.List;
import java.util.Optional;

/**
 * Smallest value. The same running min is applied to points and to shard partials.
 */
public class MinFunction implements AggregateFunction<ScalarValue, Double> {

    @Override
    public String getName() {
        return Constants.Functions.MIN;
    }

    @Override
    public Optional<ScalarValue> map(PointSource source) {
        double min = 0.0;
        boolean hasData = false;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            double value = point.numericValue();
            min = hasData ? Math.min(min, value) : value;
            hasData = true;
        }
        return hasData ? Optional.of(new ScalarValue(min)) : Optional.empty();
    }

    @Override
    public Optional<Double> reduce(List<Optional<ScalarValue>> partials) {
        double min = 0.0;
        boolean hasData = false;
        for (Optional<ScalarValue> partial : partials) {
            if (partial.isPresent()) {
                double value = partial.get().getValue();
                min = hasData ? Math.min(min, value) : value;
                hasData = true;
            }
        }
        return hasData ? Optional.of(min) : Optional.empty();
    }

    @Override
    public Writeable.Reader<ScalarValue> intermediateReader() {
        return ScalarValue::new;
    }
}
