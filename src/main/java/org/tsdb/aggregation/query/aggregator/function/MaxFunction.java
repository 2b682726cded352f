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
 * Largest value. The same running max is applied to points and to shard partials.
 */
public class MaxFunction implements AggregateFunction<ScalarValue, Double> {

    @Override
    public String getName() {
        return Constants.Functions.MAX;
    }

    @Override
    public Optional<ScalarValue> map(PointSource source) {
        double max = 0.0;
        boolean hasData = false;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            double value = point.numericValue();
            max = hasData ? Math.max(max, value) : value;
            hasData = true;
        }
        return hasData ? Optional.of(new ScalarValue(max)) : Optional.empty();
    }

    @Override
    public Optional<Double> reduce(List<Optional<ScalarValue>> partials) {
        double max = 0.0;
        boolean hasData = false;
        for (Optional<ScalarValue> partial : partials) {
            if (partial.isPresent()) {
                double value = partial.get().getValue();
                max = hasData ? Math.max(max, value) : value;
                hasData = true;
            }
        }
        return hasData ? Optional.of(max) : Optional.empty();
    }

    @Override
    public Writeable.Reader<ScalarValue> intermediateReader() {
        return ScalarValue::new;
    }
}
