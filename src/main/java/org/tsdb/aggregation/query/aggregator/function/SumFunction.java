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
 * Arithmetic sum. Shards sum their points, the coordinator sums the partial sums.
 */
public class SumFunction implements AggregateFunction<ScalarValue, Double> {

    @Override
    public String getName() {
        return Constants.Functions.SUM;
    }

    @Override
    public Optional<ScalarValue> map(PointSource source) {
        double sum = 0.0;
        long count = 0;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            sum += point.numericValue();
            count++;
        }
        return count > 0 ? Optional.of(new ScalarValue(sum)) : Optional.empty();
    }

    @Override
    public Optional<Double> reduce(List<Optional<ScalarValue>> partials) {
        double sum = 0.0;
        boolean hasData = false;
        for (Optional<ScalarValue> partial : partials) {
            if (partial.isPresent()) {
                sum += partial.get().getValue();
                hasData = true;
            }
        }
        return hasData ? Optional.of(sum) : Optional.empty();
    }

    @Override
    public Writeable.Reader<ScalarValue> intermediateReader() {
        return ScalarValue::new;
    }
}
