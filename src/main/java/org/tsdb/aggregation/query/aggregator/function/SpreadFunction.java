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
import org.tsdb.aggregation.query.aggregator.intermediate.MinMaxRange;

import java.util.List;
import java.util.Optional;

/**
 * Difference between the largest and the smallest value.
 */
public class SpreadFunction implements AggregateFunction<MinMaxRange, Double> {

    @Override
    public String getName() {
        return Constants.Functions.SPREAD;
    }

    @Override
    public Optional<MinMaxRange> map(PointSource source) {
        double min = 0.0;
        double max = 0.0;
        boolean hasData = false;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            double value = point.numericValue();
            if (hasData) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            } else {
                min = value;
                max = value;
                hasData = true;
            }
        }
        return hasData ? Optional.of(new MinMaxRange(min, max)) : Optional.empty();
    }

    @Override
    public Optional<Double> reduce(List<Optional<MinMaxRange>> partials) {
        MinMaxRange range = null;
        for (Optional<MinMaxRange> partial : partials) {
            if (partial.isPresent()) {
                range = range == null ? partial.get() : range.merge(partial.get());
            }
        }
        return range == null ? Optional.empty() : Optional.of(range.spread());
    }

    @Override
    public Writeable.Reader<MinMaxRange> intermediateReader() {
        return MinMaxRange::new;
    }
}
