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
import org.tsdb.aggregation.query.aggregator.intermediate.MeanState;

import java.util.List;
import java.util.Optional;

/**
 * Arithmetic mean.
 *
 * <p>Shards keep an incrementally updated mean, {@code mean += (v - mean) / count}, instead of a raw
 * sum so the partial stays in the range of the data. The coordinator merges partials in arrival order,
 * weighting each mean by its share of the combined count.</p>
 *
 * <p>The merge is order independent in exact arithmetic but not in floating point: feeding the same
 * partials in a different order can change the last bits of the result.</p>
 */
public class MeanFunction implements AggregateFunction<MeanState, Double> {

    @Override
    public String getName() {
        return Constants.Functions.MEAN;
    }

    @Override
    public Optional<MeanState> map(PointSource source) {
        long count = 0;
        double mean = 0.0;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            count++;
            mean += (point.numericValue() - mean) / count;
        }
        return count > 0 ? Optional.of(new MeanState(count, mean)) : Optional.empty();
    }

    @Override
    public Optional<Double> reduce(List<Optional<MeanState>> partials) {
        long count = 0;
        double mean = 0.0;
        for (Optional<MeanState> partial : partials) {
            if (partial.isEmpty()) {
                continue;
            }
            MeanState state = partial.get();
            long total = count + state.getCount();
            mean = state.getMean() * ((double) state.getCount() / total) + mean * ((double) count / total);
            count = total;
        }
        return count > 0 ? Optional.of(mean) : Optional.empty();
    }

    @Override
    public Writeable.Reader<MeanState> intermediateReader() {
        return MeanState::new;
    }
}
