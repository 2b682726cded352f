/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.function;

import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.query.aggregator.intermediate.ValueList;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-rank percentile.
 *
 * <p>Exact ranks cannot be combined from per-shard summaries, so the map phase only echoes the raw
 * values. The reduce phase sorts every value and picks index {@code floor(n * p / 100 + 0.5) - 1};
 * an index outside of the data (for instance p0) yields no result. NaN values are left out.</p>
 */
public class PercentileFunction extends ValueCollectingFunction {
    private final double percentile;

    /**
     * @param percentile rank to select, in [0, 100]
     */
    public PercentileFunction(double percentile) {
        if (Double.isNaN(percentile) || percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("Percentile must be in range [0, 100], got: " + percentile);
        }
        this.percentile = percentile;
    }

    @Override
    public String getName() {
        return Constants.Functions.PERCENTILE;
    }

    public double getPercentile() {
        return percentile;
    }

    @Override
    public Optional<Double> reduce(List<Optional<ValueList>> partials) {
        double[] values = withoutNaN(ValueList.concatenate(partials));
        Arrays.sort(values);
        int index = (int) Math.floor(values.length * percentile / 100.0 + 0.5) - 1;
        if (index < 0 || index >= values.length) {
            return Optional.empty();
        }
        return Optional.of(values[index]);
    }
}
