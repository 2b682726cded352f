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

import java.util.List;
import java.util.Optional;

/**
 * Sample standard deviation: {@code sqrt(sum((x - mean)^2) / (n - 1))}.
 *
 * <p>Undefined, and therefore absent, for fewer than two points across all shards.</p>
 */
public class StddevFunction extends ValueCollectingFunction {

    @Override
    public String getName() {
        return Constants.Functions.STDDEV;
    }

    @Override
    public Optional<Double> reduce(List<Optional<ValueList>> partials) {
        double[] data = ValueList.concatenate(partials);
        if (data.length < 2) {
            return Optional.empty();
        }

        double mean = 0.0;
        int count = 0;
        for (double value : data) {
            count++;
            mean += (value - mean) / count;
        }

        double sumSquaredDiff = 0.0;
        for (double value : data) {
            double diff = value - mean;
            sumSquaredDiff += diff * diff;
        }
        return Optional.of(Math.sqrt(sumSquaredDiff / (count - 1)));
    }
}
