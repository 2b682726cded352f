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
import org.tsdb.aggregation.query.aggregator.selection.QuickSelect;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Median of all values, found by partition-based selection instead of a full sort.
 *
 * <p>For an even number of values the result is the midpoint of the two middle values. NaN values
 * have no rank and are left out.</p>
 */
public class MedianFunction extends ValueCollectingFunction {
    private final Supplier<Random> randomSupplier;

    /**
     * @param randomSupplier source of pivot randomness, asked once per reduce
     */
    public MedianFunction(Supplier<Random> randomSupplier) {
        this.randomSupplier = Objects.requireNonNull(randomSupplier, "randomSupplier must not be null");
    }

    @Override
    public String getName() {
        return Constants.Functions.MEDIAN;
    }

    @Override
    public Optional<Double> reduce(List<Optional<ValueList>> partials) {
        // fresh array: selection reorders it in place
        double[] data = withoutNaN(ValueList.concatenate(partials));
        int length = data.length;
        if (length == 0) {
            return Optional.empty();
        }
        if (length == 1) {
            return Optional.of(data[0]);
        }

        Random random = randomSupplier.get();
        int middle = length / 2;
        if (length % 2 == 0) {
            double[] sortedRange = QuickSelect.getSortedRange(data, middle - 1, 2, random);
            double low = sortedRange[0];
            double high = sortedRange[1];
            return Optional.of(low + (high - low) / 2);
        }
        return Optional.of(QuickSelect.getSortedRange(data, middle, 1, random)[0]);
    }
}
