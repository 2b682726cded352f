/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.function;

import org.tsdb.aggregation.common.Constants;
import org.tsdb.aggregation.core.model.Point;
import org.tsdb.aggregation.core.model.PointSource;
import org.tsdb.aggregation.query.aggregator.intermediate.ScalarValue;

import java.util.Optional;

/**
 * Number of points. Shards count, the coordinator sums the counts.
 */
public class CountFunction extends SumFunction {

    @Override
    public String getName() {
        return Constants.Functions.COUNT;
    }

    @Override
    public Optional<ScalarValue> map(PointSource source) {
        long count = 0;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            count++;
        }
        return count > 0 ? Optional.of(new ScalarValue(count)) : Optional.empty();
    }
}
