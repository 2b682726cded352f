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
import org.tsdb.aggregation.query.aggregator.intermediate.TimedValue;

import java.util.List;
import java.util.Optional;

/**
 * Base for first and last: keeps the value with the earliest or latest timestamp.
 *
 * <p>The first candidate seen is kept until one with a strictly better timestamp shows up, so on
 * equal timestamps the earliest arrival wins, both among points and among shard partials.</p>
 */
public abstract class TemporalExtremumFunction implements AggregateFunction<TimedValue, Double> {

    /**
     * Whether a candidate at {@code candidate} replaces the one held at {@code current}.
     */
    protected abstract boolean replaces(long candidate, long current);

    @Override
    public Optional<TimedValue> map(PointSource source) {
        TimedValue selected = null;
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            if (selected == null || replaces(point.getTimestamp(), selected.getTimestamp())) {
                selected = new TimedValue(point.getTimestamp(), point.numericValue());
            }
        }
        return Optional.ofNullable(selected);
    }

    @Override
    public Optional<Double> reduce(List<Optional<TimedValue>> partials) {
        TimedValue selected = null;
        for (Optional<TimedValue> partial : partials) {
            if (partial.isEmpty()) {
                continue;
            }
            TimedValue candidate = partial.get();
            if (selected == null || replaces(candidate.getTimestamp(), selected.getTimestamp())) {
                selected = candidate;
            }
        }
        return selected == null ? Optional.empty() : Optional.of(selected.getValue());
    }

    @Override
    public Writeable.Reader<TimedValue> intermediateReader() {
        return TimedValue::new;
    }
}
