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
import org.tsdb.aggregation.query.aggregator.intermediate.RawPoint;
import org.tsdb.aggregation.query.aggregator.intermediate.RawPoints;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Passthrough used when a query asks for points rather than an aggregate.
 *
 * <p>Shards ship every (timestamp, value) pair untouched; values are opaque and are not required to
 * be numeric. The coordinator concatenates the shard lists and sorts them by timestamp with a stable
 * sort, so points sharing a timestamp keep their shard arrival order. The result is always present
 * and empty when no shard had points.</p>
 */
public class RawFunction implements AggregateFunction<RawPoints, List<RawPoint>> {
    private static final Comparator<RawPoint> BY_TIMESTAMP = Comparator.comparingLong(RawPoint::getTimestamp);

    private final int maxPoints;

    /**
     * @param maxPoints largest number of points a reduce may return, or 0 for no limit
     */
    public RawFunction(int maxPoints) {
        if (maxPoints < 0) {
            throw new IllegalArgumentException("Max points must not be negative, got: " + maxPoints);
        }
        this.maxPoints = maxPoints;
    }

    public RawFunction() {
        this(0);
    }

    @Override
    public String getName() {
        return Constants.Functions.RAW;
    }

    @Override
    public Optional<RawPoints> map(PointSource source) {
        List<RawPoint> points = new ArrayList<>();
        for (Point point = source.next(); !point.isEndOfStream(); point = source.next()) {
            points.add(new RawPoint(point.getTimestamp(), point.getValue()));
        }
        return points.isEmpty() ? Optional.empty() : Optional.of(new RawPoints(points));
    }

    @Override
    public Optional<List<RawPoint>> reduce(List<Optional<RawPoints>> partials) {
        List<RawPoint> merged = new ArrayList<>();
        for (Optional<RawPoints> partial : partials) {
            partial.ifPresent(points -> merged.addAll(points.getPoints()));
        }
        if (maxPoints > 0 && merged.size() > maxPoints) {
            throw new IllegalArgumentException(
                String.format(
                    Locale.ROOT,
                    "raw query returned [%d] points which exceeds [%s] of [%d]",
                    merged.size(),
                    Constants.Settings.RAW_MAX_POINTS,
                    maxPoints
                )
            );
        }
        merged.sort(BY_TIMESTAMP);
        return Optional.of(merged);
    }

    @Override
    public Writeable.Reader<RawPoints> intermediateReader() {
        return RawPoints::new;
    }
}
