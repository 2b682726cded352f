/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PointSource} backed by an in-memory list, for buckets already materialized on heap.
 *
 * <p>Iteration stops at the end of the list or at the first end-of-stream point it contains,
 * whichever comes first.</p>
 */
public class ListPointSource implements PointSource {
    private final List<Point> points;
    private int position;
    private boolean exhausted;

    public ListPointSource(List<Point> points) {
        this.points = List.copyOf(points);
    }

    /**
     * Builds a source of numeric points for one series, pairing each timestamp with the value at the same index.
     *
     * @param seriesId series identifier, must not be the end-of-stream identifier
     * @param timestamps point timestamps
     * @param values point values
     */
    public static ListPointSource of(long seriesId, long[] timestamps, double[] values) {
        if (seriesId == Point.END_OF_STREAM_SERIES_ID) {
            throw new IllegalArgumentException("Series id " + seriesId + " is reserved for end of stream");
        }
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException(
                "Timestamps and values must have the same length, got: " + timestamps.length + " and " + values.length
            );
        }
        List<Point> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new Point(seriesId, timestamps[i], values[i]));
        }
        return new ListPointSource(points);
    }

    /**
     * Builds a source of numeric points for one series with timestamps 1, 2, 3, ...
     */
    public static ListPointSource ofValues(long seriesId, double... values) {
        long[] timestamps = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = i + 1;
        }
        return of(seriesId, timestamps, values);
    }

    /**
     * A source that is exhausted on its first call.
     */
    public static ListPointSource empty() {
        return new ListPointSource(List.of());
    }

    @Override
    public Point next() {
        if (exhausted || position >= points.size()) {
            exhausted = true;
            return Point.endOfStream();
        }
        Point point = points.get(position++);
        if (point.isEndOfStream()) {
            exhausted = true;
        }
        return point;
    }
}
