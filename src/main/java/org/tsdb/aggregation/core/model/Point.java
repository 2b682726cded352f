/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single sample read from a {@link PointSource}: series identifier, timestamp and value.
 *
 * <p>The value is numeric for every aggregate except raw passthrough, where it is carried
 * through untouched. A point whose series identifier equals {@link #END_OF_STREAM_SERIES_ID}
 * marks the end of the stream and carries no sample.</p>
 */
public final class Point {

    /**
     * Reserved series identifier signalling that the source has no more points.
     * Storage must never hand out this identifier for a real series.
     */
    public static final long END_OF_STREAM_SERIES_ID = 0L;

    private static final Point END_OF_STREAM = new Point(END_OF_STREAM_SERIES_ID, 0L, null);

    private final long seriesId;
    private final long timestamp;
    private final Object value;

    public Point(long seriesId, long timestamp, Object value) {
        this.seriesId = seriesId;
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * The end-of-stream marker returned by exhausted sources.
     */
    public static Point endOfStream() {
        return END_OF_STREAM;
    }

    public boolean isEndOfStream() {
        return seriesId == END_OF_STREAM_SERIES_ID;
    }

    public long getSeriesId() {
        return seriesId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Raw value as produced by storage.
     */
    public Object getValue() {
        return value;
    }

    /**
     * Value of a numeric sample.
     *
     * @return the value as a double
     * @throws IllegalStateException if the value is not a {@link Number}; numeric aggregates never coerce other types
     */
    public double numericValue() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException(
            String.format(
                Locale.ROOT,
                "expected numeric value for series [%d] at [%d] but got [%s]",
                seriesId,
                timestamp,
                value == null ? "null" : value.getClass().getName()
            )
        );
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Point that = (Point) obj;
        return seriesId == that.seriesId && timestamp == that.timestamp && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesId, timestamp, value);
    }

    @Override
    public String toString() {
        return "Point{seriesId=" + seriesId + ", timestamp=" + timestamp + ", value=" + value + "}";
    }
}
