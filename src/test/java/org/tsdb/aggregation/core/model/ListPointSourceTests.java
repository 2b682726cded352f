/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.core.model;

import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class ListPointSourceTests extends OpenSearchTestCase {

    public void testIteratesInOrderThenSignalsEndOfStream() {
        ListPointSource source = ListPointSource.of(7L, new long[] { 10L, 20L }, new double[] { 1.5, 2.5 });

        Point first = source.next();
        assertEquals(7L, first.getSeriesId());
        assertEquals(10L, first.getTimestamp());
        assertEquals(1.5, first.numericValue(), 0.0);

        Point second = source.next();
        assertEquals(20L, second.getTimestamp());
        assertEquals(2.5, second.numericValue(), 0.0);

        assertTrue(source.next().isEndOfStream());
        // stays exhausted
        assertTrue(source.next().isEndOfStream());
    }

    public void testEmptySourceIsExhaustedImmediately() {
        assertTrue(ListPointSource.empty().next().isEndOfStream());
    }

    public void testStopsAtEmbeddedEndOfStreamPoint() {
        ListPointSource source = new ListPointSource(
            List.of(new Point(3L, 1L, 1.0), new Point(Point.END_OF_STREAM_SERIES_ID, 2L, 2.0), new Point(3L, 3L, 3.0))
        );

        assertFalse(source.next().isEndOfStream());
        assertTrue(source.next().isEndOfStream());
        assertTrue(source.next().isEndOfStream());
    }

    public void testOfValuesAssignsIncreasingTimestamps() {
        ListPointSource source = ListPointSource.ofValues(1L, 4.0, 5.0, 6.0);

        assertEquals(1L, source.next().getTimestamp());
        assertEquals(2L, source.next().getTimestamp());
        assertEquals(3L, source.next().getTimestamp());
        assertTrue(source.next().isEndOfStream());
    }

    public void testRejectsReservedSeriesId() {
        assertThrows(IllegalArgumentException.class, () -> ListPointSource.ofValues(Point.END_OF_STREAM_SERIES_ID, 1.0));
    }

    public void testRejectsMismatchedLengths() {
        assertThrows(IllegalArgumentException.class, () -> ListPointSource.of(1L, new long[] { 1L }, new double[] { 1.0, 2.0 }));
    }
}
