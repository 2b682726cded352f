/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.selection;

import org.opensearch.test.OpenSearchTestCase;

import java.util.Arrays;
import java.util.Random;

public class QuickSelectTests extends OpenSearchTestCase {

    private double[] randomValues(int length) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            // small range so duplicates show up
            values[i] = randomBoolean() ? randomIntBetween(-20, 20) : randomDoubleBetween(-1000, 1000, true);
        }
        return values;
    }

    private static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    public void testPartitionSplitsAroundPivot() {
        for (int iteration = 0; iteration < 50; iteration++) {
            double[] data = randomValues(randomIntBetween(1, 200));
            double[] expected = sorted(data);

            QuickSelect.Partition partition = QuickSelect.partition(data, 0, data.length, random());

            assertEquals(partition.pivot(), data[0], 0.0);
            assertEquals(data.length - 1, partition.lowCount() + partition.highCount());
            for (int i = partition.lowsFrom(); i < partition.split(); i++) {
                assertTrue(data[i] <= partition.pivot());
            }
            for (int i = partition.split(); i < partition.highsTo(); i++) {
                assertTrue(data[i] >= partition.pivot());
            }
            // nothing lost or duplicated
            assertArrayEquals(expected, sorted(data), 0.0);
        }
    }

    public void testPartitionOfSubRangeLeavesRestUntouched() {
        double[] data = { 9, 8, 5, 1, 4, 2, 7, 0 };
        QuickSelect.Partition partition = QuickSelect.partition(data, 2, 6, random());

        assertEquals(9.0, data[0], 0.0);
        assertEquals(8.0, data[1], 0.0);
        assertEquals(7.0, data[6], 0.0);
        assertEquals(0.0, data[7], 0.0);
        assertEquals(3, partition.lowCount() + partition.highCount());
        assertEquals(6, partition.highsTo());
    }

    public void testPartitionRejectsEmptyRange() {
        assertThrows(IllegalArgumentException.class, () -> QuickSelect.partition(new double[] { 1.0 }, 0, 0, random()));
    }

    public void testDiscardLowerRangeKeepsUpperValues() {
        for (int iteration = 0; iteration < 50; iteration++) {
            double[] data = randomValues(randomIntBetween(1, 300));
            double[] expected = sorted(data);
            int k = randomIntBetween(0, data.length);

            double[] remaining = QuickSelect.discardLowerRange(data, k, random());

            assertArrayEquals(Arrays.copyOfRange(expected, k, expected.length), sorted(remaining), 0.0);
        }
    }

    public void testDiscardUpperRangeKeepsLowerValues() {
        for (int iteration = 0; iteration < 50; iteration++) {
            double[] data = randomValues(randomIntBetween(1, 300));
            double[] expected = sorted(data);
            int k = randomIntBetween(0, data.length);

            double[] remaining = QuickSelect.discardUpperRange(data, k, random());

            assertArrayEquals(Arrays.copyOfRange(expected, 0, expected.length - k), sorted(remaining), 0.0);
        }
    }

    public void testDiscardRejectsOutOfRangeCount() {
        assertThrows(IllegalArgumentException.class, () -> QuickSelect.discardLowerRange(new double[] { 1, 2 }, 3, random()));
        assertThrows(IllegalArgumentException.class, () -> QuickSelect.discardUpperRange(new double[] { 1, 2 }, -1, random()));
    }

    public void testGetSortedRangeMatchesFullSort() {
        for (int iteration = 0; iteration < 100; iteration++) {
            double[] data = randomValues(randomIntBetween(1, 500));
            double[] expected = sorted(data);
            int start = randomIntBetween(0, data.length - 1);
            int count = randomIntBetween(0, data.length - start);

            double[] range = QuickSelect.getSortedRange(data, start, count, random());

            assertArrayEquals(Arrays.copyOfRange(expected, start, start + count), range, 0.0);
        }
    }

    public void testGetSortedRangeBottomAndTopN() {
        double[] values = { 42, 7, 19, 3, 88, 61, 5, 23, 14, 70 };

        assertArrayEquals(new double[] { 3, 5, 7 }, QuickSelect.getSortedRange(values.clone(), 0, 3, random()), 0.0);
        assertArrayEquals(new double[] { 61, 70, 88 }, QuickSelect.getSortedRange(values.clone(), values.length - 3, 3, random()), 0.0);
        assertArrayEquals(sorted(values), QuickSelect.getSortedRange(values.clone(), 0, values.length, random()), 0.0);
    }

    public void testResultDoesNotDependOnPivotSequence() {
        double[] values = randomValues(257);
        int start = 100;
        int count = 5;
        double[] expected = QuickSelect.getSortedRange(values.clone(), start, count, new Random(0));

        for (int seed = 1; seed < 20; seed++) {
            assertArrayEquals(expected, QuickSelect.getSortedRange(values.clone(), start, count, new Random(seed)), 0.0);
        }
        // a degenerate generator always picking the first index still converges
        Random firstIndex = new Random() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        };
        assertArrayEquals(expected, QuickSelect.getSortedRange(values.clone(), start, count, firstIndex), 0.0);
    }

    public void testAllEqualValues() {
        double[] values = new double[64];
        Arrays.fill(values, 3.0);

        assertArrayEquals(new double[] { 3.0, 3.0 }, QuickSelect.getSortedRange(values, 31, 2, random()), 0.0);
    }

    public void testPartitionSplitsDuplicatesEvenly() {
        double[] values = new double[1000];
        Arrays.fill(values, 1.0);

        QuickSelect.Partition partition = QuickSelect.partition(values, 0, values.length, random());

        assertEquals(499, partition.lowCount());
        assertEquals(500, partition.highCount());
    }

    public void testDuplicateHeavyInputNeedsFewPartitionRounds() {
        int length = 100_000;
        double[] constant = new double[length];
        Arrays.fill(constant, 42.0);
        double[] binary = new double[length];
        for (int i = 0; i < length; i++) {
            binary[i] = randomBoolean() ? 1.0 : 0.0;
        }
        double[] expectedBinary = sorted(binary);

        CountingRandom constantRounds = new CountingRandom(random().nextLong());
        assertArrayEquals(new double[] { 42.0, 42.0 }, QuickSelect.getSortedRange(constant, length / 2 - 1, 2, constantRounds), 0.0);
        // every round halves the range, so the round count grows with log(n), not n
        assertTrue("partition rounds: " + constantRounds.calls, constantRounds.calls < 200);

        CountingRandom binaryRounds = new CountingRandom(random().nextLong());
        assertArrayEquals(
            Arrays.copyOfRange(expectedBinary, length / 2 - 1, length / 2 + 1),
            QuickSelect.getSortedRange(binary, length / 2 - 1, 2, binaryRounds),
            0.0
        );
        assertTrue("partition rounds: " + binaryRounds.calls, binaryRounds.calls < 500);
    }

    /**
     * Counts pivot draws, one per partition round.
     */
    private static class CountingRandom extends Random {
        private int calls;

        CountingRandom(long seed) {
            super(seed);
        }

        @Override
        public int nextInt(int bound) {
            calls++;
            return super.nextInt(bound);
        }
    }

    public void testGetSortedRangeRejectsInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> QuickSelect.getSortedRange(new double[] { 1, 2, 3 }, 2, 2, random()));
        assertThrows(IllegalArgumentException.class, () -> QuickSelect.getSortedRange(new double[] { 1, 2, 3 }, -1, 1, random()));
        assertThrows(IllegalArgumentException.class, () -> QuickSelect.getSortedRange(new double[] { 1, 2, 3 }, 0, -1, random()));
    }
}
