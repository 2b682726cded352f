/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.selection;

import java.util.Arrays;
import java.util.Random;

/**
 * Randomized partition-based selection over an unsorted array of doubles.
 *
 * <p>Finding a contiguous range of ranks by sorting everything costs O(N log N). Partitioning
 * around random pivots and throwing away the side that cannot hold the wanted ranks costs O(N)
 * on average, so extracting {@code count} ranks with {@link #getSortedRange} costs
 * O(N + count log count):</p>
 * <ul>
 *   <li>median: {@code getSortedRange(data, n / 2, 1)}</li>
 *   <li>top N: {@code getSortedRange(data, n - N, N)}</li>
 *   <li>bottom N: {@code getSortedRange(data, 0, N)}</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * <p>Every method here reorders the array it is given. Callers must pass an array they own
 * exclusively and must not reuse it afterwards; a retried computation has to start from a fresh
 * copy.</p>
 *
 * <h2>Randomness</h2>
 * <p>Pivots are drawn from the {@link Random} passed in. The pivot sequence changes how many
 * rounds are needed but never the returned values.</p>
 *
 * <p>Values must not be NaN: NaN compares false against every pivot and would keep the scan
 * from making progress.</p>
 */
public final class QuickSelect {

    private QuickSelect() {}

    /**
     * Outcome of one partition round over {@code data[from, to)}. After the round
     * {@code data[from]} holds the pivot, {@code data[from + 1, split)} holds values that are
     * {@code <= pivot} and {@code data[split, to)} holds values that are {@code >= pivot}.
     */
    public static final class Partition {
        private final int from;
        private final int split;
        private final int to;
        private final double pivot;

        Partition(int from, int split, int to, double pivot) {
            this.from = from;
            this.split = split;
            this.to = to;
            this.pivot = pivot;
        }

        /** First index of the lows. */
        public int lowsFrom() {
            return from + 1;
        }

        /** End (exclusive) of the lows and first index of the highs. */
        public int split() {
            return split;
        }

        /** End (exclusive) of the highs. */
        public int highsTo() {
            return to;
        }

        public int lowCount() {
            return split - from - 1;
        }

        public int highCount() {
            return to - split;
        }

        public double pivot() {
            return pivot;
        }
    }

    /**
     * Partitions {@code data[from, to)} around a pivot chosen uniformly at random.
     *
     * <p>The pivot is swapped to {@code from}, then two cursors scan the rest of the range from
     * both ends, swapping pairs that sit on the wrong side. Values equal to the pivot stop both
     * cursors and are spread over the two sides, so runs of duplicates still halve the range.</p>
     *
     * @param data array to reorder in place
     * @param from first index of the range
     * @param to end (exclusive) of the range, must be greater than {@code from}
     * @param random pivot source
     * @return where the lows, the pivot and the highs ended up
     */
    public static Partition partition(double[] data, int from, int to, Random random) {
        int length = to - from;
        if (length <= 0) {
            throw new IllegalArgumentException("Cannot partition an empty range [" + from + ", " + to + ")");
        }
        int pivotIndex = from + random.nextInt(length);
        double pivot = data[pivotIndex];
        swap(data, pivotIndex, from);

        int low = from + 1;
        int high = to - 1;
        while (true) {
            while (low <= high && data[low] < pivot) {
                low++;
            }
            while (high >= low && data[high] > pivot) {
                high--;
            }
            if (low >= high) {
                break;
            }
            swap(data, low, high);
            low++;
            high--;
        }
        // [low, high] holds at most one value, equal to the pivot, which joins the highs
        return new Partition(from, low, to, pivot);
    }

    /**
     * Drops the {@code k} lowest values of {@code data} without sorting it.
     *
     * @param data values to select from; reordered in place
     * @param k number of lowest values to drop, in {@code [0, data.length]}
     * @param random pivot source
     * @return the remaining {@code data.length - k} values in no particular order
     */
    public static double[] discardLowerRange(double[] data, int k, Random random) {
        checkDiscardCount(data, k);
        double[] out = new double[data.length - k];
        int i = 0;
        int from = 0;
        int to = data.length;

        while (k > 0) {
            Partition partition = partition(data, from, to, random);
            int lowCount = partition.lowCount();
            if (lowCount > k) {
                // the boundary lies inside the lows: keep the pivot and the highs, continue on the lows
                out[i++] = partition.pivot();
                int highCount = partition.highCount();
                System.arraycopy(data, partition.split(), out, i, highCount);
                i += highCount;
                from = partition.lowsFrom();
                to = partition.split();
            } else {
                // drop every low and continue on the highs
                from = partition.split();
                k -= lowCount;
                if (k == 0) {
                    out[i++] = partition.pivot();
                } else {
                    k--;
                }
            }
        }
        System.arraycopy(data, from, out, i, to - from);
        return out;
    }

    /**
     * Drops the {@code k} highest values of {@code data} without sorting it.
     *
     * @param data values to select from; reordered in place
     * @param k number of highest values to drop, in {@code [0, data.length]}
     * @param random pivot source
     * @return the remaining {@code data.length - k} values in no particular order
     */
    public static double[] discardUpperRange(double[] data, int k, Random random) {
        checkDiscardCount(data, k);
        double[] out = new double[data.length - k];
        int i = 0;
        int from = 0;
        int to = data.length;

        while (k > 0) {
            Partition partition = partition(data, from, to, random);
            int highCount = partition.highCount();
            if (highCount > k) {
                // the boundary lies inside the highs: keep the pivot and the lows, continue on the highs
                out[i++] = partition.pivot();
                int lowCount = partition.lowCount();
                System.arraycopy(data, partition.lowsFrom(), out, i, lowCount);
                i += lowCount;
                from = partition.split();
            } else {
                // drop every high and continue on the lows
                from = partition.lowsFrom();
                to = partition.split();
                k -= highCount;
                if (k == 0) {
                    out[i++] = partition.pivot();
                } else {
                    k--;
                }
            }
        }
        System.arraycopy(data, from, out, i, to - from);
        return out;
    }

    /**
     * Returns the values ranked {@code start} to {@code start + count - 1} (0-based, ascending), sorted.
     *
     * @param data values to select from; reordered in place
     * @param start rank of the first value to return
     * @param count number of values to return
     * @param random pivot source
     * @return a new sorted array of length {@code count}
     */
    public static double[] getSortedRange(double[] data, int start, int count, Random random) {
        if (start < 0 || count < 0 || start > data.length - count) {
            throw new IllegalArgumentException(
                "Range [" + start + ", " + start + " + " + count + ") is outside of [0, " + data.length + ")"
            );
        }
        double[] out = discardLowerRange(data, start, random);
        int k = out.length - count;
        if (k > 0) {
            out = discardUpperRange(out, k, random);
        }
        Arrays.sort(out);
        return out;
    }

    private static void checkDiscardCount(double[] data, int k) {
        if (k < 0 || k > data.length) {
            throw new IllegalArgumentException("Cannot discard " + k + " values out of " + data.length);
        }
    }

    private static void swap(double[] data, int i, int j) {
        double tmp = data[i];
        data[i] = data[j];
        data[j] = tmp;
    }
}
