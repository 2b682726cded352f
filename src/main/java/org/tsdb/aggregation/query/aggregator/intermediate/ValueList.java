/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.intermediate;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Raw values collected by a shard without local reduction.
 *
 * <p>Used by aggregates that cannot be combined from a fixed-size summary: stddev, median and
 * percentile. The backing array is private; combiners copy values out with {@link #concatenate(List)}
 * and never see the shard's buffer.</p>
 */
public final class ValueList implements Writeable {
    private final double[] values;

    public ValueList(double[] values) {
        this.values = values.clone();
    }

    public ValueList(StreamInput in) throws IOException {
        this.values = in.readDoubleArray();
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeDoubleArray(values);
    }

    public int size() {
        return values.length;
    }

    /**
     * Returns a copy of the collected values.
     */
    public double[] toArray() {
        return values.clone();
    }

    /**
     * Concatenates every present partial into a newly allocated array owned by the caller.
     * Absent partials are skipped.
     */
    public static double[] concatenate(List<Optional<ValueList>> partials) {
        int total = 0;
        for (Optional<ValueList> partial : partials) {
            if (partial.isPresent()) {
                total += partial.get().values.length;
            }
        }
        double[] out = new double[total];
        int offset = 0;
        for (Optional<ValueList> partial : partials) {
            if (partial.isPresent()) {
                double[] values = partial.get().values;
                System.arraycopy(values, 0, out, offset, values.length);
                offset += values.length;
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((ValueList) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ValueList{size=" + values.length + "}";
    }
}
