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
import java.util.Objects;

/**
 * Smallest and largest value seen by a shard, used by spread.
 */
public final class MinMaxRange implements Writeable {
    private final double min;
    private final double max;

    public MinMaxRange(double min, double max) {
        this.min = min;
        this.max = max;
    }

    public MinMaxRange(StreamInput in) throws IOException {
        this.min = in.readDouble();
        this.max = in.readDouble();
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeDouble(min);
        out.writeDouble(max);
    }

    /**
     * Range covering both this range and {@code other}.
     */
    public MinMaxRange merge(MinMaxRange other) {
        return new MinMaxRange(Math.min(min, other.min), Math.max(max, other.max));
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double spread() {
        return max - min;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        MinMaxRange that = (MinMaxRange) obj;
        return Double.compare(that.min, min) == 0 && Double.compare(that.max, max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "MinMaxRange{min=" + min + ", max=" + max + "}";
    }
}
