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
 * Running mean together with the number of points it was computed from.
 *
 * <p>Partials are merged by weighting each mean by its count, see
 * {@link org.tsdb.aggregation.query.aggregator.function.MeanFunction}.</p>
 */
public final class MeanState implements Writeable {
    private final long count;
    private final double mean;

    public MeanState(long count, double mean) {
        if (count <= 0) {
            throw new IllegalArgumentException("Mean state count must be positive, got: " + count);
        }
        this.count = count;
        this.mean = mean;
    }

    public MeanState(StreamInput in) throws IOException {
        this(in.readVLong(), in.readDouble());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeVLong(count);
        out.writeDouble(mean);
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        MeanState that = (MeanState) obj;
        return count == that.count && Double.compare(that.mean, mean) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean);
    }

    @Override
    public String toString() {
        return "MeanState{count=" + count + ", mean=" + mean + "}";
    }
}
