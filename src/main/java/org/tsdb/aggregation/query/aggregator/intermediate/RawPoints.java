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
import java.util.List;

/**
 * Every point a shard saw for a raw query, in the order the source produced them.
 */
public final class RawPoints implements Writeable {
    private final List<RawPoint> points;

    public RawPoints(List<RawPoint> points) {
        this.points = List.copyOf(points);
    }

    public RawPoints(StreamInput in) throws IOException {
        this.points = List.copyOf(in.readList(RawPoint::new));
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeCollection(points);
    }

    public List<RawPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return points.equals(((RawPoints) obj).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "RawPoints{size=" + points.size() + "}";
    }
}
