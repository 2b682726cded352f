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
 * An unaggregated sample returned by a raw query. The value is opaque and travels through
 * the generic value encoding of {@link StreamOutput#writeGenericValue(Object)}: numbers, strings,
 * booleans, byte arrays, lists, maps and the other types that encoding knows. Any other value
 * fails {@link #writeTo} with an {@link IOException}.
 */
public final class RawPoint implements Writeable {
    private final long timestamp;
    private final Object value;

    public RawPoint(long timestamp, Object value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public RawPoint(StreamInput in) throws IOException {
        this.timestamp = in.readLong();
        this.value = in.readGenericValue();
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLong(timestamp);
        try {
            out.writeGenericValue(value);
        } catch (IllegalArgumentException e) {
            throw new IOException(
                "Cannot encode raw value of type [" + value.getClass().getName() + "] at timestamp [" + timestamp + "]",
                e
            );
        }
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        RawPoint that = (RawPoint) obj;
        return timestamp == that.timestamp && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "RawPoint{timestamp=" + timestamp + ", value=" + value + "}";
    }
}
