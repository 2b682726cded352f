/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import org.opensearch.common.io.stream.BytesStreamOutput;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Optional;

/**
 * Byte-level encoding of shard intermediates.
 *
 * <p>The layout of a payload is whatever the function's {@link AggregateFunction#writeIntermediate}
 * writes: a presence flag followed, when present, by the intermediate's own fields. Decoding uses
 * the reader of the same function that was resolved for the query and requires the payload to be
 * consumed exactly.</p>
 */
public final class IntermediateCodec {

    private IntermediateCodec() {}

    /**
     * Serializes a possibly absent intermediate.
     */
    public static <I extends Writeable> BytesReference encode(AggregateFunction<I, ?> function, Optional<I> intermediate)
        throws IOException {
        try (BytesStreamOutput out = new BytesStreamOutput()) {
            function.writeIntermediate(intermediate, out);
            return out.bytes();
        }
    }

    /**
     * Rebuilds the intermediate a shard sent for a bucket.
     *
     * @param function the function resolved for the query
     * @param shardId shard that produced the payload, for error reporting
     * @param bucketTimestamp bucket the payload belongs to, for error reporting
     * @param payload serialized intermediate
     * @return the intermediate, or empty if the shard had no data
     * @throws IntermediateDecodeException if the payload is malformed, truncated or has trailing bytes
     */
    public static <I extends Writeable> Optional<I> decode(
        AggregateFunction<I, ?> function,
        String shardId,
        long bucketTimestamp,
        BytesReference payload
    ) throws IntermediateDecodeException {
        if (payload == null) {
            throw new IntermediateDecodeException(function.getName(), shardId, bucketTimestamp, "missing payload", null);
        }
        Optional<I> intermediate;
        int trailing;
        try (StreamInput in = payload.streamInput()) {
            intermediate = function.readIntermediate(in);
            trailing = in.available();
        } catch (IOException | RuntimeException e) {
            // malformed input surfaces as EOF, illegal state or bad sizes depending on where it breaks
            throw new IntermediateDecodeException(function.getName(), shardId, bucketTimestamp, String.valueOf(e.getMessage()), e);
        }
        if (trailing > 0) {
            throw new IntermediateDecodeException(
                function.getName(),
                shardId,
                bucketTimestamp,
                "unexpected " + trailing + " trailing bytes",
                null
            );
        }
        return intermediate;
    }
}
