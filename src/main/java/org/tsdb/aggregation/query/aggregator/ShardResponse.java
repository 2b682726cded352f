/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import org.opensearch.core.common.bytes.BytesArray;
import org.opensearch.core.common.bytes.BytesReference;

import java.util.Objects;

/**
 * Serialized map output received from one shard for one bucket.
 *
 * @param shardId identity of the shard that produced the payload
 * @param payload bytes written by {@link IntermediateCodec#encode}
 */
public record ShardResponse(String shardId, BytesReference payload) {

    public ShardResponse {
        Objects.requireNonNull(shardId, "shardId must not be null");
    }

    public static ShardResponse of(String shardId, byte[] payload) {
        return new ShardResponse(shardId, payload == null ? null : new BytesArray(payload));
    }
}
