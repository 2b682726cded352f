/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import java.util.List;
import java.util.Optional;

/**
 * Final answer for one bucket together with the shards whose payload could not be used.
 *
 * @param bucketTimestamp start of the bucket
 * @param value the reduced value, empty when no shard contributed data
 * @param shardFailures decode failures of shards left out of the reduce
 * @param <R> result type of the aggregate
 */
public record BucketResult<R>(long bucketTimestamp, Optional<R> value, List<IntermediateDecodeException> shardFailures) {

    public BucketResult {
        shardFailures = List.copyOf(shardFailures);
    }

    /**
     * Whether some shards were left out, making the value a partial answer.
     */
    public boolean isPartial() {
        return !shardFailures.isEmpty();
    }
}
