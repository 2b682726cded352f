/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import java.io.IOException;
import java.util.Locale;

/**
 * Thrown when a shard's serialized intermediate value cannot be decoded for the expected aggregate.
 *
 * <p>Carries the function, shard and bucket the payload belonged to so the coordinator can report
 * the failed shard precisely.</p>
 */
public class IntermediateDecodeException extends IOException {
    private final String functionName;
    private final String shardId;
    private final long bucketTimestamp;

    public IntermediateDecodeException(String functionName, String shardId, long bucketTimestamp, String reason, Throwable cause) {
        super(
            String.format(
                Locale.ROOT,
                "failed to decode [%s] intermediate from shard [%s] for bucket [%d]: %s",
                functionName,
                shardId,
                bucketTimestamp,
                reason
            ),
            cause
        );
        this.functionName = functionName;
        this.shardId = shardId;
        this.bucketTimestamp = bucketTimestamp;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getShardId() {
        return shardId;
    }

    public long getBucketTimestamp() {
        return bucketTimestamp;
    }
}
