/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.telemetry.metrics.tags.Tags;
import org.tsdb.aggregation.TSDBAggregationPlugin;
import org.tsdb.aggregation.core.model.PointSource;
import org.tsdb.aggregation.metrics.AggregationMetrics;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the two phases of an aggregate around the wire format.
 *
 * <p>{@link #map} runs on a data node for one (shard, bucket) pair and returns the bytes to send to
 * the coordinator. {@link #reduce} runs on the coordinator once every shard answered for a bucket:
 * it decodes each payload with the same function and folds the decoded partials. Waiting for all
 * shards is the caller's job; the reduce folds whatever responses it is handed.</p>
 *
 * <p>A payload that fails to decode is recorded as a shard failure. With partial results enabled the
 * remaining shards are still reduced and the {@link BucketResult} is flagged partial; otherwise the
 * decode failure is rethrown and the bucket fails.</p>
 */
public class BucketAggregationExecutor {
    private static final Logger logger = LogManager.getLogger(BucketAggregationExecutor.class);

    private final boolean partialResultsEnabled;

    public BucketAggregationExecutor(Settings settings) {
        this(TSDBAggregationPlugin.PARTIAL_RESULTS_ENABLED.get(settings));
    }

    public BucketAggregationExecutor(boolean partialResultsEnabled) {
        this.partialResultsEnabled = partialResultsEnabled;
    }

    public boolean isPartialResultsEnabled() {
        return partialResultsEnabled;
    }

    /**
     * Map phase: folds the shard's points for a bucket and serializes the intermediate.
     *
     * @param function function resolved for the query
     * @param source the bucket's points on this shard, consumed to the end
     * @return the payload to send to the coordinator
     * @throws IOException if the intermediate cannot be serialized
     */
    public <I extends Writeable, R> BytesReference map(AggregateFunction<I, R> function, PointSource source) throws IOException {
        Optional<I> intermediate = function.map(source);
        AggregationMetrics.incrementCounter(
            AggregationMetrics.MAP_REDUCE.mapInvocations,
            1,
            AggregationMetrics.functionTags(function.getName())
        );
        return IntermediateCodec.encode(function, intermediate);
    }

    /**
     * Reduce phase: decodes every shard payload for a bucket and combines them.
     *
     * @param function function resolved for the query, the same one the shards mapped with
     * @param bucketTimestamp bucket being reduced
     * @param responses one response per shard, in arrival order
     * @return the bucket's value and the shards that were left out
     * @throws IntermediateDecodeException if a payload fails to decode and partial results are disabled
     */
    public <I extends Writeable, R> BucketResult<R> reduce(AggregateFunction<I, R> function, long bucketTimestamp, List<ShardResponse> responses)
        throws IntermediateDecodeException {
        Tags tags = AggregationMetrics.functionTags(function.getName());
        List<Optional<I>> partials = new ArrayList<>(responses.size());
        List<IntermediateDecodeException> failures = new ArrayList<>();

        for (ShardResponse response : responses) {
            try {
                partials.add(IntermediateCodec.decode(function, response.shardId(), bucketTimestamp, response.payload()));
            } catch (IntermediateDecodeException e) {
                AggregationMetrics.incrementCounter(AggregationMetrics.MAP_REDUCE.decodeFailures, 1, tags);
                if (!partialResultsEnabled) {
                    throw e;
                }
                logger.warn("Skipping shard [{}] in bucket [{}]: {}", response.shardId(), bucketTimestamp, e.getMessage());
                failures.add(e);
            }
        }

        AggregationMetrics.incrementCounter(AggregationMetrics.MAP_REDUCE.reduceInvocations, 1, tags);
        AggregationMetrics.recordHistogram(AggregationMetrics.MAP_REDUCE.reducePartials, responses.size(), tags);

        Optional<R> value = function.reduce(partials);
        if (!failures.isEmpty()) {
            logger.warn(
                "Bucket [{}] of [{}] reduced from {} of {} shards",
                bucketTimestamp,
                function.getName(),
                partials.size(),
                responses.size()
            );
        }
        return new BucketResult<>(bucketTimestamp, value, failures);
    }
}
