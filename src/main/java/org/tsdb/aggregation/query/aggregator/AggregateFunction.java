/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.tsdb.aggregation.core.model.PointSource;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * An aggregate computed in two phases: a map phase close to the data and a reduce phase on the coordinator.
 *
 * <p>The map phase folds the points of one (shard, bucket) pair into an intermediate value of type
 * {@code I}. Intermediates cross node boundaries through {@link #writeIntermediate} and
 * {@link #readIntermediate}, and the reduce phase folds the intermediates of every shard for a
 * bucket into a final result of type {@code R}.</p>
 *
 * <h2>Absence</h2>
 * <p>A shard that saw no points produces {@link Optional#empty()}, never a zero-valued intermediate.
 * On the wire absence is a presence flag written by {@link StreamOutput#writeOptionalWriteable}.
 * The reduce phase skips absent partials and returns {@link Optional#empty()} when nothing is left
 * to combine, so "no data" is never confused with a computed zero.</p>
 *
 * <h2>Threading</h2>
 * <p>Implementations are stateless. {@link #map} consumes a single source on the calling thread;
 * {@link #reduce} only reads the list it is given and never keeps a reference to it.</p>
 *
 * @param <I> intermediate value produced by the map phase
 * @param <R> final result produced by the reduce phase
 */
public interface AggregateFunction<I extends Writeable, R> {

    /**
     * Function name as registered in {@link AggregateFunctionRegistry}.
     */
    String getName();

    /**
     * Folds every point of {@code source} into an intermediate value.
     *
     * @param source points of one bucket on one shard; consumed until end of stream
     * @return the intermediate, or empty if the source had no points
     * @throws IllegalStateException if a point carries a value of the wrong type for this aggregate
     */
    Optional<I> map(PointSource source);

    /**
     * Combines the intermediates produced for one bucket by every shard.
     *
     * @param partials intermediates in arrival order; empty entries are skipped
     * @return the final result, or empty if no shard contributed data
     */
    Optional<R> reduce(List<Optional<I>> partials);

    /**
     * Reader rebuilding an intermediate of this aggregate from the stream.
     */
    Writeable.Reader<I> intermediateReader();

    /**
     * Writes a possibly absent intermediate.
     */
    default void writeIntermediate(Optional<I> intermediate, StreamOutput out) throws IOException {
        out.writeOptionalWriteable(intermediate.orElse(null));
    }

    /**
     * Reads an intermediate written by {@link #writeIntermediate}.
     */
    default Optional<I> readIntermediate(StreamInput in) throws IOException {
        return Optional.ofNullable(in.readOptionalWriteable(intermediateReader()));
    }
}
