/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.core.model;

/**
 * Forward-only cursor over the points of one group-by bucket.
 *
 * <p>A source is consumed by exactly one map invocation on a single thread. Once exhausted it
 * returns a point for which {@link Point#isEndOfStream()} is true, and keeps returning such a
 * point on further calls. Sources are never rewound.</p>
 */
public interface PointSource {

    /**
     * Returns the next point, or the end-of-stream marker. Implementations may block on I/O.
     */
    Point next();
}
