/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

/**
 * Numeric literal argument, e.g. the rank of {@code percentile(value, 95)}.
 *
 * @param value the literal value
 */
public record NumberLiteral(double value) implements CallArgument {
    @Override
    public String toString() {
        return Double.toString(value);
    }
}
