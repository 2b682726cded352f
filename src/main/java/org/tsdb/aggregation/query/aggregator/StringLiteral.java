/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

/**
 * Quoted string literal argument.
 *
 * @param value the literal value
 */
public record StringLiteral(String value) implements CallArgument {
    @Override
    public String toString() {
        return "'" + value + "'";
    }
}
