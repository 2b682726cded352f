/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

/**
 * Thrown at dispatch time when an aggregate call cannot be served: unknown function,
 * wrong number of arguments, or an argument of the wrong kind.
 */
public class InvalidAggregateCallException extends IllegalArgumentException {
    private final String functionName;

    public InvalidAggregateCallException(String functionName, String message) {
        super(message);
        this.functionName = functionName;
    }

    /**
     * Name of the function the caller asked for.
     */
    public String getFunctionName() {
        return functionName;
    }
}
