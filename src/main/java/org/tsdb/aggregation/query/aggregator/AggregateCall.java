/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An aggregate function call handed over by the query parser, e.g. {@code percentile(value, 95)}.
 *
 * @param name function name
 * @param arguments call arguments in order
 */
public record AggregateCall(String name, List<CallArgument> arguments) {

    public AggregateCall {
        Objects.requireNonNull(name, "name must not be null");
        arguments = List.copyOf(arguments);
    }

    public static AggregateCall of(String name, CallArgument... arguments) {
        return new AggregateCall(name, List.of(arguments));
    }

    /**
     * Convenience for the common single-field form, e.g. {@code mean(value)}.
     */
    public static AggregateCall onField(String name, String field) {
        return of(name, new FieldReference(field));
    }

    @Override
    public String toString() {
        return String.format(
            Locale.ROOT,
            "%s(%s)",
            name,
            arguments.stream().map(CallArgument::toString).collect(Collectors.joining(", "))
        );
    }
}
