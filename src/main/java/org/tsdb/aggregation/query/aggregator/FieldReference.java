/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

import java.util.Objects;

/**
 * Reference to the field an aggregate is computed over.
 *
 * @param field the field name
 */
public record FieldReference(String field) implements CallArgument {
    public FieldReference {
        Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public String toString() {
        return field;
    }
}
