/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator;

/**
 * An argument of an aggregate call, as produced by the query parser.
 */
public sealed interface CallArgument permits FieldReference, NumberLiteral, StringLiteral {}
