/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.query.aggregator.function;

import org.tsdb.aggregation.common.Constants;

/**
 * Value with the latest timestamp.
 */
public class LastFunction extends TemporalExtremumFunction {

    @Override
    public String getName() {
        return Constants.Functions.LAST;
    }

    @Override
    protected boolean replaces(long candidate, long current) {
        return candidate > current;
    }
}
