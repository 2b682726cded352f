/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tsdb.aggregation.common;

/**
 * Constants shared across the aggregation engine.
 */
public final class Constants {

    private Constants() {}

    /**
     * Aggregate function names as they appear in a query call.
     */
    public static final class Functions {
        private Functions() {}

        public static final String COUNT = "count";
        public static final String SUM = "sum";
        public static final String MEAN = "mean";
        public static final String MIN = "min";
        public static final String MAX = "max";
        public static final String SPREAD = "spread";
        public static final String STDDEV = "stddev";
        public static final String MEDIAN = "median";
        public static final String PERCENTILE = "percentile";
        public static final String FIRST = "first";
        public static final String LAST = "last";

        /** Pseudo function used when a query asks for raw points instead of an aggregate. */
        public static final String RAW = "raw";
    }

    /**
     * Setting keys.
     */
    public static final class Settings {
        private Settings() {}

        public static final String PARTIAL_RESULTS_ENABLED = "tsdb.aggregation.partial_results.enabled";
        public static final String RAW_MAX_POINTS = "tsdb.aggregation.raw.max_points";
    }
}
