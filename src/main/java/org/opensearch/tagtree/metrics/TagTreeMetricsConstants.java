/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.metrics;

/** Metric names, descriptions, and units. */
public final class TagTreeMetricsConstants {

    private TagTreeMetricsConstants() {
        // Utility class, no instantiation
    }

    // Registry Counters
    /** Counter: Total number of register calls, including those that found an existing series */
    public static final String REGISTRATIONS_TOTAL = "tagtree.registrations.total";

    /** Counter: Total number of series created */
    public static final String SERIES_CREATED_TOTAL = "tagtree.series.created.total";

    // Resolver Metrics
    /** Counter: Total number of matcher resolutions */
    public static final String RESOLVES_TOTAL = "tagtree.resolves.total";

    /** Histogram: Latency of a matcher resolution */
    public static final String RESOLVE_LATENCY = "tagtree.resolve.latency";

    /** Histogram: Number of series returned per resolution */
    public static final String RESOLVED_SERIES = "tagtree.resolve.series";

    // Descriptions
    public static final String REGISTRATIONS_TOTAL_DESC = "Total number of register calls, including those that found an existing series";
    public static final String SERIES_CREATED_TOTAL_DESC = "Total number of series created";
    public static final String RESOLVES_TOTAL_DESC = "Total number of matcher resolutions";
    public static final String RESOLVE_LATENCY_DESC = "Latency of a matcher resolution";
    public static final String RESOLVED_SERIES_DESC = "Number of series returned per resolution";

    // Units
    public static final String UNIT_COUNT = "1";
    public static final String UNIT_MILLISECONDS = "ms";
}
