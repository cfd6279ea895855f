/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.metrics;

import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.Histogram;
import org.opensearch.telemetry.metrics.MetricsRegistry;

/**
 * Registry and resolver metrics.
 */
public class TagTreeIndexMetrics {
    /** Counter for total number of register calls */
    public Counter registrations;

    /** Counter for total number of series created */
    public Counter seriesCreated;

    /** Counter for total number of matcher resolutions */
    public Counter resolves;

    /** Histogram for resolution latency */
    public Histogram resolveLatency;

    /** Histogram for number of series returned per resolution */
    public Histogram resolvedSeries;

    /**
     * Initialize index metrics. Called by TagTreeMetrics.initialize().
     */
    public void initialize(MetricsRegistry registry) {
        registrations = registry.createCounter(
            TagTreeMetricsConstants.REGISTRATIONS_TOTAL,
            TagTreeMetricsConstants.REGISTRATIONS_TOTAL_DESC,
            TagTreeMetricsConstants.UNIT_COUNT
        );
        seriesCreated = registry.createCounter(
            TagTreeMetricsConstants.SERIES_CREATED_TOTAL,
            TagTreeMetricsConstants.SERIES_CREATED_TOTAL_DESC,
            TagTreeMetricsConstants.UNIT_COUNT
        );
        resolves = registry.createCounter(
            TagTreeMetricsConstants.RESOLVES_TOTAL,
            TagTreeMetricsConstants.RESOLVES_TOTAL_DESC,
            TagTreeMetricsConstants.UNIT_COUNT
        );
        resolveLatency = registry.createHistogram(
            TagTreeMetricsConstants.RESOLVE_LATENCY,
            TagTreeMetricsConstants.RESOLVE_LATENCY_DESC,
            TagTreeMetricsConstants.UNIT_MILLISECONDS
        );
        resolvedSeries = registry.createHistogram(
            TagTreeMetricsConstants.RESOLVED_SERIES,
            TagTreeMetricsConstants.RESOLVED_SERIES_DESC,
            TagTreeMetricsConstants.UNIT_COUNT
        );
    }

    /**
     * Cleanup index metrics (for tests).
     */
    public void cleanup() {
        registrations = null;
        seriesCreated = null;
        resolves = null;
        resolveLatency = null;
        resolvedSeries = null;
    }
}
