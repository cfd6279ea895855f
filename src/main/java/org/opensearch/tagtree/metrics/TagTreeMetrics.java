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
 * Static holder for tag tree metrics. Until {@link #initialize(MetricsRegistry)} is called every recording method is a no-op, so
 * the index can run without a telemetry backend.
 */
public final class TagTreeMetrics {

    /** Registry and resolver metrics */
    public static final TagTreeIndexMetrics INDEX = new TagTreeIndexMetrics();

    private static volatile MetricsRegistry registry;

    private TagTreeMetrics() {
        // Utility class, no instantiation
    }

    /**
     * Create all metrics in the given registry. Later calls replace the instruments.
     *
     * @param metricsRegistry the telemetry registry
     */
    public static synchronized void initialize(MetricsRegistry metricsRegistry) {
        if (metricsRegistry == null) {
            throw new IllegalArgumentException("MetricsRegistry cannot be null");
        }
        INDEX.initialize(metricsRegistry);
        registry = metricsRegistry;
    }

    /**
     * @return true once metrics have been initialized
     */
    public static boolean isInitialized() {
        return registry != null;
    }

    /**
     * Drop all instruments (for tests).
     */
    public static synchronized void cleanup() {
        registry = null;
        INDEX.cleanup();
    }

    /**
     * Increment a counter if metrics are initialized.
     *
     * @param counter the counter, may be null
     * @param value   the increment
     */
    public static void incrementCounter(Counter counter, long value) {
        if (counter != null) {
            counter.add(value);
        }
    }

    /**
     * Record a histogram value if metrics are initialized.
     *
     * @param histogram the histogram, may be null
     * @param value     the observed value
     */
    public static void recordHistogram(Histogram histogram, double value) {
        if (histogram != null) {
            histogram.record(value);
        }
    }
}
