/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

/**
 * Notified once for every series created by registration, after the series is visible to readers. Exceptions thrown by the listener
 * propagate to the registering caller; the series stays registered.
 */
@FunctionalInterface
public interface SeriesEventListener {

    /** Listener that ignores every event. */
    SeriesEventListener NOOP = series -> {};

    /**
     * @param series the newly created series
     */
    void onSeriesCreated(SeriesRecord series);
}
