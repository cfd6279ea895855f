/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

import org.opensearch.tagtree.core.model.Labels;

/**
 * Callback receiving persisted series during recovery.
 */
@FunctionalInterface
public interface SeriesLoader {

    /**
     * Load one persisted series.
     *
     * @param tsid         the identifier the series was registered under
     * @param labels       the series labels
     * @param minTimestamp lower bound of the persisted activity interval
     * @param maxTimestamp upper bound of the persisted activity interval
     */
    void load(long tsid, Labels labels, long minTimestamp, long maxTimestamp);
}
