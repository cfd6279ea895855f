/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

import java.io.IOException;

/**
 * Durable source of previously registered series. Implementations live outside the index; the index only replays what they hold.
 */
public interface SeriesStore {

    /**
     * Replay every persisted series into the loader, in any order.
     *
     * @param loader receives each series
     * @throws IOException if the store cannot be read
     */
    void replay(SeriesLoader loader) throws IOException;
}
