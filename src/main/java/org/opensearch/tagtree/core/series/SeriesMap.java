/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

import org.opensearch.common.util.concurrent.ConcurrentHashMapLong;
import org.opensearch.tagtree.core.model.Labels;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * A collection of series records, addressable by TSID ({@link SeriesRecord#getTsid()}) and by canonical labels.
 * <p>
 * The labels index decides identity: {@link #computeIfAbsent(Labels, Function)} runs the creation function at most once per distinct
 * label set, blocking only callers racing on the same key. The TSID index is what readers use; a record becomes reachable by TSID
 * only when the creation function calls {@link #addByTsid(SeriesRecord)}.
 */
public class SeriesMap {

    private final ConcurrentHashMapLong<SeriesRecord> seriesByTsid;
    private final ConcurrentHashMap<Labels, SeriesRecord> seriesByLabels;

    /**
     * Constructs a new SeriesMap instance.
     */
    public SeriesMap() {
        seriesByTsid = new ConcurrentHashMapLong<>(new ConcurrentHashMap<>());
        seriesByLabels = new ConcurrentHashMap<>();
    }

    /**
     * Get a series by its TSID.
     * @param tsid the series identifier
     * @return the SeriesRecord instance, or null if not found
     */
    public SeriesRecord getByTsid(long tsid) {
        return seriesByTsid.get(tsid);
    }

    /**
     * Get a series by its canonical labels.
     * @param labels canonical series labels
     * @return the SeriesRecord instance, or null if not found
     */
    public SeriesRecord getByLabels(Labels labels) {
        return seriesByLabels.get(labels);
    }

    /**
     * Atomically get the series for the labels, or create it with the given function. The function runs at most once per key.
     *
     * @param labels  canonical series labels
     * @param creator builds and indexes the new record
     * @return the existing or newly created record
     */
    public SeriesRecord computeIfAbsent(Labels labels, Function<Labels, SeriesRecord> creator) {
        return seriesByLabels.computeIfAbsent(labels, creator);
    }

    /**
     * Make a record reachable by TSID.
     * @param series the record
     */
    public void addByTsid(SeriesRecord series) {
        seriesByTsid.put(series.getTsid(), series);
    }

    /**
     * Add a record to both indexes, used when replaying persisted series.
     * @param series the record
     * @return the record already registered under the same TSID or labels, or null if the record was added
     */
    public SeriesRecord putIfAbsent(SeriesRecord series) {
        SeriesRecord existing = seriesByLabels.putIfAbsent(series.getLabels(), series);
        if (existing != null) {
            return existing;
        }
        existing = seriesByTsid.putIfAbsent(series.getTsid(), series);
        if (existing != null) {
            seriesByLabels.remove(series.getLabels(), series);
            return existing;
        }
        return null;
    }

    /**
     * Returns a list containing a snapshot of the current series.
     * @return list of SeriesRecord
     */
    public List<SeriesRecord> getSeries() {
        return new ArrayList<>(seriesByTsid.values());
    }

    /**
     * Returns the number of series reachable by TSID.
     * @return the number of series
     */
    public int size() {
        return seriesByTsid.size();
    }
}
