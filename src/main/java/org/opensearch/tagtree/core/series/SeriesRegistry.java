/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.tagtree.core.exceptions.SeriesNotFoundException;
import org.opensearch.tagtree.core.exceptions.TagTreeCorruptionException;
import org.opensearch.tagtree.core.exceptions.TagTreeInternalException;
import org.opensearch.tagtree.core.index.TagTree;
import org.opensearch.tagtree.core.model.ByteLabels;
import org.opensearch.tagtree.core.model.Labels;
import org.opensearch.tagtree.core.utils.Constants;
import org.opensearch.tagtree.metrics.TagTreeMetrics;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SeriesRegistry owns the mapping between label sets and TSIDs. Registering a label set for the first time allocates the next TSID,
 * indexes its labels in the {@link TagTree} and then publishes the TSID, so readers resolving against the tag tree never see a series
 * whose postings are incomplete.
 */
public class SeriesRegistry {
    private static final Logger logger = LogManager.getLogger(SeriesRegistry.class);

    private final SeriesMap seriesMap = new SeriesMap();
    private final AtomicLong nextTsid = new AtomicLong(Constants.FIRST_TSID);
    private final TagTree tagTree;
    private final int maxLabelPairs;
    private final SeriesEventListener listener;

    /**
     * Creates a registry without a label limit or listener.
     *
     * @param tagTree the tag tree receiving postings for new series
     */
    public SeriesRegistry(TagTree tagTree) {
        this(tagTree, 0, SeriesEventListener.NOOP);
    }

    /**
     * Creates a registry.
     *
     * @param tagTree       the tag tree receiving postings for new series
     * @param maxLabelPairs maximum number of labels per series, 0 for no limit
     * @param listener      notified for every created series
     */
    public SeriesRegistry(TagTree tagTree, int maxLabelPairs, SeriesEventListener listener) {
        if (maxLabelPairs < 0) {
            throw new IllegalArgumentException("maxLabelPairs must be non-negative, got: " + maxLabelPairs);
        }
        this.tagTree = tagTree;
        this.maxLabelPairs = maxLabelPairs;
        this.listener = listener == null ? SeriesEventListener.NOOP : listener;
    }

    /**
     * Get the TSID of a label set, creating the series if it does not exist. Registering an existing label set widens its activity
     * interval to include the timestamp.
     *
     * @param timestamp the timestamp the series was observed at
     * @param labels    the series labels
     * @return the TSID and whether the series was created
     * @throws IllegalArgumentException  if labels are null, empty or exceed the configured label limit
     * @throws TagTreeInternalException if no TSID can be allocated
     */
    public RegistrationResult register(long timestamp, Labels labels) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("Series labels cannot be null or empty");
        }
        if (maxLabelPairs > 0 && labels.size() > maxLabelPairs) {
            throw new IllegalArgumentException(
                "Series has " + labels.size() + " labels, more than the limit of " + maxLabelPairs + ": " + labels.toKeyValueString()
            );
        }
        ByteLabels canonical = ByteLabels.canonical(labels);

        boolean[] created = new boolean[1];
        SeriesRecord series = seriesMap.computeIfAbsent(canonical, key -> {
            created[0] = true;
            return createSeries(key, timestamp);
        });

        TagTreeMetrics.incrementCounter(TagTreeMetrics.INDEX.registrations, 1);
        if (created[0] == false) {
            series.extend(timestamp);
            return new RegistrationResult(series.getTsid(), false);
        }

        TagTreeMetrics.incrementCounter(TagTreeMetrics.INDEX.seriesCreated, 1);
        if (logger.isDebugEnabled()) {
            logger.debug("Created series tsid={} labels={}", series.getTsid(), canonical.toKeyValueString());
        }
        listener.onSeriesCreated(series);
        return new RegistrationResult(series.getTsid(), true);
    }

    // Runs at most once per label set, under the labels map's lock for that key.
    private SeriesRecord createSeries(Labels labels, long timestamp) {
        long tsid = allocateTsid();
        SeriesRecord series = new SeriesRecord(tsid, labels, timestamp);
        tagTree.addSeries(labels, tsid);
        seriesMap.addByTsid(series);
        tagTree.publish(tsid);
        return series;
    }

    private long allocateTsid() {
        long tsid = nextTsid.getAndIncrement();
        if (tsid < Constants.FIRST_TSID || tsid == Long.MAX_VALUE) {
            nextTsid.set(Long.MAX_VALUE);
            throw new TagTreeInternalException("TSID space exhausted, cannot register more series");
        }
        return tsid;
    }

    /**
     * Get the labels of a series.
     *
     * @param tsid the series identifier
     * @return the canonical labels
     * @throws SeriesNotFoundException if the TSID is reserved or unknown
     */
    public Labels lookupLabels(long tsid) {
        SeriesRecord series = tsid < Constants.FIRST_TSID ? null : seriesMap.getByTsid(tsid);
        if (series == null) {
            throw new SeriesNotFoundException(tsid);
        }
        return series.getLabels();
    }

    /**
     * Find the TSID of a label set without registering it.
     *
     * @param labels the series labels
     * @return the TSID, or empty if the label set was never registered
     */
    public Optional<Long> lookupSeries(Labels labels) {
        if (labels == null) {
            throw new IllegalArgumentException("Series labels cannot be null");
        }
        if (labels.isEmpty()) {
            return Optional.empty();
        }
        SeriesRecord series = seriesMap.getByLabels(ByteLabels.canonical(labels));
        return series == null ? Optional.empty() : Optional.of(series.getTsid());
    }

    /**
     * @param tsid the series identifier
     * @return the series record, or null if the TSID is unknown
     */
    public SeriesRecord getRecord(long tsid) {
        return seriesMap.getByTsid(tsid);
    }

    /**
     * @return number of registered series
     */
    public int getNumSeries() {
        return seriesMap.size();
    }

    /**
     * @return the TSID the next new series will receive
     */
    public long getNextTsid() {
        return nextTsid.get();
    }

    /**
     * Restore persisted series. Must run on an empty registry before it serves any registration or query. On success the TSID counter
     * continues after the largest recovered TSID. If recovery fails the registry is left partially loaded and must be discarded.
     *
     * @param store the persisted series
     * @return number of recovered series
     * @throws IOException                 if the store cannot be read
     * @throws IllegalStateException       if the registry already holds series
     * @throws TagTreeCorruptionException if the store holds a reserved TSID, a duplicate TSID or label set, or an invalid interval
     */
    public synchronized int recover(SeriesStore store) throws IOException {
        if (seriesMap.size() != 0 || nextTsid.get() != Constants.FIRST_TSID) {
            throw new IllegalStateException("Series can only be recovered into an empty registry");
        }
        RecoveringSeriesLoader loader = new RecoveringSeriesLoader();
        store.replay(loader);
        if (loader.count > 0) {
            nextTsid.set(loader.maxTsid == Long.MAX_VALUE ? Long.MAX_VALUE : loader.maxTsid + 1);
        }
        logger.info("Recovered {} series, next tsid {}", loader.count, nextTsid.get());
        return loader.count;
    }

    /**
     * Loads persisted series into the registry and the tag tree.
     */
    private class RecoveringSeriesLoader implements SeriesLoader {
        private int count;
        private long maxTsid = Constants.INVALID_TSID;

        @Override
        public void load(long tsid, Labels labels, long minTimestamp, long maxTimestamp) {
            if (tsid < Constants.FIRST_TSID) {
                throw new TagTreeCorruptionException("Persisted series has reserved tsid [" + tsid + "]");
            }
            if (labels == null || labels.isEmpty()) {
                throw new TagTreeCorruptionException("Persisted series [" + tsid + "] has no labels");
            }
            SeriesRecord series;
            try {
                series = new SeriesRecord(tsid, ByteLabels.canonical(labels), minTimestamp, maxTimestamp);
            } catch (IllegalArgumentException e) {
                throw new TagTreeCorruptionException("Persisted series [" + tsid + "] is invalid", e);
            }
            SeriesRecord existing = seriesMap.putIfAbsent(series);
            if (existing != null) {
                throw new TagTreeCorruptionException(
                    "Persisted series [" + tsid + "] " + series.getLabels().toKeyValueString() + " conflicts with series [" + existing
                        .getTsid() + "] " + existing.getLabels().toKeyValueString()
                );
            }
            tagTree.addSeries(series.getLabels(), tsid);
            tagTree.publish(tsid);
            maxTsid = Math.max(maxTsid, tsid);
            count++;
        }
    }
}
