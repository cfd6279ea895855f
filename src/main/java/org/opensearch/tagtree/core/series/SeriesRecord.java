/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

import org.opensearch.tagtree.core.model.Labels;

import java.util.concurrent.atomic.AtomicLong;

/**
 * SeriesRecord binds a TSID to its labels and tracks the activity interval, the range of timestamps the series has been registered
 * with. The interval only ever widens.
 */
public class SeriesRecord {
    private final long tsid;

    // Series Labels
    private final Labels labels;

    private final AtomicLong minTimestamp;
    private final AtomicLong maxTimestamp;

    /**
     * Constructs a record with a single-point activity interval.
     * @param tsid the series identifier
     * @param labels the series labels
     * @param timestamp the first registration timestamp
     */
    public SeriesRecord(long tsid, Labels labels, long timestamp) {
        this(tsid, labels, timestamp, timestamp);
    }

    /**
     * Constructs a record with an explicit activity interval, used when replaying persisted series.
     * @param tsid the series identifier
     * @param labels the series labels
     * @param minTimestamp lower bound of the activity interval
     * @param maxTimestamp upper bound of the activity interval
     * @throws IllegalArgumentException if minTimestamp &gt; maxTimestamp
     */
    public SeriesRecord(long tsid, Labels labels, long minTimestamp, long maxTimestamp) {
        if (minTimestamp > maxTimestamp) {
            throw new IllegalArgumentException(
                "Invalid activity interval for tsid " + tsid + ": [" + minTimestamp + ", " + maxTimestamp + "]"
            );
        }
        this.tsid = tsid;
        this.labels = labels;
        this.minTimestamp = new AtomicLong(minTimestamp);
        this.maxTimestamp = new AtomicLong(maxTimestamp);
    }

    /**
     * Get the series identifier.
     * @return the TSID
     */
    public long getTsid() {
        return tsid;
    }

    /**
     * Get the series labels.
     * @return the series labels
     */
    public Labels getLabels() {
        return labels;
    }

    /**
     * @return lower bound of the activity interval
     */
    public long getMinTimestamp() {
        return minTimestamp.get();
    }

    /**
     * @return upper bound of the activity interval
     */
    public long getMaxTimestamp() {
        return maxTimestamp.get();
    }

    /**
     * Widen the activity interval to include the timestamp. Lock free; concurrent callers never shrink the interval.
     * @param timestamp observed timestamp
     */
    public void extend(long timestamp) {
        if (timestamp < minTimestamp.get()) {
            minTimestamp.accumulateAndGet(timestamp, Math::min);
        }
        if (timestamp > maxTimestamp.get()) {
            maxTimestamp.accumulateAndGet(timestamp, Math::max);
        }
    }

    /**
     * Check whether the activity interval intersects [mint, maxt], both inclusive.
     * @param mint window start
     * @param maxt window end
     * @return true if the series was active within the window
     */
    public boolean overlaps(long mint, long maxt) {
        return getMinTimestamp() <= maxt && getMaxTimestamp() >= mint;
    }

    @Override
    public String toString() {
        return "SeriesRecord{tsid=" + tsid + ", labels=" + labels + ", interval=[" + getMinTimestamp() + ", " + getMaxTimestamp() + "]}";
    }
}
