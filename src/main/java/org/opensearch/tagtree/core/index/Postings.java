/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.index;

import org.roaringbitmap.longlong.LongIterator;
import org.roaringbitmap.longlong.Roaring64Bitmap;

/**
 * An immutable set of TSIDs backed by a 64-bit roaring bitmap. Set operations return new instances and never modify their operands.
 */
public final class Postings {
    private static final Postings EMPTY = new Postings(new Roaring64Bitmap());

    private final Roaring64Bitmap bitmap;

    private Postings(Roaring64Bitmap bitmap) {
        this.bitmap = bitmap;
    }

    /**
     * @return the shared empty postings
     */
    public static Postings empty() {
        return EMPTY;
    }

    /**
     * Create postings from explicit TSIDs.
     *
     * @param tsids the TSIDs, in any order
     * @return postings containing the TSIDs
     */
    public static Postings of(long... tsids) {
        if (tsids.length == 0) {
            return EMPTY;
        }
        Roaring64Bitmap bitmap = new Roaring64Bitmap();
        bitmap.add(tsids);
        return new Postings(bitmap);
    }

    /**
     * Take a private copy of a mutable bitmap. The caller must hold whatever lock guards {@code source}.
     *
     * @param source bitmap to copy
     * @return postings independent of later changes to {@code source}
     */
    static Postings copyOf(Roaring64Bitmap source) {
        if (source == null || source.isEmpty()) {
            return EMPTY;
        }
        Roaring64Bitmap copy = new Roaring64Bitmap();
        copy.or(source);
        return new Postings(copy);
    }

    /**
     * Wrap a bitmap the caller will no longer modify.
     */
    static Postings wrap(Roaring64Bitmap owned) {
        return owned.isEmpty() ? EMPTY : new Postings(owned);
    }

    /**
     * @param other postings to union with
     * @return TSIDs in either set
     */
    public Postings union(Postings other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        Roaring64Bitmap result = mutableCopy();
        result.or(other.bitmap);
        return new Postings(result);
    }

    /**
     * @param other postings to intersect with
     * @return TSIDs in both sets
     */
    public Postings intersect(Postings other) {
        if (isEmpty() || other.isEmpty()) return EMPTY;
        Roaring64Bitmap result = mutableCopy();
        result.and(other.bitmap);
        return wrap(result);
    }

    /**
     * @param other postings to remove
     * @return TSIDs in this set but not in {@code other}
     */
    public Postings difference(Postings other) {
        if (isEmpty() || other.isEmpty()) return this;
        Roaring64Bitmap result = mutableCopy();
        result.andNot(other.bitmap);
        return wrap(result);
    }

    /**
     * @param tsid TSID to test
     * @return true if present
     */
    public boolean contains(long tsid) {
        return bitmap.contains(tsid);
    }

    /**
     * @return true if no TSID is present
     */
    public boolean isEmpty() {
        return bitmap.isEmpty();
    }

    /**
     * @return number of TSIDs
     */
    public long cardinality() {
        return bitmap.getLongCardinality();
    }

    /**
     * @return iterator in ascending TSID order
     */
    public LongIterator iterator() {
        return bitmap.getLongIterator();
    }

    /**
     * @return TSIDs in ascending order
     */
    public long[] toArray() {
        return bitmap.toArray();
    }

    private Roaring64Bitmap mutableCopy() {
        Roaring64Bitmap copy = new Roaring64Bitmap();
        copy.or(bitmap);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Postings other)) return false;
        return bitmap.equals(other.bitmap);
    }

    @Override
    public int hashCode() {
        return bitmap.hashCode();
    }

    @Override
    public String toString() {
        return bitmap.toString();
    }
}
