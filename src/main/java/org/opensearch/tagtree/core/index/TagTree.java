/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.index;

import org.opensearch.tagtree.core.model.Labels;
import org.roaringbitmap.longlong.Roaring64Bitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * TagTree is the inverted index from label pairs to series. For every label name it keeps the postings of each observed value, sorted by
 * value, and the union of those postings (the series carrying the name at all). It also keeps the published set: TSIDs whose postings
 * are complete and may be returned to readers.
 * <p>
 * Names are partitioned into stripes by hash. Each stripe is guarded by a read/write lock held only for a single map access, and every
 * postings handed out is a private copy, so readers never observe a bitmap while it is modified.
 */
public class TagTree {
    private final Stripe[] stripes;
    private final int stripeMask;

    private final ReadWriteLock publishedLock = new ReentrantReadWriteLock();
    private final Roaring64Bitmap published = new Roaring64Bitmap();

    /**
     * Creates a TagTree.
     *
     * @param numStripes number of lock stripes, a power of two
     * @throws IllegalArgumentException if numStripes is not a positive power of two
     */
    public TagTree(int numStripes) {
        if (numStripes <= 0 || Integer.bitCount(numStripes) != 1) {
            throw new IllegalArgumentException("Number of stripes must be a positive power of two, got: " + numStripes);
        }
        stripes = new Stripe[numStripes];
        for (int i = 0; i < numStripes; i++) {
            stripes[i] = new Stripe();
        }
        stripeMask = numStripes - 1;
    }

    /**
     * Add postings for every label of a series. The series stays invisible to readers until {@link #publish(long)} is called.
     *
     * @param labels series labels
     * @param tsid   series identifier
     */
    public void addSeries(Labels labels, long tsid) {
        labels.forEach((name, value) -> insert(name, value, tsid));
    }

    /**
     * Add a TSID to the postings of (name, value) and to the name union. Re-inserting is a no-op.
     *
     * @param name  label name
     * @param value label value
     * @param tsid  series identifier
     */
    public void insert(String name, String value, long tsid) {
        Stripe stripe = stripeFor(name);
        stripe.lock.writeLock().lock();
        try {
            NameEntry entry = stripe.names.computeIfAbsent(name, k -> new NameEntry());
            entry.values.computeIfAbsent(value, k -> new Roaring64Bitmap()).addLong(tsid);
            entry.union.addLong(tsid);
        } finally {
            stripe.lock.writeLock().unlock();
        }
    }

    /**
     * Make a fully indexed TSID visible to readers.
     *
     * @param tsid series identifier
     */
    public void publish(long tsid) {
        publishedLock.writeLock().lock();
        try {
            published.addLong(tsid);
        } finally {
            publishedLock.writeLock().unlock();
        }
    }

    /**
     * @return snapshot of all published TSIDs
     */
    public Postings allSeries() {
        publishedLock.readLock().lock();
        try {
            return Postings.copyOf(published);
        } finally {
            publishedLock.readLock().unlock();
        }
    }

    /**
     * @param name  label name
     * @param value label value
     * @return series carrying (name, value), empty if never observed
     */
    public Postings lookupEQL(String name, String value) {
        Stripe stripe = stripeFor(name);
        stripe.lock.readLock().lock();
        try {
            NameEntry entry = stripe.names.get(name);
            return entry == null ? Postings.empty() : Postings.copyOf(entry.values.get(value));
        } finally {
            stripe.lock.readLock().unlock();
        }
    }

    /**
     * @param name label name
     * @return series carrying the name under any value, empty if never observed
     */
    public Postings nameUnion(String name) {
        Stripe stripe = stripeFor(name);
        stripe.lock.readLock().lock();
        try {
            NameEntry entry = stripe.names.get(name);
            return entry == null ? Postings.empty() : Postings.copyOf(entry.union);
        } finally {
            stripe.lock.readLock().unlock();
        }
    }

    /**
     * @param name label name
     * @return distinct values observed for the name in lexicographic order
     */
    public List<String> enumerateValues(String name) {
        Stripe stripe = stripeFor(name);
        stripe.lock.readLock().lock();
        try {
            NameEntry entry = stripe.names.get(name);
            return entry == null ? Collections.emptyList() : new ArrayList<>(entry.values.keySet());
        } finally {
            stripe.lock.readLock().unlock();
        }
    }

    /**
     * Union of the postings of every value of {@code name} accepted by the predicate, computed under one lock acquisition.
     *
     * @param name      label name
     * @param predicate value filter
     * @return matching series
     */
    public Postings postingsForValues(String name, Predicate<String> predicate) {
        Stripe stripe = stripeFor(name);
        stripe.lock.readLock().lock();
        try {
            NameEntry entry = stripe.names.get(name);
            if (entry == null) {
                return Postings.empty();
            }
            Roaring64Bitmap result = new Roaring64Bitmap();
            for (Map.Entry<String, Roaring64Bitmap> value : entry.values.entrySet()) {
                if (predicate.test(value.getKey())) {
                    result.or(value.getValue());
                }
            }
            return Postings.wrap(result);
        } finally {
            stripe.lock.readLock().unlock();
        }
    }

    /**
     * Series carrying {@code name} with a value other than {@code value}. The union and the value postings are read under the same
     * lock acquisition so a concurrent insert cannot appear in one and not the other.
     *
     * @param name  label name
     * @param value excluded value
     * @return matching series
     */
    public Postings nameUnionMinusValue(String name, String value) {
        Stripe stripe = stripeFor(name);
        stripe.lock.readLock().lock();
        try {
            NameEntry entry = stripe.names.get(name);
            if (entry == null) {
                return Postings.empty();
            }
            Roaring64Bitmap result = new Roaring64Bitmap();
            result.or(entry.union);
            Roaring64Bitmap excluded = entry.values.get(value);
            if (excluded != null) {
                result.andNot(excluded);
            }
            return Postings.wrap(result);
        } finally {
            stripe.lock.readLock().unlock();
        }
    }

    /**
     * Series carrying {@code name} with a value rejected by the predicate, read under one lock acquisition.
     *
     * @param name     label name
     * @param excluded predicate selecting the values to exclude
     * @return matching series
     */
    public Postings nameUnionMinusMatching(String name, Predicate<String> excluded) {
        Stripe stripe = stripeFor(name);
        stripe.lock.readLock().lock();
        try {
            NameEntry entry = stripe.names.get(name);
            if (entry == null) {
                return Postings.empty();
            }
            Roaring64Bitmap result = new Roaring64Bitmap();
            for (Map.Entry<String, Roaring64Bitmap> value : entry.values.entrySet()) {
                if (excluded.test(value.getKey()) == false) {
                    result.or(value.getValue());
                }
            }
            return Postings.wrap(result);
        } finally {
            stripe.lock.readLock().unlock();
        }
    }

    /**
     * @return every label name observed, sorted
     */
    public List<String> labelNames() {
        TreeSet<String> names = new TreeSet<>();
        for (Stripe stripe : stripes) {
            stripe.lock.readLock().lock();
            try {
                names.addAll(stripe.names.keySet());
            } finally {
                stripe.lock.readLock().unlock();
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * @return number of distinct label names
     */
    public int numNames() {
        int count = 0;
        for (Stripe stripe : stripes) {
            stripe.lock.readLock().lock();
            try {
                count += stripe.names.size();
            } finally {
                stripe.lock.readLock().unlock();
            }
        }
        return count;
    }

    /**
     * @return number of distinct (name, value) pairs, i.e. postings entries
     */
    public long numPairs() {
        long count = 0;
        for (Stripe stripe : stripes) {
            stripe.lock.readLock().lock();
            try {
                for (NameEntry entry : stripe.names.values()) {
                    count += entry.values.size();
                }
            } finally {
                stripe.lock.readLock().unlock();
            }
        }
        return count;
    }

    /**
     * @return number of lock stripes
     */
    public int numStripes() {
        return stripes.length;
    }

    private Stripe stripeFor(String name) {
        int h = name.hashCode();
        return stripes[(h ^ (h >>> 16)) & stripeMask];
    }

    private static final class Stripe {
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private final Map<String, NameEntry> names = new HashMap<>();
    }

    private static final class NameEntry {
        private final TreeMap<String, Roaring64Bitmap> values = new TreeMap<>();
        private final Roaring64Bitmap union = new Roaring64Bitmap();
    }
}
