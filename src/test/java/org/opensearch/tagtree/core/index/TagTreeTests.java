/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.tagtree.core.index;

import org.opensearch.tagtree.core.model.ByteLabels;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.concurrent.CountDownLatch;

public class TagTreeTests extends OpenSearchTestCase {

    public void testStripesMustBePowerOfTwo() {
        expectThrows(IllegalArgumentException.class, () -> new TagTree(0));
        expectThrows(IllegalArgumentException.class, () -> new TagTree(3));
        expectThrows(IllegalArgumentException.class, () -> new TagTree(-4));
        assertEquals(1, new TagTree(1).numStripes());
        assertEquals(64, new TagTree(64).numStripes());
    }

    public void testInsertAndLookup() {
        TagTree tree = new TagTree(4);
        tree.addSeries(ByteLabels.fromStrings("job", "api", "env", "prod"), 1);
        tree.addSeries(ByteLabels.fromStrings("job", "api", "env", "dev"), 2);
        tree.addSeries(ByteLabels.fromStrings("job", "web"), 3);

        assertEquals(Postings.of(1, 2), tree.lookupEQL("job", "api"));
        assertEquals(Postings.of(1), tree.lookupEQL("env", "prod"));
        assertTrue(tree.lookupEQL("env", "staging").isEmpty());
        assertTrue(tree.lookupEQL("region", "us").isEmpty());

        assertEquals(Postings.of(1, 2, 3), tree.nameUnion("job"));
        assertEquals(Postings.of(1, 2), tree.nameUnion("env"));
        assertTrue(tree.nameUnion("region").isEmpty());
    }

    public void testInsertIsIdempotent() {
        TagTree tree = new TagTree(1);
        tree.insert("job", "api", 1);
        tree.insert("job", "api", 1);
        assertEquals(Postings.of(1), tree.lookupEQL("job", "api"));
        assertEquals(1, tree.numPairs());
    }

    public void testValuesAreSorted() {
        TagTree tree = new TagTree(2);
        tree.insert("env", "staging", 1);
        tree.insert("env", "dev", 2);
        tree.insert("env", "prod", 3);
        tree.insert("env", "dev", 4);

        assertEquals(List.of("dev", "prod", "staging"), tree.enumerateValues("env"));
        assertEquals(List.of(), tree.enumerateValues("unknown"));
    }

    public void testNegationPrimitives() {
        TagTree tree = new TagTree(2);
        tree.insert("env", "prod", 1);
        tree.insert("env", "dev", 2);
        tree.insert("env", "production", 3);

        assertEquals(Postings.of(2, 3), tree.nameUnionMinusValue("env", "prod"));
        assertEquals(Postings.of(1, 2, 3), tree.nameUnionMinusValue("env", "absent"));
        assertTrue(tree.nameUnionMinusValue("unknown", "x").isEmpty());

        assertEquals(Postings.of(1, 3), tree.postingsForValues("env", v -> v.startsWith("prod")));
        assertEquals(Postings.of(2), tree.nameUnionMinusMatching("env", v -> v.startsWith("prod")));
    }

    public void testPublishedSet() {
        TagTree tree = new TagTree(2);
        tree.addSeries(ByteLabels.fromStrings("job", "api"), 1);
        tree.addSeries(ByteLabels.fromStrings("job", "web"), 2);
        assertTrue(tree.allSeries().isEmpty());

        tree.publish(2);
        assertEquals(Postings.of(2), tree.allSeries());
        tree.publish(1);
        assertEquals(Postings.of(1, 2), tree.allSeries());
    }

    public void testReturnedPostingsAreSnapshots() {
        TagTree tree = new TagTree(1);
        tree.insert("job", "api", 1);
        Postings before = tree.lookupEQL("job", "api");
        Postings unionBefore = tree.nameUnion("job");
        tree.insert("job", "api", 2);
        assertEquals(Postings.of(1), before);
        assertEquals(Postings.of(1), unionBefore);
    }

    public void testStats() {
        TagTree tree = new TagTree(8);
        tree.addSeries(ByteLabels.fromStrings("job", "api", "env", "prod"), 1);
        tree.addSeries(ByteLabels.fromStrings("job", "api", "region", "us"), 2);

        assertEquals(List.of("env", "job", "region"), tree.labelNames());
        assertEquals(3, tree.numNames());
        assertEquals(3, tree.numPairs());
    }

    public void testConcurrentInserts() throws Exception {
        TagTree tree = new TagTree(4);
        int numThreads = 4;
        int perThread = 500;
        CountDownLatch start = new CountDownLatch(1);
        Thread[] threads = new Thread[numThreads];
        for (int t = 0; t < numThreads; t++) {
            final int offset = t * perThread;
            threads[t] = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    throw new AssertionError(e);
                }
                for (int i = 1; i <= perThread; i++) {
                    long tsid = offset + i;
                    tree.insert("job", "job" + (tsid % 10), tsid);
                    tree.insert("instance", "i" + tsid, tsid);
                    tree.publish(tsid);
                }
            });
            threads[t].start();
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        long total = (long) numThreads * perThread;
        assertEquals(total, tree.allSeries().cardinality());
        assertEquals(total, tree.nameUnion("job").cardinality());
        assertEquals(total, tree.nameUnion("instance").cardinality());
        assertEquals(10, tree.enumerateValues("job").size());
        assertEquals(total / 10, tree.lookupEQL("job", "job3").cardinality());
    }
}
