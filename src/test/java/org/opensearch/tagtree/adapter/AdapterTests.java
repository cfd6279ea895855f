/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.adapter;

import org.opensearch.tagtree.core.index.TagTreeIndex;
import org.opensearch.tagtree.core.model.ByteLabels;
import org.opensearch.tagtree.core.model.LabelMatcher;
import org.opensearch.tagtree.core.model.Labels;
import org.opensearch.tagtree.core.model.MatchOp;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;

/**
 * Exercises the adapter seams with a host that models label sets as lists of "name=value" strings and negation as a wrapper around a
 * positive matcher.
 */
public class AdapterTests extends OpenSearchTestCase {

    /** Host matcher: either a leaf or a negation of another host matcher. */
    private interface HostMatcher {
    }

    private record Leaf(String name, String symbol, String value) implements HostMatcher {
    }

    private record Not(HostMatcher inner) implements HostMatcher {
    }

    private static final LabelsAdapter<List<String>> LABELS = new LabelsAdapter<>() {
        @Override
        public Labels toCanonical(List<String> hostLabels) {
            List<String> pairs = new ArrayList<>();
            for (String pair : hostLabels) {
                int eq = pair.indexOf('=');
                if (eq < 0) {
                    throw new IllegalArgumentException("Malformed label: " + pair);
                }
                pairs.add(pair.substring(0, eq));
                pairs.add(pair.substring(eq + 1));
            }
            return ByteLabels.fromStrings(pairs.toArray(new String[0]));
        }

        @Override
        public List<String> fromCanonical(Labels labels) {
            List<String> result = new ArrayList<>();
            labels.forEach((name, value) -> result.add(name + "=" + value));
            return result;
        }
    };

    private static final MatcherAdapter<HostMatcher> MATCHERS = new MatcherAdapter<>() {
        @Override
        public LabelMatcher toCanonicalMatcher(HostMatcher hostMatcher) {
            if (hostMatcher instanceof Not not) {
                return toCanonicalMatcher(not.inner()).invert();
            }
            Leaf leaf = (Leaf) hostMatcher;
            return LabelMatcher.of(MatchOp.fromSymbol(leaf.symbol()), leaf.name(), leaf.value());
        }

        @Override
        public HostMatcher fromCanonicalMatcher(LabelMatcher matcher) {
            if (matcher.getOp().isNegative()) {
                return new Not(fromCanonicalMatcher(matcher.positive()));
            }
            return new Leaf(matcher.getName(), matcher.getOp().symbol(), matcher.getValue());
        }
    };

    public void testLabelsRoundTrip() {
        Labels canonical = LABELS.toCanonical(List.of("job=api", "env=prod"));
        assertEquals(ByteLabels.fromStrings("env", "prod", "job", "api"), canonical);
        assertEquals(List.of("env=prod", "job=api"), LABELS.fromCanonical(canonical));
        expectThrows(IllegalArgumentException.class, () -> LABELS.toCanonical(List.of("job=api", "job=web")));
    }

    public void testNegatedWrappersInvert() {
        Leaf eq = new Leaf("env", "=", "prod");
        Leaf regex = new Leaf("env", "=~", "pro.");

        assertEquals(LabelMatcher.notEqual("env", "prod"), MATCHERS.toCanonicalMatcher(new Not(eq)));
        assertEquals(LabelMatcher.notRegex("env", "pro."), MATCHERS.toCanonicalMatcher(new Not(regex)));
        assertEquals(LabelMatcher.equal("env", "prod"), MATCHERS.toCanonicalMatcher(new Not(new Leaf("env", "!=", "prod"))));
        assertEquals(LabelMatcher.regex("env", "pro."), MATCHERS.toCanonicalMatcher(new Not(new Not(regex))));
    }

    public void testFromCanonicalUsesWrapperForNegation() {
        assertEquals(new Not(new Leaf("env", "=~", "pro.")), MATCHERS.fromCanonicalMatcher(LabelMatcher.notRegex("env", "pro.")));
        for (MatchOp op : MatchOp.values()) {
            LabelMatcher matcher = LabelMatcher.of(op, "env", "p");
            assertEquals(matcher, MATCHERS.toCanonicalMatcher(MATCHERS.fromCanonicalMatcher(matcher)));
        }
    }

    public void testMalformedHostRegexRejected() {
        expectThrows(IllegalArgumentException.class, () -> MATCHERS.toCanonicalMatcher(new Not(new Leaf("env", "=~", "("))));
    }

    public void testHostQueryThroughIndex() {
        TagTreeIndex index = new TagTreeIndex();
        long prod = index.register(100L, LABELS.toCanonical(List.of("job=api", "env=prod"))).tsid();
        long dev = index.register(100L, LABELS.toCanonical(List.of("job=api", "env=dev"))).tsid();

        List<LabelMatcher> matchers = List.of(
            MATCHERS.toCanonicalMatcher(new Leaf("job", "=", "api")),
            MATCHERS.toCanonicalMatcher(new Not(new Leaf("env", "=~", "pro.")))
        );
        assertArrayEquals(new long[] { dev }, index.resolve(matchers, 0L, 200L));
        assertEquals(List.of("env=prod", "job=api"), LABELS.fromCanonical(index.lookupLabels(prod)));
    }
}
