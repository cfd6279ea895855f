/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.tagtree.core.model;

import org.opensearch.test.OpenSearchTestCase;

public class LabelMatcherTests extends OpenSearchTestCase {

    public void testEqualityMatchers() {
        LabelMatcher eq = LabelMatcher.equal("env", "prod");
        assertTrue(eq.matches("prod"));
        assertFalse(eq.matches("production"));

        LabelMatcher neq = LabelMatcher.notEqual("env", "prod");
        assertFalse(neq.matches("prod"));
        assertTrue(neq.matches("dev"));
    }

    public void testRegexIsFullyAnchored() {
        LabelMatcher regex = LabelMatcher.regex("env", "pro.");
        assertTrue(regex.matches("prod"));
        assertFalse(regex.matches("production"));
        assertFalse(regex.matches("xprod"));

        LabelMatcher alternation = LabelMatcher.regex("env", "dev|prod");
        assertTrue(alternation.matches("dev"));
        assertTrue(alternation.matches("prod"));
        assertFalse(alternation.matches("devprod"));

        LabelMatcher notRegex = LabelMatcher.notRegex("env", "pro.");
        assertFalse(notRegex.matches("prod"));
        assertTrue(notRegex.matches("production"));
    }

    public void testMalformedRegexRejected() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class, () -> LabelMatcher.regex("env", "pro("));
        assertTrue(e.getMessage().contains("env"));
        expectThrows(IllegalArgumentException.class, () -> LabelMatcher.notRegex("env", "[a-"));
    }

    public void testInvalidArguments() {
        expectThrows(IllegalArgumentException.class, () -> LabelMatcher.of(null, "env", "prod"));
        expectThrows(IllegalArgumentException.class, () -> LabelMatcher.equal("", "prod"));
        expectThrows(IllegalArgumentException.class, () -> LabelMatcher.equal(null, "prod"));
        expectThrows(IllegalArgumentException.class, () -> LabelMatcher.equal("env", null));
    }

    public void testDoubleInversionIsIdentity() {
        for (MatchOp op : MatchOp.values()) {
            LabelMatcher matcher = LabelMatcher.of(op, "env", "pro.");
            LabelMatcher inverted = matcher.invert();
            assertEquals(op.invert(), inverted.getOp());
            assertEquals("env", inverted.getName());
            assertEquals("pro.", inverted.getValue());
            assertEquals(matcher, inverted.invert());
            assertEquals(matcher.hashCode(), inverted.invert().hashCode());
        }
    }

    public void testInversionNegatesMatches() {
        String[] values = { "prod", "dev", "production", "" };
        for (MatchOp op : MatchOp.values()) {
            LabelMatcher matcher = LabelMatcher.of(op, "env", "pro.");
            for (String value : values) {
                assertNotEquals(matcher.matches(value), matcher.invert().matches(value));
            }
        }
    }

    public void testPositive() {
        LabelMatcher eq = LabelMatcher.equal("env", "prod");
        assertSame(eq, eq.positive());
        assertEquals(eq, LabelMatcher.notEqual("env", "prod").positive());
        assertEquals(LabelMatcher.regex("env", "p.*"), LabelMatcher.notRegex("env", "p.*").positive());
    }

    public void testToString() {
        assertEquals("env=~\"pro.\"", LabelMatcher.regex("env", "pro.").toString());
        assertEquals("env!=\"prod\"", LabelMatcher.notEqual("env", "prod").toString());
    }
}
