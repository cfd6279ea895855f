/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.tagtree.core.model;

import org.opensearch.test.OpenSearchTestCase;

public class MatchOpTests extends OpenSearchTestCase {

    public void testInvert() {
        assertEquals(MatchOp.NEQ, MatchOp.EQL.invert());
        assertEquals(MatchOp.EQL, MatchOp.NEQ.invert());
        assertEquals(MatchOp.NEQ_REGEX, MatchOp.EQL_REGEX.invert());
        assertEquals(MatchOp.EQL_REGEX, MatchOp.NEQ_REGEX.invert());
        for (MatchOp op : MatchOp.values()) {
            assertEquals(op, op.invert().invert());
            assertNotEquals(op.isNegative(), op.invert().isNegative());
            assertEquals(op.isRegex(), op.invert().isRegex());
        }
    }

    public void testSymbols() {
        for (MatchOp op : MatchOp.values()) {
            assertEquals(op, MatchOp.fromSymbol(op.symbol()));
        }
        assertEquals("=~", MatchOp.EQL_REGEX.symbol());
        expectThrows(IllegalArgumentException.class, () -> MatchOp.fromSymbol("=="));
    }
}
