/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.adapter;

import org.opensearch.tagtree.core.model.LabelMatcher;

/**
 * Converts between a host engine's matcher type and {@link LabelMatcher}. Host types that express negation as a wrapper around a
 * positive matcher are converted with {@link LabelMatcher#invert()}: NOT(=) becomes !=, NOT(=~) becomes !~ and the reverse, so a
 * doubly negated host matcher converts to the original matcher.
 *
 * @param <H> the host matcher type
 */
public interface MatcherAdapter<H> {

    /**
     * @param hostMatcher host matcher
     * @return the equivalent matcher
     * @throws IllegalArgumentException if the host matcher carries a malformed regex or an unsupported operator
     */
    LabelMatcher toCanonicalMatcher(H hostMatcher);

    /**
     * @param matcher canonical matcher
     * @return the equivalent host matcher
     */
    H fromCanonicalMatcher(LabelMatcher matcher);
}
