/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.model;

/**
 * Operator of a {@link LabelMatcher}.
 */
public enum MatchOp {
    /** Label value equals the matcher value. */
    EQL("="),
    /** Label is present with a value different from the matcher value. */
    NEQ("!="),
    /** Label value fully matches the matcher pattern. */
    EQL_REGEX("=~"),
    /** Label is present with a value that does not fully match the matcher pattern. */
    NEQ_REGEX("!~");

    private final String symbol;

    MatchOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Operator symbol in PromQL notation, e.g. {@code =~}.
     * @return the symbol
     */
    public String symbol() {
        return symbol;
    }

    /**
     * The operator selecting exactly the complement (within series carrying the label) of this one. Applied when an upstream query
     * layer wraps a matcher in a logical NOT. {@code op.invert().invert() == op}.
     *
     * @return the inverted operator
     */
    public MatchOp invert() {
        return switch (this) {
            case EQL -> NEQ;
            case NEQ -> EQL;
            case EQL_REGEX -> NEQ_REGEX;
            case NEQ_REGEX -> EQL_REGEX;
        };
    }

    /**
     * @return true for NEQ and NEQ_REGEX
     */
    public boolean isNegative() {
        return this == NEQ || this == NEQ_REGEX;
    }

    /**
     * @return true for EQL_REGEX and NEQ_REGEX
     */
    public boolean isRegex() {
        return this == EQL_REGEX || this == NEQ_REGEX;
    }

    /**
     * Parse an operator from its symbol.
     *
     * @param symbol one of {@code =}, {@code !=}, {@code =~}, {@code !~}
     * @return the operator
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static MatchOp fromSymbol(String symbol) {
        for (MatchOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown match operator: " + symbol);
    }
}
