/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.model;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single label predicate. Regex patterns are compiled when the matcher is constructed and always match the whole value, so a
 * malformed pattern is rejected before any resolution starts.
 */
public final class LabelMatcher {
    private final MatchOp op;
    private final String name;
    private final String value;
    private final Pattern pattern; // null unless op.isRegex()

    private LabelMatcher(MatchOp op, String name, String value, Pattern pattern) {
        this.op = op;
        this.name = name;
        this.value = value;
        this.pattern = pattern;
    }

    /**
     * Create a matcher.
     *
     * @param op    the operator
     * @param name  the label name
     * @param value the value, or the pattern for regex operators
     * @return the matcher
     * @throws IllegalArgumentException if an argument is missing or the pattern does not compile
     */
    public static LabelMatcher of(MatchOp op, String name, String value) {
        if (op == null) {
            throw new IllegalArgumentException("Match operator cannot be null");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Matcher label name cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Matcher value cannot be null for label: " + name);
        }
        return new LabelMatcher(op, name, value, op.isRegex() ? compile(name, value) : null);
    }

    /**
     * @param name  label name
     * @param value required value
     * @return an EQL matcher
     */
    public static LabelMatcher equal(String name, String value) {
        return of(MatchOp.EQL, name, value);
    }

    /**
     * @param name  label name
     * @param value excluded value
     * @return a NEQ matcher
     */
    public static LabelMatcher notEqual(String name, String value) {
        return of(MatchOp.NEQ, name, value);
    }

    /**
     * @param name    label name
     * @param pattern regex the value must fully match
     * @return an EQL_REGEX matcher
     */
    public static LabelMatcher regex(String name, String pattern) {
        return of(MatchOp.EQL_REGEX, name, pattern);
    }

    /**
     * @param name    label name
     * @param pattern regex the value must not fully match
     * @return a NEQ_REGEX matcher
     */
    public static LabelMatcher notRegex(String name, String pattern) {
        return of(MatchOp.NEQ_REGEX, name, pattern);
    }

    private static Pattern compile(String name, String regex) {
        try {
            return Pattern.compile("^(?:" + regex + ")$");
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex for label [" + name + "]: " + regex, e);
        }
    }

    /**
     * Logical NOT of this matcher: same name and value with the inverted operator. The compiled pattern is reused.
     *
     * @return the inverted matcher
     */
    public LabelMatcher invert() {
        return new LabelMatcher(op.invert(), name, value, pattern);
    }

    /**
     * The matcher with the non-negated operator of this one, e.g. EQL for NEQ. Returns {@code this} if already positive.
     *
     * @return the positive form
     */
    public LabelMatcher positive() {
        return op.isNegative() ? invert() : this;
    }

    /**
     * Test a present label value against this matcher.
     *
     * @param labelValue value of the label on a series
     * @return true if the value satisfies the matcher
     */
    public boolean matches(String labelValue) {
        return switch (op) {
            case EQL -> value.equals(labelValue);
            case NEQ -> value.equals(labelValue) == false;
            case EQL_REGEX -> pattern.matcher(labelValue).matches();
            case NEQ_REGEX -> pattern.matcher(labelValue).matches() == false;
        };
    }

    /**
     * @return the operator
     */
    public MatchOp getOp() {
        return op;
    }

    /**
     * @return the label name
     */
    public String getName() {
        return name;
    }

    /**
     * @return the value, or the regex source for regex operators
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelMatcher other)) return false;
        return op == other.op && name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, name, value);
    }

    @Override
    public String toString() {
        return name + op.symbol() + '"' + value + '"';
    }
}
