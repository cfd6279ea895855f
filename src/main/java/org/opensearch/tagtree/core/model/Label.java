/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.model;

/**
 * A single name/value pair attached to a series.
 *
 * @param name  the label name, never empty
 * @param value the label value, may be empty
 */
public record Label(String name, String value) implements Comparable<Label> {

    /**
     * Constructs a label, validating that the name is present.
     *
     * @param name  the label name
     * @param value the label value
     * @throws IllegalArgumentException if the name is null or empty, or the value is null
     */
    public Label {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Label name cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Label value cannot be null for name: " + name);
        }
    }

    @Override
    public int compareTo(Label o) {
        int cmp = name.compareTo(o.name);
        return cmp != 0 ? cmp : value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return name + ':' + value;
    }
}
