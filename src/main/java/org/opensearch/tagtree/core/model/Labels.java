/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.model;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Labels is a set of uniquely named name/value pairs identifying a series. Two label sets holding the same pairs are equal regardless of
 * the order the pairs were supplied in.
 */
public interface Labels {

    /**
     * Convert to key:value string format
     * @return string representation
     */
    String toKeyValueString();

    /**
     * Get a read-only map view of the labels, iterating in name order
     * @return map view
     */
    Map<String, String> toMapView();

    /**
     * Get the labels as a list sorted by name
     * @return sorted labels
     */
    List<Label> toLabelList();

    /**
     * Visit every name/value pair in name order
     * @param consumer receives name and value
     */
    void forEach(BiConsumer<String, String> consumer);

    /**
     * Check if labels are empty
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Number of labels in the set
     * @return label count
     */
    int size();

    /**
     * Get stable hash of labels
     * @return stable hash value
     */
    long stableHash();

    /**
     * Get the value for a label name
     * @param name label name
     * @return label value or empty string if not found
     */
    String get(String name);

    /**
     * Check if a label exists
     * @param name label name
     * @return true if label exists
     */
    boolean has(String name);
}
