/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree;

import org.opensearch.common.settings.Setting;
import org.opensearch.tagtree.core.utils.Constants;

import java.util.List;

/**
 * Settings of the tag tree index.
 */
public final class TagTreeSettings {

    private static final String INDEX_STRIPES_KEY = "tagtree.index.stripes";

    private TagTreeSettings() {}

    /**
     * Number of lock stripes the tag tree partitions label names into. Must be a power of two.
     */
    public static final Setting<Integer> INDEX_STRIPES = new Setting<>(
        INDEX_STRIPES_KEY,
        Integer.toString(Constants.DEFAULT_STRIPES),
        TagTreeSettings::parseStripes,
        Setting.Property.NodeScope
    );

    /**
     * When true, a series that lacks a label satisfies negative matchers (!=, !~) on that label. When false, negative matchers only
     * select series that carry the label.
     */
    public static final Setting<Boolean> ABSENT_LABEL_MATCHES_NEGATION = Setting.boolSetting(
        "tagtree.resolver.absent_label_matches_negation",
        false,
        Setting.Property.NodeScope
    );

    /**
     * Maximum number of labels a series may carry, 0 for no limit.
     */
    public static final Setting<Integer> MAX_LABEL_PAIRS = Setting.intSetting(
        "tagtree.registry.max_label_pairs",
        0,
        0,
        Setting.Property.NodeScope
    );

    /**
     * @return every setting declared here
     */
    public static List<Setting<?>> getSettings() {
        return List.of(INDEX_STRIPES, ABSENT_LABEL_MATCHES_NEGATION, MAX_LABEL_PAIRS);
    }

    private static int parseStripes(String value) {
        int stripes = Setting.parseInt(value, 1, Constants.MAX_STRIPES, INDEX_STRIPES_KEY);
        if (Integer.bitCount(stripes) != 1) {
            throw new IllegalArgumentException(
                "Failed to parse value [" + value + "] for setting [" + INDEX_STRIPES_KEY + "], must be a power of two"
            );
        }
        return stripes;
    }
}
