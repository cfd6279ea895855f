/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree;

import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

public class TagTreeSettingsTests extends OpenSearchTestCase {

    public void testDefaults() {
        assertEquals(16, (int) TagTreeSettings.INDEX_STRIPES.get(Settings.EMPTY));
        assertFalse(TagTreeSettings.ABSENT_LABEL_MATCHES_NEGATION.get(Settings.EMPTY));
        assertEquals(0, (int) TagTreeSettings.MAX_LABEL_PAIRS.get(Settings.EMPTY));
        assertEquals(3, TagTreeSettings.getSettings().size());
    }

    public void testStripes() {
        assertEquals(64, (int) TagTreeSettings.INDEX_STRIPES.get(Settings.builder().put("tagtree.index.stripes", 64).build()));
        assertEquals(1, (int) TagTreeSettings.INDEX_STRIPES.get(Settings.builder().put("tagtree.index.stripes", 1).build()));
        expectThrows(
            IllegalArgumentException.class,
            () -> TagTreeSettings.INDEX_STRIPES.get(Settings.builder().put("tagtree.index.stripes", 12).build())
        );
        expectThrows(
            IllegalArgumentException.class,
            () -> TagTreeSettings.INDEX_STRIPES.get(Settings.builder().put("tagtree.index.stripes", 0).build())
        );
        expectThrows(
            IllegalArgumentException.class,
            () -> TagTreeSettings.INDEX_STRIPES.get(Settings.builder().put("tagtree.index.stripes", 2048).build())
        );
    }

    public void testMaxLabelPairs() {
        assertEquals(8, (int) TagTreeSettings.MAX_LABEL_PAIRS.get(Settings.builder().put("tagtree.registry.max_label_pairs", 8).build()));
        expectThrows(
            IllegalArgumentException.class,
            () -> TagTreeSettings.MAX_LABEL_PAIRS.get(Settings.builder().put("tagtree.registry.max_label_pairs", -1).build())
        );
    }
}
