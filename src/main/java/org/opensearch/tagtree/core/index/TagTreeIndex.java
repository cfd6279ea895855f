/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;
import org.opensearch.tagtree.TagTreeSettings;
import org.opensearch.tagtree.core.model.ByteLabels;
import org.opensearch.tagtree.core.model.LabelMatcher;
import org.opensearch.tagtree.core.model.Labels;
import org.opensearch.tagtree.core.series.RegistrationResult;
import org.opensearch.tagtree.core.series.SeriesEventListener;
import org.opensearch.tagtree.core.series.SeriesRegistry;
import org.opensearch.tagtree.core.series.SeriesStore;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * TagTreeIndex is the entry point for callers: it owns the {@link SeriesRegistry}, the {@link TagTree} and the {@link MatcherResolver}
 * and wires them together from {@link TagTreeSettings}. All methods are safe to call concurrently.
 */
public class TagTreeIndex {
    private static final Logger logger = LogManager.getLogger(TagTreeIndex.class);

    private final TagTree tagTree;
    private final SeriesRegistry registry;
    private final MatcherResolver resolver;

    /**
     * Creates an index with default settings.
     */
    public TagTreeIndex() {
        this(Settings.EMPTY);
    }

    /**
     * Creates an index.
     *
     * @param settings node settings, see {@link TagTreeSettings}
     */
    public TagTreeIndex(Settings settings) {
        this(settings, SeriesEventListener.NOOP);
    }

    /**
     * Creates an index.
     *
     * @param settings node settings, see {@link TagTreeSettings}
     * @param listener notified for every created series
     */
    public TagTreeIndex(Settings settings, SeriesEventListener listener) {
        int stripes = TagTreeSettings.INDEX_STRIPES.get(settings);
        boolean absentLabelMatchesNegation = TagTreeSettings.ABSENT_LABEL_MATCHES_NEGATION.get(settings);
        this.tagTree = new TagTree(stripes);
        this.registry = new SeriesRegistry(tagTree, TagTreeSettings.MAX_LABEL_PAIRS.get(settings), listener);
        this.resolver = new MatcherResolver(tagTree, registry, absentLabelMatchesNegation);
        logger.info("Created tag tree index with {} stripes, absent_label_matches_negation={}", stripes, absentLabelMatchesNegation);
    }

    /**
     * Register a series observed at a timestamp.
     *
     * @param timestamp observation timestamp
     * @param labels    series labels
     * @return the TSID and whether the series was created
     * @see SeriesRegistry#register(long, Labels)
     */
    public RegistrationResult register(long timestamp, Labels labels) {
        return registry.register(timestamp, labels);
    }

    /**
     * Register a series given as alternating label names and values.
     *
     * @param timestamp      observation timestamp
     * @param nameValuePairs e.g. "job", "api", "env", "prod"
     * @return the TSID and whether the series was created
     * @throws IllegalArgumentException if the list is odd, empty, or repeats a name
     */
    public RegistrationResult register(long timestamp, String... nameValuePairs) {
        return registry.register(timestamp, ByteLabels.fromStrings(nameValuePairs));
    }

    /**
     * @param tsid series identifier
     * @return the series labels
     * @see SeriesRegistry#lookupLabels(long)
     */
    public Labels lookupLabels(long tsid) {
        return registry.lookupLabels(tsid);
    }

    /**
     * @param labels series labels
     * @return the TSID of the label set, or empty if it was never registered
     */
    public Optional<Long> lookupSeries(Labels labels) {
        return registry.lookupSeries(labels);
    }

    /**
     * @param matchers conjunction of matchers, empty to select every series
     * @param mint     window start, inclusive
     * @param maxt     window end, inclusive
     * @return matching TSIDs in ascending order
     * @see MatcherResolver#resolve(List, long, long)
     */
    public long[] resolve(List<LabelMatcher> matchers, long mint, long maxt) {
        return resolver.resolve(matchers, mint, maxt);
    }

    /**
     * @return every label name ever registered, sorted
     */
    public List<String> labelNames() {
        return tagTree.labelNames();
    }

    /**
     * @param name     label name
     * @param matchers conjunction of matchers, empty to select every series
     * @param mint     window start, inclusive
     * @param maxt     window end, inclusive
     * @return sorted values of the label over matching series
     */
    public List<String> labelValues(String name, List<LabelMatcher> matchers, long mint, long maxt) {
        return resolver.labelValues(name, matchers, mint, maxt);
    }

    /**
     * Restore persisted series before serving traffic.
     *
     * @param store persisted series
     * @return number of recovered series
     * @throws IOException if the store cannot be read
     * @see SeriesRegistry#recover(SeriesStore)
     */
    public int recover(SeriesStore store) throws IOException {
        return registry.recover(store);
    }

    /**
     * @return number of registered series
     */
    public int getNumSeries() {
        return registry.getNumSeries();
    }

    /**
     * @return the underlying registry
     */
    public SeriesRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the underlying tag tree
     */
    public TagTree getTagTree() {
        return tagTree;
    }
}
