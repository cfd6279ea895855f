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
import org.opensearch.tagtree.core.exceptions.TagTreeCorruptionException;
import org.opensearch.tagtree.core.model.LabelMatcher;
import org.opensearch.tagtree.core.series.SeriesRecord;
import org.opensearch.tagtree.core.series.SeriesRegistry;
import org.opensearch.tagtree.metrics.TagTreeMetrics;
import org.roaringbitmap.longlong.LongIterator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Resolves a conjunction of label matchers to the TSIDs of the series that satisfy every matcher and were active within a time window.
 * <p>
 * Each matcher is evaluated against the tag tree into a postings set. The sets are intersected smallest first, stopping as soon as the
 * intersection is empty; an empty matcher list selects every series. The candidates are always intersected with a snapshot of the
 * published TSIDs taken before any matcher is evaluated, so a series still being indexed by a concurrent registration is never returned.
 * <p>
 * Negative matchers select, by default, only series that carry the label. With {@code absentLabelMatchesNegation} a series without the
 * label also satisfies them.
 */
public class MatcherResolver {
    private static final Logger logger = LogManager.getLogger(MatcherResolver.class);

    private final TagTree tagTree;
    private final SeriesRegistry registry;
    private final boolean absentLabelMatchesNegation;

    /**
     * Creates a resolver.
     *
     * @param tagTree                    postings source
     * @param registry                   source of activity intervals
     * @param absentLabelMatchesNegation whether a series lacking a label satisfies negative matchers on it
     */
    public MatcherResolver(TagTree tagTree, SeriesRegistry registry, boolean absentLabelMatchesNegation) {
        this.tagTree = tagTree;
        this.registry = registry;
        this.absentLabelMatchesNegation = absentLabelMatchesNegation;
    }

    /**
     * Resolve matchers to TSIDs.
     *
     * @param matchers conjunction of matchers, empty to select every series
     * @param mint     window start, inclusive
     * @param maxt     window end, inclusive
     * @return matching TSIDs in ascending order
     * @throws IllegalArgumentException   if matchers is null or contains null, or mint &gt; maxt
     * @throws TagTreeCorruptionException if a visible TSID has no series record
     */
    public long[] resolve(List<LabelMatcher> matchers, long mint, long maxt) {
        long start = System.nanoTime();
        Postings candidates = candidates(matchers, mint, maxt);

        long[] result = new long[(int) candidates.cardinality()];
        int[] size = new int[1];
        forEachActive(candidates, mint, maxt, series -> result[size[0]++] = series.getTsid());

        TagTreeMetrics.incrementCounter(TagTreeMetrics.INDEX.resolves, 1);
        TagTreeMetrics.recordHistogram(TagTreeMetrics.INDEX.resolveLatency, (System.nanoTime() - start) / 1_000_000.0);
        TagTreeMetrics.recordHistogram(TagTreeMetrics.INDEX.resolvedSeries, size[0]);
        if (logger.isTraceEnabled()) {
            logger.trace("Resolved {} in [{}, {}] to {} of {} candidate series", matchers, mint, maxt, size[0], candidates.cardinality());
        }
        return size[0] == result.length ? result : Arrays.copyOf(result, size[0]);
    }

    /**
     * Distinct values of a label over the series selected by the matchers within the window.
     *
     * @param name     label name
     * @param matchers conjunction of matchers, empty to select every series
     * @param mint     window start, inclusive
     * @param maxt     window end, inclusive
     * @return values in lexicographic order
     */
    public List<String> labelValues(String name, List<LabelMatcher> matchers, long mint, long maxt) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Label name cannot be null or empty");
        }
        // series without the label can never contribute a value
        Postings candidates = candidates(matchers, mint, maxt).intersect(tagTree.nameUnion(name));
        TreeSet<String> values = new TreeSet<>();
        forEachActive(candidates, mint, maxt, series -> values.add(series.getLabels().get(name)));
        return new ArrayList<>(values);
    }

    private Postings candidates(List<LabelMatcher> matchers, long mint, long maxt) {
        if (matchers == null) {
            throw new IllegalArgumentException("Matchers cannot be null");
        }
        if (mint > maxt) {
            throw new IllegalArgumentException("Invalid time window: mint [" + mint + "] is after maxt [" + maxt + "]");
        }
        for (LabelMatcher matcher : matchers) {
            if (matcher == null) {
                throw new IllegalArgumentException("Matchers cannot contain null");
            }
        }

        Postings published = tagTree.allSeries();
        List<Postings> selected = new ArrayList<>(matchers.size());
        for (LabelMatcher matcher : matchers) {
            Postings postings = evaluate(matcher, published);
            if (postings.isEmpty()) {
                return Postings.empty();
            }
            selected.add(postings);
        }
        selected.sort(Comparator.comparingLong(Postings::cardinality));

        Postings result = published;
        for (Postings postings : selected) {
            result = postings.intersect(result);
            if (result.isEmpty()) {
                break;
            }
        }
        return result;
    }

    private Postings evaluate(LabelMatcher matcher, Postings published) {
        String name = matcher.getName();
        return switch (matcher.getOp()) {
            case EQL -> tagTree.lookupEQL(name, matcher.getValue());
            case EQL_REGEX -> tagTree.postingsForValues(name, matcher::matches);
            case NEQ -> absentLabelMatchesNegation
                ? published.difference(tagTree.lookupEQL(name, matcher.getValue()))
                : tagTree.nameUnionMinusValue(name, matcher.getValue());
            case NEQ_REGEX -> {
                LabelMatcher positive = matcher.positive();
                yield absentLabelMatchesNegation
                    ? published.difference(tagTree.postingsForValues(name, positive::matches))
                    : tagTree.nameUnionMinusMatching(name, positive::matches);
            }
        };
    }

    private void forEachActive(Postings candidates, long mint, long maxt, Consumer<SeriesRecord> consumer) {
        LongIterator it = candidates.iterator();
        while (it.hasNext()) {
            long tsid = it.next();
            SeriesRecord series = registry.getRecord(tsid);
            if (series == null) {
                throw new TagTreeCorruptionException("Published tsid [" + tsid + "] has no series record");
            }
            if (series.overlaps(mint, maxt)) {
                consumer.accept(series);
            }
        }
    }
}
