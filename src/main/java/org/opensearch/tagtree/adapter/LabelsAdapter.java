/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.adapter;

import org.opensearch.tagtree.core.model.Labels;

/**
 * Converts between a host engine's label-set type and the canonical {@link Labels}.
 *
 * @param <H> the host label-set type
 */
public interface LabelsAdapter<H> {

    /**
     * @param hostLabels host label set
     * @return the canonical labels
     * @throws IllegalArgumentException if the host label set repeats a name or has an empty name
     */
    Labels toCanonical(H hostLabels);

    /**
     * @param labels canonical labels
     * @return the host label set
     */
    H fromCanonical(Labels labels);
}
