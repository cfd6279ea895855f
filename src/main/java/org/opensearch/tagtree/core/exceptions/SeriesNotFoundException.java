/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.exceptions;

import org.opensearch.ResourceNotFoundException;

/**
 * Thrown when a TSID does not name a registered series.
 */
public class SeriesNotFoundException extends ResourceNotFoundException {

    public SeriesNotFoundException(long tsid) {
        super("No series registered for tsid [{}]", tsid);
    }
}
