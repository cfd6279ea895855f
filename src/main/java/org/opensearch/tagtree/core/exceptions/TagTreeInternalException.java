/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.exceptions;

import org.opensearch.OpenSearchException;

/**
 * Exception thrown when the index cannot complete an operation for reasons unrelated to the caller's input, such as an exhausted
 * TSID counter.
 */
public class TagTreeInternalException extends OpenSearchException {

    public TagTreeInternalException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public TagTreeInternalException(String msg) {
        super(msg);
    }
}
