/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.exceptions;

/**
 * Exception thrown when the index state violates its own invariants: a visible TSID without a series record, or persisted series that
 * cannot be replayed consistently.
 */
public class TagTreeCorruptionException extends TagTreeInternalException {

    public TagTreeCorruptionException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public TagTreeCorruptionException(String msg) {
        super(msg);
    }
}
