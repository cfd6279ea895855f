/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.utils;

/**
 * Constants used throughout the tag tree index.
 */
public class Constants {

    /**
     * Private constructor to prevent instantiation.
     */
    private Constants() {}

    /**
     * Reserved identifier that never names a series.
     */
    public static final long INVALID_TSID = 0L;

    /**
     * The first identifier handed out by an empty registry.
     */
    public static final long FIRST_TSID = 1L;

    /**
     * Default number of lock stripes in the tag tree.
     */
    public static final int DEFAULT_STRIPES = 16;

    /**
     * Upper bound for the number of lock stripes.
     */
    public static final int MAX_STRIPES = 1024;
}
