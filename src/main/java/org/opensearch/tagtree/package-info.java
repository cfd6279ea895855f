/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Tag tree: an in-memory series registry and inverted label index resolving label matchers to time series identifiers.
 */
package org.opensearch.tagtree;
