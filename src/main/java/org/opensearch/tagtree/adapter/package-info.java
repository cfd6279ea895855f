/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Seams through which a host query engine plugs its own label and matcher types into the index.
 */
package org.opensearch.tagtree.adapter;
