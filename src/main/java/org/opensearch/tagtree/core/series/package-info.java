/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Series registry: assigns TSIDs to label sets and tracks each series' activity interval.
 */
package org.opensearch.tagtree.core.series;
