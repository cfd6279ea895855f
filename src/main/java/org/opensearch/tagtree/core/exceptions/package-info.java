/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

/**
 * Exceptions raised by the tag tree index.
 */
package org.opensearch.tagtree.core.exceptions;
