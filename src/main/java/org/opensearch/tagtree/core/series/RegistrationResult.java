/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.tagtree.core.series;

/**
 * Result of a registration.
 *
 * @param tsid    the identifier of the found or created series
 * @param created true if the label set was seen for the first time
 */
public record RegistrationResult(long tsid, boolean created) {
}
