/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

/** Optional features of an index implementation. */
public enum IndexCapability {
  /** Supports ALTER INDEX. */
  ALTER
}
