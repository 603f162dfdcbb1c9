/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import org.opensearch.docql.datastore.exceptions.KeyspaceNotFoundException;

/** Entry point to live cluster metadata. Implementations must be safe for concurrent use. */
public interface Datastore {

  /**
   * Resolve a keyspace by path.
   *
   * @param path keyspace path
   * @return live keyspace
   * @throws KeyspaceNotFoundException if no keyspace exists at the path
   */
  Keyspace getKeyspace(KeyspacePath path);
}
