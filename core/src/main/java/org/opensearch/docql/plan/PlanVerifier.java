/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;

/** Checks plan references against live metadata while a plan tree is walked. */
public interface PlanVerifier {

  /**
   * Check that the index still exists under the same id and name, is online, and that its
   * keyspace is still valid.
   */
  boolean verifyIndex(Index index, Keyspace keyspace);

  /** Check that the keyspace still resolves to the same id and has not changed. */
  boolean verifyKeyspace(Keyspace keyspace);
}
