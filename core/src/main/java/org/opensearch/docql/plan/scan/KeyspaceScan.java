/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.plan.KeyspaceTerm;

/** A scan that reads one keyspace through one of its indexes. */
public interface KeyspaceScan {

  Keyspace getKeyspace();

  KeyspaceTerm getTerm();

  Index getIndex();

  /** True if the keyspace carried uncommitted transaction writes when the scan was planned. */
  default boolean hasDeltaKeyspace() {
    return false;
  }
}
