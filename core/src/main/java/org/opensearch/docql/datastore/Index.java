/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import java.util.List;
import org.opensearch.docql.expression.Expression;

public interface Index {

  String getId();

  String getName();

  IndexType getType();

  Indexer getIndexer();

  String getKeyspaceId();

  IndexState getState();

  /** Index key expressions, unqualified. Empty for a primary index. */
  List<Expression> getRangeKey();

  /** Partial index condition, or null when the index covers every document. */
  Expression getCondition();

  boolean isPrimary();

  default boolean supports(IndexCapability capability) {
    return false;
  }
}
