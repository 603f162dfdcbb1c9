/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import java.util.Collections;
import java.util.List;
import org.opensearch.docql.expression.Expression;

/** Index over document keys only. */
public interface PrimaryIndex extends Index {

  @Override
  default List<Expression> getRangeKey() {
    return Collections.emptyList();
  }

  @Override
  default Expression getCondition() {
    return null;
  }

  @Override
  default boolean isPrimary() {
    return true;
  }
}
