/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.IndexType;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/** Encoding of a reference to a live index inside an operator record. */
public final class IndexReference {

  public static final String INDEX_FIELD = "index";

  public static final String INDEX_ID_FIELD = "index_id";

  public static final String USING_FIELD = "using";

  private IndexReference() {}

  public static void writeTo(ObjectNode node, Index index) {
    node.put(INDEX_FIELD, index.getName());
    node.put(INDEX_ID_FIELD, index.getId());
    node.put(USING_FIELD, index.getType().getWireName());
  }

  /** Index type of the {@code using} field. Records without it refer to a GSI index. */
  public static IndexType readType(ObjectNode node) {
    String using = PlanJson.optString(node, USING_FIELD);
    if (using == null || using.isEmpty()) {
      return IndexType.GSI;
    }
    return IndexType.fromWireName(using)
        .orElseThrow(() -> new PlanDecodingException("Unknown index type " + using));
  }
}
