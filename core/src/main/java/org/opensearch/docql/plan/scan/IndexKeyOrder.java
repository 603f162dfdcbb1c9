/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.plan.PlanJson;

/** Ordering an index scan delivers on one of its keys. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class IndexKeyOrder {

  private final int keyPos;

  private final boolean desc;

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    node.put("keypos", keyPos);
    PlanJson.putFlag(node, "desc", desc);
    return node;
  }

  public static IndexKeyOrder decode(ObjectNode node) {
    return new IndexKeyOrder(
        (int) PlanJson.optLong(node, "keypos", 0), PlanJson.optBoolean(node, "desc"));
  }
}
