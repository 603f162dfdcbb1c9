/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/** Index key positions an index scan returns, and whether it returns the document key. */
@Getter
@EqualsAndHashCode
public class IndexProjection {

  private final List<Integer> entryKeys;

  private final boolean primaryKey;

  public IndexProjection(List<Integer> entryKeys, boolean primaryKey) {
    this.entryKeys = ImmutableList.copyOf(entryKeys);
    this.primaryKey = primaryKey;
  }

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    if (!entryKeys.isEmpty()) {
      ArrayNode keys = node.putArray("entry_keys");
      entryKeys.forEach(keys::add);
    }
    PlanJson.putFlag(node, "primary_key", primaryKey);
    return node;
  }

  public static IndexProjection decode(ObjectNode node) {
    List<Integer> keys = new ArrayList<>();
    for (JsonNode key : PlanJson.optArray(node, "entry_keys")) {
      if (!key.isInt()) {
        throw new PlanDecodingException("index_projection.entry_keys must hold integers");
      }
      keys.add(key.intValue());
    }
    return new IndexProjection(keys, PlanJson.optBoolean(node, "primary_key"));
  }
}
