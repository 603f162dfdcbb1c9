/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.docql.expression.Expression;

/** Bit filter on the keys of one index: the expressions whose values are hashed into it. */
@Getter
@ToString
@EqualsAndHashCode
public class BitFilterIndex {

  private final String indexName;

  private final String indexId;

  private final List<Expression> expressions;

  public BitFilterIndex(String indexName, String indexId, List<Expression> expressions) {
    this.indexName = indexName;
    this.indexId = indexId;
    this.expressions = ImmutableList.copyOf(expressions);
  }

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    node.put("index_name", indexName);
    node.put("index_id", indexId);
    PlanJson.putExpressions(node, "expressions", expressions);
    return node;
  }

  public static BitFilterIndex decode(ObjectNode node, PlanDecodingContext context) {
    return new BitFilterIndex(
        PlanJson.requireString(node, "index_name"),
        PlanJson.requireString(node, "index_id"),
        PlanJson.optExpressions(node, "expressions", context));
  }
}
