/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class SortTerm {

  private final Expression expr;

  private final boolean desc;

  private final boolean nullsLast;

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    PlanJson.putExpression(node, "expr", expr);
    PlanJson.putFlag(node, "desc", desc);
    PlanJson.putFlag(node, "nulls_last", nullsLast);
    return node;
  }

  public static SortTerm decode(ObjectNode node, PlanDecodingContext context) {
    Expression expr = PlanJson.optExpression(node, "expr", context);
    if (expr == null) {
      throw new PlanDecodingException("sort term has no expression");
    }
    return new SortTerm(
        expr, PlanJson.optBoolean(node, "desc"), PlanJson.optBoolean(node, "nulls_last"));
  }
}
