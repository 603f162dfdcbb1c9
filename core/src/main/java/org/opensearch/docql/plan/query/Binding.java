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

/** A LET variable and the expression it is bound to. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Binding {

  private final String variable;

  private final Expression expr;

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    node.put("var", variable);
    PlanJson.putExpression(node, "expr", expr);
    return node;
  }

  public static Binding decode(ObjectNode node, PlanDecodingContext context) {
    return new Binding(
        PlanJson.requireString(node, "var"), PlanJson.optExpression(node, "expr", context));
  }
}
