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

/** One projected term of a SELECT list: {@code expr AS alias}, or {@code expr.*} when starred. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ResultTerm {

  private final Expression expr;

  private final String alias;

  private final boolean star;

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    PlanJson.putExpression(node, "expr", expr);
    PlanJson.putString(node, "as", alias);
    PlanJson.putFlag(node, "star", star);
    return node;
  }

  public static ResultTerm decode(ObjectNode node, PlanDecodingContext context) {
    return new ResultTerm(
        PlanJson.optExpression(node, "expr", context),
        PlanJson.optString(node, "as"),
        PlanJson.optBoolean(node, "star"));
  }
}
