/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.dml;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/** A path assigned by UPDATE ... SET, or removed by UNSET when the value is null. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class SetTerm {

  private final Expression path;

  private final Expression value;

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    PlanJson.putExpression(node, "path", path);
    PlanJson.putExpression(node, "value", value);
    return node;
  }

  public static SetTerm decode(ObjectNode node, PlanDecodingContext context) {
    Expression path = PlanJson.optExpression(node, "path", context);
    if (path == null) {
      throw new PlanDecodingException("set term has no path");
    }
    return new SetTerm(path, PlanJson.optExpression(node, "value", context));
  }
}
