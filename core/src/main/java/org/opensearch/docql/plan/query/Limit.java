/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.ReadonlyOperator;

@Getter
public class Limit extends ReadonlyOperator {

  private Expression expr;

  public Limit() {}

  public Limit(
      Expression expr,
      OptimizerEstimates estimates) {
    super(estimates);
    this.expr = expr;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.LIMIT;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Limit();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "expr", expr);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    expr = PlanJson.optExpression(node, "expr", context);
  }
}
