/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

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

/** Scans the values of an expression in the FROM clause. */
@Getter
public class ExpressionScan extends ReadonlyOperator {

  private Expression fromExpr;

  private String alias;

  private boolean correlated;

  private Expression filter;

  public ExpressionScan() {}

  public ExpressionScan(
      Expression fromExpr,
      String alias,
      boolean correlated,
      Expression filter,
      OptimizerEstimates estimates) {
    super(estimates);
    this.fromExpr = fromExpr;
    this.alias = alias;
    this.correlated = correlated;
    this.filter = filter;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.EXPRESSION_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitExpressionScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new ExpressionScan();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "expr", fromExpr);
    PlanJson.putString(node, "alias", alias);
    PlanJson.putFlag(node, "correlated", correlated);
    PlanJson.putExpression(node, "filter", filter);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    fromExpr = PlanJson.optExpression(node, "expr", context);
    alias = PlanJson.optString(node, "alias");
    correlated = PlanJson.optBoolean(node, "correlated");
    filter = PlanJson.optExpression(node, "filter", context);
  }
}
