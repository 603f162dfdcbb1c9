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

/** Flattens an array of each row into one row per element. */
@Getter
public class Unnest extends ReadonlyOperator {

  private Expression expr;

  private String alias;

  private boolean outer;

  public Unnest() {}

  public Unnest(
      Expression expr,
      String alias,
      boolean outer,
      OptimizerEstimates estimates) {
    super(estimates);
    this.expr = expr;
    this.alias = alias;
    this.outer = outer;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.UNNEST;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitUnnest(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Unnest();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "expr", expr);
    PlanJson.putString(node, "as", alias);
    PlanJson.putFlag(node, "outer", outer);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    expr = PlanJson.optExpression(node, "expr", context);
    alias = PlanJson.optString(node, "as");
    outer = PlanJson.optBoolean(node, "outer");
  }
}
