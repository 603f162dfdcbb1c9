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
public class Filter extends ReadonlyOperator {

  private Expression condition;

  public Filter() {}

  public Filter(
      Expression condition,
      OptimizerEstimates estimates) {
    super(estimates);
    this.condition = condition;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.FILTER;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Filter();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "condition", condition);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    condition = PlanJson.optExpression(node, "condition", context);
  }
}
