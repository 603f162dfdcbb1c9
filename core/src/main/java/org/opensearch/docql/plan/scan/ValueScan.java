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

@Getter
public class ValueScan extends ReadonlyOperator {

  private Expression values;

  public ValueScan() {}

  public ValueScan(
      Expression values,
      OptimizerEstimates estimates) {
    super(estimates);
    this.values = values;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.VALUE_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitValueScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new ValueScan();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "values", values);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    values = PlanJson.optExpression(node, "values", context);
  }
}
