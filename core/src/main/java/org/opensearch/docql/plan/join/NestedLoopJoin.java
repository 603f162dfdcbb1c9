/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.join;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
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
public class NestedLoopJoin extends ReadonlyOperator {

  private Expression onclause;

  private String alias;

  private boolean outer;

  private Operator child;

  public NestedLoopJoin() {}

  public NestedLoopJoin(
      Expression onclause,
      String alias,
      boolean outer,
      Operator child,
      OptimizerEstimates estimates) {
    super(estimates);
    this.onclause = onclause;
    this.alias = alias;
    this.outer = outer;
    this.child = child;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.NESTED_LOOP_JOIN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitNestedLoopJoin(this, context);
  }

  @Override
  public Operator newInstance() {
    return new NestedLoopJoin();
  }

  @Override
  public List<Operator> getChildren() {
    return ImmutableList.of(child);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "on_clause", onclause);
    PlanJson.putString(node, "alias", alias);
    PlanJson.putFlag(node, "outer", outer);
    node.set("~child", child.encode());
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    onclause = PlanJson.optExpression(node, "on_clause", context);
    alias = PlanJson.optString(node, "alias");
    outer = PlanJson.optBoolean(node, "outer");
    child = context.decodeChild(node, "~child");
  }
}
