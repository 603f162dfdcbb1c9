/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.docql.plan.ExecutionOperator;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;

/** Returns the plan of a statement instead of running it. */
@Getter
public class Explain extends ExecutionOperator {

  private Operator plan;

  private String text;

  public Explain() {}

  public Explain(
      Operator plan,
      String text) {
    this.plan = plan;
    this.text = text;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.EXPLAIN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitExplain(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Explain();
  }

  @Override
  public List<Operator> getChildren() {
    return ImmutableList.of(plan);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    node.set("plan", plan.encode());
    PlanJson.putString(node, "text", text);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    plan = context.decodeChild(node, "plan");
    text = PlanJson.optString(node, "text");
  }
}
