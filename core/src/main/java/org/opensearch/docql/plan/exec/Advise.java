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

@Getter
public class Advise extends ExecutionOperator {

  private Operator plan;

  private String text;

  public Advise() {}

  public Advise(
      Operator plan,
      String text) {
    this.plan = plan;
    this.text = text;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.ADVISE;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitAdvise(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Advise();
  }

  @Override
  public List<Operator> getChildren() {
    return ImmutableList.of(plan);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    node.set("~child", plan.encode());
    PlanJson.putString(node, "text", text);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    plan = context.decodeChild(node, "~child");
    text = PlanJson.optString(node, "text");
  }
}
