/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Runs its children one after the other, each feeding the next. */
@Getter
public class Sequence extends ReadonlyOperator {

  private List<Operator> children = ImmutableList.of();

  public Sequence() {}

  public Sequence(
      List<Operator> children,
      OptimizerEstimates estimates) {
    super(estimates);
    this.children = ImmutableList.copyOf(children);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.SEQUENCE;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitSequence(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Sequence();
  }

  @Override
  public List<Operator> getChildren() {
    return children;
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    ArrayNode array = node.putArray("~children");
    children.forEach(c -> array.add(c.encode()));
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    children = ImmutableList.copyOf(context.decodeChildren(node, "~children"));
  }
}
