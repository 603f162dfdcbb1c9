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
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.ReadonlyOperator;

@Getter
public class Let extends ReadonlyOperator {

  private List<Binding> bindings = ImmutableList.of();

  public Let() {}

  public Let(
      List<Binding> bindings,
      OptimizerEstimates estimates) {
    super(estimates);
    this.bindings = ImmutableList.copyOf(bindings);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.LET;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitLet(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Let();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (!bindings.isEmpty()) {
      ArrayNode array = node.putArray("bindings");
      bindings.forEach(t -> array.add(t.encode()));
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    bindings =
        ImmutableList.copyOf(
            PlanJson.optObjects(node, "bindings", t -> Binding.decode(t, context)));
  }
}
