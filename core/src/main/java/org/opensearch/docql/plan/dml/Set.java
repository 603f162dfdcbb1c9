/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.dml;

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
import org.opensearch.docql.plan.ReadwriteOperator;

@Getter
public class Set extends ReadwriteOperator {

  private List<SetTerm> setTerms = ImmutableList.of();

  public Set() {}

  public Set(
      List<SetTerm> setTerms,
      OptimizerEstimates estimates) {
    super(estimates);
    this.setTerms = ImmutableList.copyOf(setTerms);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.SET;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitSet(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Set();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (!setTerms.isEmpty()) {
      ArrayNode array = node.putArray("set_terms");
      setTerms.forEach(t -> array.add(t.encode()));
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    setTerms =
        ImmutableList.copyOf(
            PlanJson.optObjects(node, "set_terms", t -> SetTerm.decode(t, context)));
  }
}
