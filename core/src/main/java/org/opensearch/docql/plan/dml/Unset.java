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
public class Unset extends ReadwriteOperator {

  private List<SetTerm> unsetTerms = ImmutableList.of();

  public Unset() {}

  public Unset(
      List<SetTerm> unsetTerms,
      OptimizerEstimates estimates) {
    super(estimates);
    this.unsetTerms = ImmutableList.copyOf(unsetTerms);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.UNSET;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitUnset(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Unset();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (!unsetTerms.isEmpty()) {
      ArrayNode array = node.putArray("unset_terms");
      unsetTerms.forEach(t -> array.add(t.encode()));
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    unsetTerms =
        ImmutableList.copyOf(
            PlanJson.optObjects(node, "unset_terms", t -> SetTerm.decode(t, context)));
  }
}
