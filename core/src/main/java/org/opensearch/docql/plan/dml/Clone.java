/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.dml;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.ReadwriteOperator;

/** Copies each row before an UPDATE modifies it. */
@Getter
public class Clone extends ReadwriteOperator {

  private String alias;

  public Clone() {}

  public Clone(
      String alias,
      OptimizerEstimates estimates) {
    super(estimates);
    this.alias = alias;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.CLONE;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitClone(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Clone();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putString(node, "alias", alias);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    alias = PlanJson.optString(node, "alias");
  }
}
