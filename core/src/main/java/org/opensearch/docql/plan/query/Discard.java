/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Drops every row, for statements that return nothing. */
@Getter
public class Discard extends ReadonlyOperator {

  public Discard() {}

  public Discard(OptimizerEstimates estimates) {
    super(estimates);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.DISCARD;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitDiscard(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Discard();
  }

  @Override
  protected void encodeFields(ObjectNode node) {}

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {}
}
