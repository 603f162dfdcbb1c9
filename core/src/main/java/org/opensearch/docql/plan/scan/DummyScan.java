/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Produces a single empty row, for statements without a FROM clause. */
@Getter
public class DummyScan extends ReadonlyOperator {

  public DummyScan() {}

  public DummyScan(OptimizerEstimates estimates) {
    super(estimates);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.DUMMY_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitDummyScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new DummyScan();
  }

  @Override
  protected void encodeFields(ObjectNode node) {}

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {}
}
