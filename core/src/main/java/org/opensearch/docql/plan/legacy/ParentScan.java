/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.legacy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.LegacyOperator;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;

/** Scan of the parent document inside a correlated subquery. */
@Getter
public class ParentScan extends LegacyOperator {

  public ParentScan() {}

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.PARENT_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitParentScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new ParentScan();
  }

  @Override
  protected void encodeFields(ObjectNode node) {}

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {}
}
