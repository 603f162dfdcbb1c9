/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.txn;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.DdlOperator;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;

@Getter
public class TransactionIsolation extends DdlOperator {

  private String isolation;

  public TransactionIsolation() {}

  public TransactionIsolation(String isolation) {
    this.isolation = isolation;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.TRANSACTION_ISOLATION;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitTransactionIsolation(this, context);
  }

  @Override
  public Operator newInstance() {
    return new TransactionIsolation();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putString(node, "isolation", isolation);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    isolation = PlanJson.optString(node, "isolation");
  }
}
