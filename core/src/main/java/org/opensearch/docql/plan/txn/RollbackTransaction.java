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

/** Rolls back the transaction, or only to the savepoint when one is named. */
@Getter
public class RollbackTransaction extends DdlOperator {

  private String savepoint;

  public RollbackTransaction() {}

  public RollbackTransaction(String savepoint) {
    this.savepoint = savepoint;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.ROLLBACK_TRANSACTION;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitRollbackTransaction(this, context);
  }

  @Override
  public Operator newInstance() {
    return new RollbackTransaction();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putString(node, "savepoint", savepoint);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    savepoint = PlanJson.optString(node, "savepoint");
  }
}
