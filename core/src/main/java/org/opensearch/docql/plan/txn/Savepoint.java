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
public class Savepoint extends DdlOperator {

  private String name;

  public Savepoint() {}

  public Savepoint(String name) {
    this.name = name;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.SAVEPOINT;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitSavepoint(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Savepoint();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putString(node, "savepoint", name);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    name = PlanJson.optString(node, "savepoint");
  }
}
