/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.txn;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.DdlOperator;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;

@Getter
public class StartTransaction extends DdlOperator {

  private JsonNode options;

  public StartTransaction() {}

  public StartTransaction(JsonNode options) {
    this.options = options;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.START_TRANSACTION;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitStartTransaction(this, context);
  }

  @Override
  public Operator newInstance() {
    return new StartTransaction();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (options != null) {
      node.set("options", options.deepCopy());
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    options = PlanJson.optValue(node, "options");
  }
}
