/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.plan.ExecutionOperator;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;

/** Returns the prepared form of a statement. */
@Getter
public class Prepare extends ExecutionOperator {

  private JsonNode prepared;

  private String text;

  private boolean force;

  public Prepare() {}

  public Prepare(
      JsonNode prepared,
      String text,
      boolean force) {
    this.prepared = prepared;
    this.text = text;
    this.force = force;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.PREPARE;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitPrepare(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Prepare();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (prepared != null) {
      node.set("prepared", prepared.deepCopy());
    }
    PlanJson.putString(node, "text", text);
    PlanJson.putFlag(node, "force", force);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    prepared = PlanJson.optValue(node, "prepared");
    text = PlanJson.optString(node, "text");
    force = PlanJson.optBoolean(node, "force");
  }
}
