/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Fetches documents by key (USE KEYS). */
@Getter
public class KeyScan extends ReadonlyOperator {

  private Expression keys;

  private boolean distinct;

  public KeyScan() {}

  public KeyScan(
      Expression keys,
      boolean distinct,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keys = keys;
    this.distinct = distinct;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.KEY_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitKeyScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new KeyScan();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "keys", keys);
    PlanJson.putFlag(node, "distinct", distinct);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    keys = PlanJson.optExpression(node, "keys", context);
    distinct = PlanJson.optBoolean(node, "distinct");
  }
}
