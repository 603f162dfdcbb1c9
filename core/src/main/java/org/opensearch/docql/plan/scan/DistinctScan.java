/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Removes duplicate document keys produced by a multi-span scan. */
@Getter
public class DistinctScan extends ReadonlyOperator {

  private Operator scan;

  private Expression limit;

  private Expression offset;

  public DistinctScan() {}

  public DistinctScan(
      Operator scan,
      Expression limit,
      Expression offset,
      OptimizerEstimates estimates) {
    super(estimates);
    this.scan = scan;
    this.limit = limit;
    this.offset = offset;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.DISTINCT_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitDistinctScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new DistinctScan();
  }

  @Override
  public List<Operator> getChildren() {
    return ImmutableList.of(scan);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    node.set("scan", scan.encode());
    PlanJson.putExpression(node, "limit", limit);
    PlanJson.putExpression(node, "offset", offset);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    scan = context.decodeChild(node, "scan");
    limit = PlanJson.optExpression(node, "limit", context);
    offset = PlanJson.optExpression(node, "offset", context);
  }
}
