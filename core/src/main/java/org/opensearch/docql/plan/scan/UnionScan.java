/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ArrayNode;
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

/** Union of the document keys returned by several scans. Each key is returned once. */
@Getter
public class UnionScan extends ReadonlyOperator {

  private List<Operator> scans = ImmutableList.of();

  private Expression limit;

  private Expression offset;

  public UnionScan() {}

  public UnionScan(
      List<Operator> scans,
      Expression limit,
      Expression offset,
      OptimizerEstimates estimates) {
    super(estimates);
    this.scans = ImmutableList.copyOf(scans);
    this.limit = limit;
    this.offset = offset;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.UNION_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitUnionScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new UnionScan();
  }

  @Override
  public List<Operator> getChildren() {
    return scans;
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    ArrayNode array = node.putArray("scans");
    scans.forEach(c -> array.add(c.encode()));
    PlanJson.putExpression(node, "limit", limit);
    PlanJson.putExpression(node, "offset", offset);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    scans = ImmutableList.copyOf(context.decodeChildren(node, "scans"));
    limit = PlanJson.optExpression(node, "limit", context);
    offset = PlanJson.optExpression(node, "offset", context);
  }
}
