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

/** Intersect scan that keeps the order of its first scan. */
@Getter
public class OrderedIntersectScan extends ReadonlyOperator {

  private List<Operator> scans = ImmutableList.of();

  private Expression limit;

  public OrderedIntersectScan() {}

  public OrderedIntersectScan(
      List<Operator> scans,
      Expression limit,
      OptimizerEstimates estimates) {
    super(estimates);
    this.scans = ImmutableList.copyOf(scans);
    this.limit = limit;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.ORDERED_INTERSECT_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitOrderedIntersectScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new OrderedIntersectScan();
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
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    scans = ImmutableList.copyOf(context.decodeChildren(node, "scans"));
    limit = PlanJson.optExpression(node, "limit", context);
  }
}
