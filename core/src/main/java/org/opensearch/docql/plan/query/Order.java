/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

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

@Getter
public class Order extends ReadonlyOperator {

  private List<SortTerm> sortTerms = ImmutableList.of();

  private Expression offset;

  private Expression limit;

  public Order() {}

  public Order(
      List<SortTerm> sortTerms,
      Expression offset,
      Expression limit,
      OptimizerEstimates estimates) {
    super(estimates);
    this.sortTerms = ImmutableList.copyOf(sortTerms);
    this.offset = offset;
    this.limit = limit;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.ORDER;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitOrder(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Order();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (!sortTerms.isEmpty()) {
      ArrayNode array = node.putArray("sort_terms");
      sortTerms.forEach(t -> array.add(t.encode()));
    }
    PlanJson.putExpression(node, "offset", offset);
    PlanJson.putExpression(node, "limit", limit);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    sortTerms =
        ImmutableList.copyOf(
            PlanJson.optObjects(node, "sort_terms", t -> SortTerm.decode(t, context)));
    offset = PlanJson.optExpression(node, "offset", context);
    limit = PlanJson.optExpression(node, "limit", context);
  }
}
