/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

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
public class IntermediateGroup extends ReadonlyOperator {

  private List<Expression> groupKeys = ImmutableList.of();

  private List<Expression> aggregates = ImmutableList.of();

  public IntermediateGroup() {}

  public IntermediateGroup(
      List<Expression> groupKeys,
      List<Expression> aggregates,
      OptimizerEstimates estimates) {
    super(estimates);
    this.groupKeys = ImmutableList.copyOf(groupKeys);
    this.aggregates = ImmutableList.copyOf(aggregates);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INTERMEDIATE_GROUP;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitIntermediateGroup(this, context);
  }

  @Override
  public Operator newInstance() {
    return new IntermediateGroup();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpressions(node, "group_keys", groupKeys);
    PlanJson.putExpressions(node, "aggregates", aggregates);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    groupKeys = ImmutableList.copyOf(PlanJson.optExpressions(node, "group_keys", context));
    aggregates = ImmutableList.copyOf(PlanJson.optExpressions(node, "aggregates", context));
  }
}
