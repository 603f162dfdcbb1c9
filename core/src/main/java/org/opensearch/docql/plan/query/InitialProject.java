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
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Computes the SELECT list for each row. */
@Getter
public class InitialProject extends ReadonlyOperator {

  private List<ResultTerm> resultTerms = ImmutableList.of();

  private boolean distinct;

  public InitialProject() {}

  public InitialProject(
      List<ResultTerm> resultTerms,
      boolean distinct,
      OptimizerEstimates estimates) {
    super(estimates);
    this.resultTerms = ImmutableList.copyOf(resultTerms);
    this.distinct = distinct;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INITIAL_PROJECT;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitInitialProject(this, context);
  }

  @Override
  public Operator newInstance() {
    return new InitialProject();
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    if (!resultTerms.isEmpty()) {
      ArrayNode array = node.putArray("result_terms");
      resultTerms.forEach(t -> array.add(t.encode()));
    }
    PlanJson.putFlag(node, "distinct", distinct);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    resultTerms =
        ImmutableList.copyOf(
            PlanJson.optObjects(node, "result_terms", t -> ResultTerm.decode(t, context)));
    distinct = PlanJson.optBoolean(node, "distinct");
  }
}
