/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.join;

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
public class HashNest extends ReadonlyOperator {

  private Expression onclause;

  private List<Expression> buildExprs = ImmutableList.of();

  private List<Expression> probeExprs = ImmutableList.of();

  private List<String> buildAliases = ImmutableList.of();

  private boolean outer;

  private Operator child;

  public HashNest() {}

  public HashNest(
      Expression onclause,
      List<Expression> buildExprs,
      List<Expression> probeExprs,
      List<String> buildAliases,
      boolean outer,
      Operator child,
      OptimizerEstimates estimates) {
    super(estimates);
    this.onclause = onclause;
    this.buildExprs = ImmutableList.copyOf(buildExprs);
    this.probeExprs = ImmutableList.copyOf(probeExprs);
    this.buildAliases = ImmutableList.copyOf(buildAliases);
    this.outer = outer;
    this.child = child;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.HASH_NEST;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitHashNest(this, context);
  }

  @Override
  public Operator newInstance() {
    return new HashNest();
  }

  @Override
  public List<Operator> getChildren() {
    return ImmutableList.of(child);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    PlanJson.putExpression(node, "on_clause", onclause);
    PlanJson.putExpressions(node, "build_exprs", buildExprs);
    PlanJson.putExpressions(node, "probe_exprs", probeExprs);
    PlanJson.putStrings(node, "build_aliases", buildAliases);
    PlanJson.putFlag(node, "outer", outer);
    node.set("~child", child.encode());
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    onclause = PlanJson.optExpression(node, "on_clause", context);
    buildExprs = ImmutableList.copyOf(PlanJson.optExpressions(node, "build_exprs", context));
    probeExprs = ImmutableList.copyOf(PlanJson.optExpressions(node, "probe_exprs", context));
    buildAliases = ImmutableList.copyOf(PlanJson.optStrings(node, "build_aliases"));
    outer = PlanJson.optBoolean(node, "outer");
    child = context.decodeChild(node, "~child");
  }
}
