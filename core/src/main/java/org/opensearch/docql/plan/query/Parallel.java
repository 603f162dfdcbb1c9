/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

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

/** Runs copies of its child concurrently. */
@Getter
public class Parallel extends ReadonlyOperator {

  private Operator child;

  private long maxParallelism;

  public Parallel() {}

  public Parallel(
      Operator child,
      long maxParallelism,
      OptimizerEstimates estimates) {
    super(estimates);
    this.child = child;
    this.maxParallelism = maxParallelism;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.PARALLEL;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitParallel(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Parallel();
  }

  @Override
  public List<Operator> getChildren() {
    return ImmutableList.of(child);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    node.set("~child", child.encode());
    if (maxParallelism > 0) {
      node.put("maxParallelism", maxParallelism);
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    child = context.decodeChild(node, "~child");
    maxParallelism = PlanJson.optLong(node, "maxParallelism", 0);
  }
}
