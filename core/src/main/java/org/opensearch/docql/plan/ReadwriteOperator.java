/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Operators that modify data. Estimates are carried when an optimizer ran. */
public abstract class ReadwriteOperator extends AbstractOperator {

  private OptimizerEstimates estimates;

  protected ReadwriteOperator() {
    this(OptimizerEstimates.UNAVAILABLE);
  }

  protected ReadwriteOperator(OptimizerEstimates estimates) {
    this.estimates = estimates == null ? OptimizerEstimates.UNAVAILABLE : estimates;
  }

  @Override
  public boolean isReadonly() {
    return false;
  }

  @Override
  public OptimizerEstimates getEstimates() {
    return estimates;
  }

  @Override
  public void decode(ObjectNode node, PlanDecodingContext context) {
    super.decode(node, context);
    estimates = OptimizerEstimates.readFrom(node);
  }
}
