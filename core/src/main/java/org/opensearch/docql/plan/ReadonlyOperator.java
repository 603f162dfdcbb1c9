/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Operators that only read data: scans, fetch, joins, filters, projections, grouping and
 * ordering. Estimates are carried when an optimizer ran.
 */
public abstract class ReadonlyOperator extends AbstractOperator {

  private OptimizerEstimates estimates;

  protected ReadonlyOperator() {
    this(OptimizerEstimates.UNAVAILABLE);
  }

  protected ReadonlyOperator(OptimizerEstimates estimates) {
    this.estimates = estimates == null ? OptimizerEstimates.UNAVAILABLE : estimates;
  }

  @Override
  public boolean isReadonly() {
    return true;
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
