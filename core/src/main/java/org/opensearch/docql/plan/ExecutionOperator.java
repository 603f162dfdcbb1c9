/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

/**
 * Operators that only make sense while a statement executes, such as EXPLAIN or PREPARE.
 * Estimates are never available.
 */
public abstract class ExecutionOperator extends AbstractOperator {

  @Override
  public boolean isReadonly() {
    return true;
  }

  @Override
  public final OptimizerEstimates getEstimates() {
    return OptimizerEstimates.UNAVAILABLE;
  }
}
