/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

/** Index definition and transaction statements. Estimates are never available. */
public abstract class DdlOperator extends AbstractOperator {

  @Override
  public boolean isReadonly() {
    return false;
  }

  @Override
  public final OptimizerEstimates getEstimates() {
    return OptimizerEstimates.UNAVAILABLE;
  }
}
