/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

/**
 * Scan kinds kept so that plans encoded by older versions still decode. Estimates are never
 * available.
 */
public abstract class LegacyOperator extends AbstractOperator {

  @Override
  public boolean isReadonly() {
    return true;
  }

  @Override
  public final OptimizerEstimates getEstimates() {
    return OptimizerEstimates.UNAVAILABLE;
  }
}
