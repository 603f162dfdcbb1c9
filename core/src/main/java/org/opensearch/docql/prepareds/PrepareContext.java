/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds;

import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.docql.plan.prepared.Prepared;

/** Settings a statement is prepared under. Two plans of one text differ by these. */
@Data
@AllArgsConstructor
public class PrepareContext {

  private int indexApiVersion;

  private long featureControls;

  private boolean useFts;

  private boolean useCbo;

  private String queryContext;

  /** Keyspaces with uncommitted writes in the current transaction, or null outside of one. */
  private Set<String> deltaKeyspaces;

  /** True if the plan was prepared under these settings. */
  public boolean matches(Prepared prepared) {
    return prepared.getIndexApiVersion() == indexApiVersion
        && prepared.getFeatureControls() == featureControls
        && prepared.isUseFts() == useFts
        && prepared.isUseCbo() == useCbo;
  }
}
