/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds;

import java.util.Set;
import org.opensearch.docql.plan.prepared.Prepared;

/** Compiles a statement again from its text. Implemented by the statement compiler. */
@FunctionalInterface
public interface Repreparer {

  /**
   * Compile the statement of a stale plan again, with the same settings.
   *
   * @param prepared the stale plan; its text, namespace, query context and feature settings are
   *     used for compilation
   * @param deltaKeyspaces keyspaces with uncommitted transaction writes to plan for, or null
   * @return a new plan with the same name and identity, its encoded plan built
   */
  Prepared reprepare(Prepared prepared, Set<String> deltaKeyspaces);
}
