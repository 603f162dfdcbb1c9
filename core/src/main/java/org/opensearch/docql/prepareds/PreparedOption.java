/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds;

/** Options of a prepared plan lookup. */
public enum PreparedOption {
  /** Count the lookup as a use of the statement. */
  TRACK,
  /** Check the plan is still valid, recompiling it when it is not. */
  VERIFY,
  /** Check metadata versions only; a stale plan is reported missing instead of recompiled. */
  METACHECK
}
