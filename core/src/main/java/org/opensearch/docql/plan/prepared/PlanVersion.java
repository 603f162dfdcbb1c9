/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

/** Position of an encoded plan's protocol version relative to {@link #CURRENT}. */
public enum PlanVersion {
  BEHIND,
  EQUAL,
  AHEAD;

  /** Protocol version written by this build. */
  public static final int CURRENT = 7;

  /**
   * Compare the version found in an encoded plan with the current one. Decoding is attempted
   * whatever the outcome; callers decide whether to trust a plan that is not {@link #EQUAL}.
   */
  public static PlanVersion compare(int encodedVersion) {
    if (encodedVersion < CURRENT) {
      return BEHIND;
    }
    return encodedVersion == CURRENT ? EQUAL : AHEAD;
  }
}
