/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Result of looking up the transaction variant of a prepared plan. */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class TxPreparedLookup {

  public enum Outcome {
    /** The plan does not depend on transaction state and can be used as is. */
    BASE,
    /** A variant compiled for the same delta shape exists. */
    HIT,
    /** No variant yet: compile one and register it under {@link #getHashCode()}. */
    MISS,
    /** Too many keyspaces to share variants: compile for this request only. */
    REFUSED
  }

  private final Outcome outcome;

  private final Prepared prepared;

  private final String hashCode;

  static TxPreparedLookup base(Prepared prepared) {
    return new TxPreparedLookup(Outcome.BASE, prepared, null);
  }

  static TxPreparedLookup hit(Prepared variant, String hashCode) {
    return new TxPreparedLookup(Outcome.HIT, variant, hashCode);
  }

  static TxPreparedLookup miss(String hashCode) {
    return new TxPreparedLookup(Outcome.MISS, null, hashCode);
  }

  static TxPreparedLookup refused() {
    return new TxPreparedLookup(Outcome.REFUSED, null, null);
  }

  /** True if {@link #getPrepared()} can be executed without compiling anything. */
  public boolean isUsable() {
    return outcome == Outcome.BASE || outcome == Outcome.HIT;
  }
}
