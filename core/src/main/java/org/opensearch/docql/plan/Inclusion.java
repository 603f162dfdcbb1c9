/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/** Which bounds of a range are inclusive. Encoded as a bit set: 1 for low, 2 for high. */
@Getter
@RequiredArgsConstructor
public enum Inclusion {
  NEITHER(0),
  LOW(1),
  HIGH(2),
  BOTH(3);

  private final int code;

  public boolean isLowInclusive() {
    return (code & LOW.code) != 0;
  }

  public boolean isHighInclusive() {
    return (code & HIGH.code) != 0;
  }

  public static Inclusion of(boolean lowInclusive, boolean highInclusive) {
    return fromCode((lowInclusive ? LOW.code : 0) | (highInclusive ? HIGH.code : 0));
  }

  public static Inclusion fromCode(long code) {
    for (Inclusion inclusion : values()) {
      if (inclusion.code == code) {
        return inclusion;
      }
    }
    throw new PlanDecodingException("Invalid range inclusion " + code);
  }
}
