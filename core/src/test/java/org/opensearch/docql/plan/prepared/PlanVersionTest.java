/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class PlanVersionTest {

  @Test
  void testCompare() {
    assertEquals(PlanVersion.BEHIND, PlanVersion.compare(0));
    assertEquals(PlanVersion.EQUAL, PlanVersion.compare(PlanVersion.CURRENT));
    assertEquals(PlanVersion.AHEAD, PlanVersion.compare(PlanVersion.CURRENT + 1));
  }
}
