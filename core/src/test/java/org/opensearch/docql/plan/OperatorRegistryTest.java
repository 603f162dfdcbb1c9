/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

class OperatorRegistryTest {

  private final OperatorRegistry registry = new OperatorRegistry();

  @Test
  void testEveryOperatorTypeIsRegistered() {
    for (OperatorType type : OperatorType.values()) {
      assertTrue(registry.isRegistered(type.getWireName()), type.name());
      Operator operator = registry.newInstance(type.getWireName());
      assertEquals(type, operator.getOperatorType());
      assertEquals(type, operator.newInstance().getOperatorType());
    }
  }

  @Test
  void testNewInstanceIsFreshEachTime() {
    assertNotSame(registry.newInstance("Filter"), registry.newInstance("Filter"));
  }

  @Test
  void testUnknownTagIsRejected() {
    assertFalse(registry.isRegistered("Teleport"));
    assertNull(OperatorType.fromWireName("Teleport"));
    PlanDecodingException e =
        assertThrows(PlanDecodingException.class, () -> registry.newInstance("Teleport"));
    assertEquals("Unknown operator Teleport", e.getMessage());
  }

  @Test
  void testReadonlyClassification() {
    assertTrue(registry.newInstance("IndexScan3").isReadonly());
    assertTrue(registry.newInstance("HashJoin").isReadonly());
    assertFalse(registry.newInstance("SendInsert").isReadonly());
    assertFalse(registry.newInstance("CreateIndex").isReadonly());
  }
}
