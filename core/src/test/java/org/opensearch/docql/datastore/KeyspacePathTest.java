/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class KeyspacePathTest {

  @Test
  void testDefaultCollectionName() {
    KeyspacePath path = KeyspacePath.of("default", "orders");

    assertFalse(path.isCollection());
    assertEquals("default:orders", path.getFullName());
  }

  @Test
  void testNamedCollectionName() {
    KeyspacePath path = KeyspacePath.of("default", "shop", "sales", "orders");

    assertTrue(path.isCollection());
    assertEquals("default:shop.sales.orders", path.getFullName());
  }

  @Test
  void testEmptyBucketAndScopeMeanDefaultCollection() {
    KeyspacePath path = KeyspacePath.of("default", "", "", "orders");

    assertNull(path.getBucket());
    assertEquals(KeyspacePath.of("default", "orders"), path);
  }

  @Test
  void testBucketWithoutScopeIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> KeyspacePath.of("default", "shop", null, "orders"));
    assertThrows(IllegalArgumentException.class, () -> KeyspacePath.of("default", null));
  }
}
