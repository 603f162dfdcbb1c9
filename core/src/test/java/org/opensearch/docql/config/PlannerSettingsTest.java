/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PlannerSettingsTest {

  @Test
  void testLoadFromClasspath() {
    PlannerSettings settings = PlannerSettings.load();

    assertEquals(16384, settings.getPreparedCacheLimit());
    assertEquals(2, settings.getMaxTxPreparedKeyspaces());
    assertEquals(16, settings.getMaxTxPreparedVariants());
    assertEquals(1024, settings.getMaxSpans());
    assertEquals(3, settings.getIndexApiVersion());
  }

  @Test
  void testLoadKeepsDefaultsOfMissingSettings() throws IOException {
    PlannerSettings settings =
        PlannerSettings.load(stream("{\"preparedCacheLimit\": 10, \"futureSetting\": true}"));

    assertEquals(10, settings.getPreparedCacheLimit());
    assertEquals(2, settings.getMaxTxPreparedKeyspaces());
    assertEquals(1024, settings.getMaxSpans());
  }

  @Test
  void testLoadRejectsUnusableLimits() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> PlannerSettings.load(stream("{\"preparedCacheLimit\": 0}")));
    assertEquals("preparedCacheLimit must be positive", e.getMessage());
  }

  @Test
  void testValidate() {
    PlannerSettings settings = new PlannerSettings();
    settings.setMaxTxPreparedVariants(0);
    settings.validate();

    settings.setMaxSpans(-1);
    assertThrows(IllegalArgumentException.class, settings::validate);
  }

  private static InputStream stream(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }
}
