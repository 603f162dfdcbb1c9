/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.common.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StringUtilsTest {

  @Test
  void should_leave_plain_identifiers_alone() {
    assertEquals("customerId", StringUtils.quoteIdentifier("customerId"));
    assertEquals("_id2", StringUtils.quoteIdentifier("_id2"));
  }

  @Test
  void should_quote_identifiers_with_special_characters() {
    assertEquals("`order-date`", StringUtils.quoteIdentifier("order-date"));
    assertEquals("`a``b`", StringUtils.quoteIdentifier("a`b"));
    assertEquals("`1st`", StringUtils.quoteIdentifier("1st"));
  }

  @Test
  void should_detect_plain_identifiers() {
    assertTrue(StringUtils.isPlainIdentifier("abc"));
    assertFalse(StringUtils.isPlainIdentifier(""));
    assertFalse(StringUtils.isPlainIdentifier(null));
  }

  @Test
  void should_format_with_root_locale() {
    assertEquals("1.50", StringUtils.format("%.2f", 1.5));
  }
}
