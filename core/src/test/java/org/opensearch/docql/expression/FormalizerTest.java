/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FormalizerTest {

  private final ExpressionParser parser = new DefaultExpressionParser();

  @Test
  void testUnqualifiedFieldIsPrefixedWithAlias() {
    Formalizer formalizer = new Formalizer("o");

    assertEquals(
        parser.parse("o.customerId = \"c1\" and o.total > $min"),
        formalizer.formalize(parser.parse("customerId = \"c1\" and total > $min")));
  }

  @Test
  void testQualifiedFieldIsKept() {
    Formalizer formalizer = new Formalizer("o");

    assertEquals(
        parser.parse("o.customerId"), formalizer.formalize(parser.parse("o.customerId")));
  }

  @Test
  void testFieldsInsideCallsAndArraysArePrefixed() {
    Formalizer formalizer = new Formalizer("d");

    assertEquals(
        parser.parse("lower(d.name) in [d.a, 1]"),
        formalizer.formalize(parser.parse("lower(name) in [a, 1]")));
  }
}
