/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.opensearch.docql.expression.Constant;
import org.opensearch.docql.expression.Parameter;

class Range2Test {

  @Test
  void testPointRange() {
    Range2 range = Range2.point(Constant.of("c1"));

    assertTrue(range.isEqualRange());
    assertTrue(range.contains("c1"));
    assertFalse(range.contains("c2"));
  }

  @Test
  void testHalfOpenRange() {
    Range2 range = new Range2(Constant.of(10L), null, Inclusion.NEITHER);

    assertFalse(range.contains(10L));
    assertTrue(range.contains(10.5));
    assertFalse(range.contains(null));
    assertTrue(range.contains("strings sort after numbers"));
  }

  @Test
  void testEmptyRange() {
    assertTrue(new Range2(Constant.of(5L), Constant.of(3L), Inclusion.BOTH).isEmpty());
    assertTrue(new Range2(Constant.of(5L), Constant.of(5L), Inclusion.LOW).isEmpty());
    assertFalse(new Range2(Constant.of(5L), Constant.of(5L), Inclusion.BOTH).isEmpty());
    assertFalse(new Range2(new Parameter("lo"), Constant.of(3L), Inclusion.BOTH).isEmpty());
  }

  @Test
  void testParameterBoundCannotBeEvaluated() {
    Range2 range = new Range2(new Parameter("lo"), null, Inclusion.LOW);

    assertFalse(range.isConstant());
    assertThrows(IllegalStateException.class, () -> range.contains(1L));
  }

  @Test
  void testSpanMatchesEveryKey() {
    Span2 span =
        new Span2(
            null,
            ImmutableList.of(
                Range2.point(Constant.of(5L)),
                new Range2(Constant.of(10L), null, Inclusion.NEITHER)),
            false);

    assertTrue(span.matches(ImmutableList.of(5L, 11L)));
    assertFalse(span.matches(ImmutableList.of(5L, 10L)));
    assertFalse(span.matches(ImmutableList.of(6L, 11L)));
    assertThrows(IllegalArgumentException.class, () -> span.matches(ImmutableList.of(5L)));
  }
}
