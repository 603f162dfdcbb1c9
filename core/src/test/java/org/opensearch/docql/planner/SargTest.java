/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.opensearch.docql.expression.Constant;
import org.opensearch.docql.expression.DefaultExpressionParser;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.expression.ExpressionParser;
import org.opensearch.docql.expression.NnfNormalizer;
import org.opensearch.docql.expression.Parameter;
import org.opensearch.docql.plan.Inclusion;
import org.opensearch.docql.plan.Range2;
import org.opensearch.docql.plan.Span2;

class SargTest {

  private final ExpressionParser parser = new DefaultExpressionParser();

  private final NnfNormalizer normalizer = new NnfNormalizer();

  @Test
  void testComparisonRanges() {
    assertEquals(
        ImmutableList.of(new Range2(Constant.NULL, Constant.of(5L), Inclusion.HIGH)),
        ranges("a", "a <= 5"));
    assertEquals(
        ImmutableList.of(new Range2(Constant.of(5L), null, Inclusion.NEITHER)),
        ranges("a", "a > 5"));
    assertNull(ranges("a", "a != 5"));
    assertNull(ranges("a", "b = 5"));
    assertNull(ranges("a", "a = b"));
  }

  @Test
  void testUpperBoundedRangeStartsAboveNull() {
    Span2 span = new Span2(ImmutableList.of(), ranges("a", "a < 5"), true);

    assertFalse(span.matches(Collections.singletonList(null)));
    assertTrue(span.matches(ImmutableList.of(false)));
    assertTrue(span.matches(ImmutableList.of(true)));
    assertTrue(span.matches(ImmutableList.of(-3L)));
    assertTrue(span.matches(ImmutableList.of(4.5)));
    assertFalse(span.matches(ImmutableList.of(5L)));
    assertFalse(span.matches(ImmutableList.of("abc")));
  }

  @Test
  void testConjunctionIsIntersected() {
    assertEquals(
        ImmutableList.of(new Range2(Constant.of(3L), Constant.of(7L), Inclusion.LOW)),
        ranges("a", "a >= 3 AND a < 7 AND b = 1"));
  }

  @Test
  void testContradictionYieldsNoRange() {
    assertTrue(ranges("a", "a > 7 AND a < 3").isEmpty());
  }

  @Test
  void testDisjunctionIsUnited() {
    assertEquals(
        ImmutableList.of(Range2.point(Constant.of(1L)), Range2.point(Constant.of(2L))),
        ranges("a", "a = 1 OR a = 2 OR a = 1"));
    assertNull(ranges("a", "a = 1 OR b = 2"));
  }

  @Test
  void testInNeedsArrayLiteral() {
    assertEquals(2, ranges("a", "a IN [1, 2]").size());
    assertNull(ranges("a", "a IN $list"));
  }

  @Test
  void testParameterBoundKeepsLeftSide() {
    List<Range2> ranges = ranges("a", "a > $lo AND a > 5");

    assertEquals(
        ImmutableList.of(new Range2(new Parameter("lo"), null, Inclusion.NEITHER)), ranges);
  }

  @Test
  void testExactness() {
    assertTrue(Sarg.isExact(parser.parse("a"), parser.parse("a = 1 OR a > 5")));
    assertFalse(Sarg.isExact(parser.parse("a"), parser.parse("a = 1 OR b > 5")));
    assertFalse(Sarg.isExact(parser.parse("a"), parser.parse("lower(a) = \"x\"")));
  }

  private List<Range2> ranges(String key, String pred) {
    Expression normalized = normalizer.normalize(parser.parse(pred));
    return Sarg.ranges(parser.parse(key), normalized);
  }
}
