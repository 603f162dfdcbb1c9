/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.planner;

import java.util.List;
import org.opensearch.docql.expression.And;
import org.opensearch.docql.expression.Comparison;
import org.opensearch.docql.expression.Constant;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.expression.Or;
import org.opensearch.docql.plan.Range2;

/** Conservative implication checks between predicates in negation normal form. */
public final class Subsets {

  private Subsets() {}

  /**
   * True if every document satisfying {@code expr1} provably satisfies {@code expr2}. A false
   * answer means the implication could not be shown, not that it does not hold.
   */
  public static boolean subsetOf(Expression expr1, Expression expr2) {
    if (expr2 == null || Constant.TRUE.equals(expr2) || expr1.equals(expr2)) {
      return true;
    }
    if (expr2 instanceof And) {
      return ((And) expr2).getOperands().stream().allMatch(operand -> subsetOf(expr1, operand));
    }
    if (expr1 instanceof Or) {
      return ((Or) expr1).getOperands().stream().allMatch(operand -> subsetOf(operand, expr2));
    }
    if (expr1 instanceof And
        && ((And) expr1).getOperands().stream().anyMatch(operand -> subsetOf(operand, expr2))) {
      return true;
    }
    if (expr2 instanceof Or
        && ((Or) expr2).getOperands().stream().anyMatch(operand -> subsetOf(expr1, operand))) {
      return true;
    }
    if (expr1 instanceof Comparison && expr2 instanceof Comparison) {
      return rangeSubset((Comparison) expr1, (Comparison) expr2);
    }
    return false;
  }

  /** {@code a > 10} implies {@code a > 5}: both sides constrain the same key by constants. */
  private static boolean rangeSubset(Comparison expr1, Comparison expr2) {
    Expression key = expr1.getLeft();
    if (!key.equals(expr2.getLeft())) {
      return false;
    }
    List<Range2> inner = Sarg.ranges(key, expr1);
    List<Range2> outer = Sarg.ranges(key, expr2);
    if (inner == null || outer == null) {
      return false;
    }
    return inner.stream()
        .allMatch(range -> range.isConstant() && outer.stream().anyMatch(o -> covers(o, range)));
  }

  private static boolean covers(Range2 outer, Range2 inner) {
    return outer.isConstant() && Sarg.intersect(inner, outer).equals(inner);
  }
}
