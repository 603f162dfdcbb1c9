/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.planner;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.opensearch.docql.expression.And;
import org.opensearch.docql.expression.ArrayConstruct;
import org.opensearch.docql.expression.Collation;
import org.opensearch.docql.expression.Comparison;
import org.opensearch.docql.expression.Constant;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.expression.Or;
import org.opensearch.docql.plan.Inclusion;
import org.opensearch.docql.plan.Range2;

/**
 * Derives the ranges of one index key that hold every document satisfying a predicate. The
 * predicate is expected in negation normal form, with static values on the right-hand side of
 * comparisons.
 *
 * <p>{@link #ranges} returns null when the predicate does not constrain the key. An empty list
 * means the predicate constrains the key to no value at all.
 */
final class Sarg {

  private Sarg() {}

  static List<Range2> ranges(Expression key, Expression pred) {
    if (pred instanceof Comparison) {
      return comparison(key, (Comparison) pred);
    }
    if (pred instanceof And) {
      List<Range2> result = null;
      for (Expression operand : ((And) pred).getOperands()) {
        List<Range2> ranges = ranges(key, operand);
        if (ranges != null) {
          result = result == null ? ranges : intersect(result, ranges);
        }
      }
      return result;
    }
    if (pred instanceof Or) {
      List<Range2> result = new ArrayList<>();
      for (Expression operand : ((Or) pred).getOperands()) {
        List<Range2> ranges = ranges(key, operand);
        if (ranges == null) {
          return null;
        }
        ranges.stream().filter(range -> !result.contains(range)).forEach(result::add);
      }
      return result;
    }
    return null;
  }

  /**
   * True if the ranges of the key decide the predicate by themselves, so that no filter is needed
   * on top of a scan over them.
   */
  static boolean isExact(Expression key, Expression pred) {
    if (pred instanceof Comparison) {
      return comparison(key, (Comparison) pred) != null;
    }
    if (pred instanceof Or) {
      return ((Or) pred).getOperands().stream().allMatch(operand -> isExact(key, operand));
    }
    return false;
  }

  private static List<Range2> comparison(Expression key, Comparison pred) {
    if (!key.equals(pred.getLeft()) || !pred.getRight().isStatic()) {
      return null;
    }
    Expression value = pred.getRight();
    switch (pred.getOperator()) {
      case EQ:
        return ImmutableList.of(Range2.point(value));
      case LT:
        return ImmutableList.of(new Range2(Constant.NULL, value, Inclusion.NEITHER));
      case LE:
        return ImmutableList.of(new Range2(Constant.NULL, value, Inclusion.HIGH));
      case GT:
        return ImmutableList.of(new Range2(value, null, Inclusion.NEITHER));
      case GE:
        return ImmutableList.of(new Range2(value, null, Inclusion.LOW));
      case IN:
        return in(value);
      default:
        return null;
    }
  }

  private static List<Range2> in(Expression values) {
    if (!(values instanceof ArrayConstruct)) {
      return null;
    }
    List<Range2> ranges = new ArrayList<>();
    for (Expression element : ((ArrayConstruct) values).getElements()) {
      Range2 point = Range2.point(element);
      if (!ranges.contains(point)) {
        ranges.add(point);
      }
    }
    return ranges;
  }

  /** Pairwise intersection of two unions of ranges, empty results dropped. */
  static List<Range2> intersect(List<Range2> left, List<Range2> right) {
    List<Range2> result = new ArrayList<>();
    for (Range2 l : left) {
      for (Range2 r : right) {
        Range2 range = intersect(l, r);
        if (!range.isEmpty() && !result.contains(range)) {
          result.add(range);
        }
      }
    }
    return result;
  }

  /**
   * Intersection of two ranges. Bounds that are not constants cannot be compared; the bound of the
   * left range is kept then, which yields a superset of the intersection.
   */
  static Range2 intersect(Range2 left, Range2 right) {
    Pair<Expression, Boolean> low =
        tighter(
            left.getLow(),
            left.getInclusion().isLowInclusive(),
            right.getLow(),
            right.getInclusion().isLowInclusive(),
            true);
    Pair<Expression, Boolean> high =
        tighter(
            left.getHigh(),
            left.getInclusion().isHighInclusive(),
            right.getHigh(),
            right.getInclusion().isHighInclusive(),
            false);
    return new Range2(
        low.getLeft(), high.getLeft(), Inclusion.of(low.getRight(), high.getRight()));
  }

  /** The tighter of two bounds on the same side, with its inclusiveness. */
  private static Pair<Expression, Boolean> tighter(
      Expression left,
      boolean leftInclusive,
      Expression right,
      boolean rightInclusive,
      boolean low) {
    int c = compareBounds(left, right, low);
    boolean takeRight = (low ? c < 0 : c > 0) || (c == 0 && !rightInclusive);
    return takeRight ? Pair.of(right, rightInclusive) : Pair.of(left, leftInclusive);
  }

  /**
   * Order of two bounds on the same side. A missing bound is unbounded: below everything for a low
   * bound, above everything for a high bound. Non-constant bounds compare as left-preferred.
   */
  private static int compareBounds(Expression left, Expression right, boolean low) {
    if (right == null) {
      return low ? 1 : -1;
    }
    if (left == null) {
      return low ? -1 : 1;
    }
    if (!(left instanceof Constant) || !(right instanceof Constant)) {
      return low ? 1 : -1;
    }
    return Collation.INSTANCE.compare(((Constant) left).getValue(), ((Constant) right).getValue());
  }
}
