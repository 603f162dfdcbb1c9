/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.expression.Collation;
import org.opensearch.docql.expression.Constant;
import org.opensearch.docql.expression.Expression;

/**
 * Range over one index key. A missing bound is unbounded on that side. Bounds are static
 * expressions: constants or statement parameters.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Range2 {

  private final Expression low;

  private final Expression high;

  private final Inclusion inclusion;

  /** Range holding no value at all. */
  public static final Range2 EMPTY = new Range2(Constant.NULL, Constant.NULL, Inclusion.NEITHER);

  /** Range holding exactly one value. */
  public static Range2 point(Expression value) {
    return new Range2(value, value, Inclusion.BOTH);
  }

  public boolean isEqualRange() {
    return inclusion == Inclusion.BOTH && low != null && low.equals(high);
  }

  /** True if both bounds are constants (or absent), so the range can be evaluated. */
  public boolean isConstant() {
    return (low == null || low instanceof Constant) && (high == null || high instanceof Constant);
  }

  /** True if the range provably holds no value. */
  public boolean isEmpty() {
    if (low == null || high == null || !isConstant()) {
      return false;
    }
    int c = Collation.INSTANCE.compare(((Constant) low).getValue(), ((Constant) high).getValue());
    return c > 0 || (c == 0 && inclusion != Inclusion.BOTH);
  }

  /**
   * Evaluate the range against a key value.
   *
   * @throws IllegalStateException if a bound is not a constant
   */
  public boolean contains(Object value) {
    if (!isConstant()) {
      throw new IllegalStateException("range with non-constant bounds cannot be evaluated");
    }
    if (low != null) {
      int c = Collation.INSTANCE.compare(value, ((Constant) low).getValue());
      if (c < 0 || (c == 0 && !inclusion.isLowInclusive())) {
        return false;
      }
    }
    if (high != null) {
      int c = Collation.INSTANCE.compare(value, ((Constant) high).getValue());
      return c < 0 || (c == 0 && inclusion.isHighInclusive());
    }
    return true;
  }

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    PlanJson.putExpression(node, "low", low);
    PlanJson.putExpression(node, "high", high);
    node.put("inclusion", inclusion.getCode());
    return node;
  }

  public static Range2 decode(ObjectNode node, PlanDecodingContext context) {
    return new Range2(
        PlanJson.optExpression(node, "low", context),
        PlanJson.optExpression(node, "high", context),
        Inclusion.fromCode(PlanJson.optLong(node, "inclusion", 0)));
  }

  @Override
  public String toString() {
    return PlanJson.toJson(encode());
  }
}
