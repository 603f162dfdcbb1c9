/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A binary comparison {@code (left op right)}. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Comparison implements Expression {

  private final ComparisonOperator operator;

  private final Expression left;

  private final Expression right;

  public static Comparison eq(Expression left, Expression right) {
    return new Comparison(ComparisonOperator.EQ, left, right);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitComparison(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of(left, right);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
