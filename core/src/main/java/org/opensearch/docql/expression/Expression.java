/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import java.util.List;

/**
 * An immutable expression tree node. Two expressions are equivalent when they are equal, and the
 * {@link #toString()} form of an expression is canonical: {@link ExpressionParser#parse(String)}
 * returns an equal expression for it.
 */
public interface Expression {

  /**
   * Accept a visitor.
   *
   * @param visitor visitor
   * @param context visitor context
   * @param <R> result type
   * @param <C> context type
   * @return visitor result
   */
  <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);

  /** Direct sub-expressions, in evaluation order. */
  List<Expression> getChildren();

  /** True if the expression has the same value for every document. */
  default boolean isStatic() {
    return getChildren().stream().allMatch(Expression::isStatic);
  }
}
