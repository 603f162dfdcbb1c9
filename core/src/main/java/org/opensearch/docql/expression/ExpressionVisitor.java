/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

/**
 * Visitor over {@link Expression} trees. Every method defaults to {@link #visitExpression}, so a
 * subclass only overrides the node kinds it cares about.
 *
 * @param <R> result type
 * @param <C> context type
 */
public abstract class ExpressionVisitor<R, C> {

  public R visitExpression(Expression expr, C context) {
    return null;
  }

  public R visitConstant(Constant node, C context) {
    return visitExpression(node, context);
  }

  public R visitField(Field node, C context) {
    return visitExpression(node, context);
  }

  public R visitParameter(Parameter node, C context) {
    return visitExpression(node, context);
  }

  public R visitArrayConstruct(ArrayConstruct node, C context) {
    return visitExpression(node, context);
  }

  public R visitFunctionCall(FunctionCall node, C context) {
    return visitExpression(node, context);
  }

  public R visitComparison(Comparison node, C context) {
    return visitExpression(node, context);
  }

  public R visitAnd(And node, C context) {
    return visitExpression(node, context);
  }

  public R visitOr(Or node, C context) {
    return visitExpression(node, context);
  }

  public R visitNot(Not node, C context) {
    return visitExpression(node, context);
  }
}
