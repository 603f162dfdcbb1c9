/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Qualifies every field reference with a keyspace alias, so that {@code customerId} and {@code
 * o.customerId} compare equal once formalized to alias {@code o}.
 */
@RequiredArgsConstructor
public class Formalizer extends ExpressionVisitor<Expression, Void> {

  @Getter private final String alias;

  public Expression formalize(Expression expr) {
    return expr == null ? null : expr.accept(this, null);
  }

  public List<Expression> formalize(List<Expression> exprs) {
    return exprs.stream().map(this::formalize).collect(Collectors.toList());
  }

  @Override
  public Expression visitExpression(Expression expr, Void context) {
    return expr;
  }

  @Override
  public Expression visitField(Field node, Void context) {
    return alias.equals(node.getHead()) ? node : node.prefixedWith(alias);
  }

  @Override
  public Expression visitArrayConstruct(ArrayConstruct node, Void context) {
    return new ArrayConstruct(formalize(node.getElements()));
  }

  @Override
  public Expression visitFunctionCall(FunctionCall node, Void context) {
    return new FunctionCall(node.getName(), formalize(node.getArguments()));
  }

  @Override
  public Expression visitComparison(Comparison node, Void context) {
    return new Comparison(
        node.getOperator(), formalize(node.getLeft()), formalize(node.getRight()));
  }

  @Override
  public Expression visitAnd(And node, Void context) {
    return new And(formalize(node.getOperands()));
  }

  @Override
  public Expression visitOr(Or node, Void context) {
    return new Or(formalize(node.getOperands()));
  }

  @Override
  public Expression visitNot(Not node, Void context) {
    return new Not(formalize(node.getOperand()));
  }
}
