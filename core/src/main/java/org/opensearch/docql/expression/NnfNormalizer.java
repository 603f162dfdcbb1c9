/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rewrites a predicate into negation normal form. NOT is pushed down to the leaves (De Morgan),
 * negated comparisons are replaced by their complement, nested AND/OR of the same kind are
 * flattened, and comparisons with a static value on the left are turned around so that the
 * static side is on the right.
 */
public class NnfNormalizer extends ExpressionVisitor<Expression, Void> {

  public Expression normalize(Expression expr) {
    return expr == null ? null : expr.accept(this, null);
  }

  @Override
  public Expression visitExpression(Expression expr, Void context) {
    return expr;
  }

  @Override
  public Expression visitArrayConstruct(ArrayConstruct node, Void context) {
    return new ArrayConstruct(normalizeAll(node.getElements()));
  }

  @Override
  public Expression visitFunctionCall(FunctionCall node, Void context) {
    return new FunctionCall(node.getName(), normalizeAll(node.getArguments()));
  }

  @Override
  public Expression visitComparison(Comparison node, Void context) {
    Expression left = normalize(node.getLeft());
    Expression right = normalize(node.getRight());
    if (left.isStatic() && !right.isStatic()) {
      Optional<ComparisonOperator> mirrored = node.getOperator().mirror();
      if (mirrored.isPresent()) {
        return new Comparison(mirrored.get(), right, left);
      }
    }
    return new Comparison(node.getOperator(), left, right);
  }

  @Override
  public Expression visitAnd(And node, Void context) {
    List<Expression> operands = new ArrayList<>();
    for (Expression operand : normalizeAll(node.getOperands())) {
      if (operand instanceof And) {
        operands.addAll(((And) operand).getOperands());
      } else {
        operands.add(operand);
      }
    }
    return new And(operands);
  }

  @Override
  public Expression visitOr(Or node, Void context) {
    List<Expression> operands = new ArrayList<>();
    for (Expression operand : normalizeAll(node.getOperands())) {
      if (operand instanceof Or) {
        operands.addAll(((Or) operand).getOperands());
      } else {
        operands.add(operand);
      }
    }
    return new Or(operands);
  }

  @Override
  public Expression visitNot(Not node, Void context) {
    Expression operand = node.getOperand();
    if (operand instanceof Not) {
      return normalize(((Not) operand).getOperand());
    }
    if (operand instanceof And) {
      return normalize(new Or(negateAll(((And) operand).getOperands())));
    }
    if (operand instanceof Or) {
      return normalize(new And(negateAll(((Or) operand).getOperands())));
    }
    if (operand instanceof Comparison) {
      Comparison comparison = (Comparison) operand;
      Optional<ComparisonOperator> negated = comparison.getOperator().negate();
      if (negated.isPresent()) {
        return normalize(
            new Comparison(negated.get(), comparison.getLeft(), comparison.getRight()));
      }
    }
    if (Constant.TRUE.equals(operand)) {
      return Constant.FALSE;
    }
    if (Constant.FALSE.equals(operand)) {
      return Constant.TRUE;
    }
    return new Not(normalize(operand));
  }

  private List<Expression> normalizeAll(List<Expression> exprs) {
    return exprs.stream().map(this::normalize).collect(Collectors.toList());
  }

  private static List<Expression> negateAll(List<Expression> exprs) {
    return exprs.stream().map(Not::new).collect(Collectors.toList());
  }
}
