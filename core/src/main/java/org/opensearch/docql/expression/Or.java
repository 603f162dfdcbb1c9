/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Disjunction of two or more operands. */
@Getter
@EqualsAndHashCode
public class Or implements Expression {

  private final List<Expression> operands;

  public Or(List<Expression> operands) {
    Preconditions.checkArgument(operands.size() >= 2, "OR needs at least two operands");
    this.operands = ImmutableList.copyOf(operands);
  }

  public static Or of(Expression... operands) {
    return new Or(ImmutableList.copyOf(operands));
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitOr(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return operands;
  }

  @Override
  public String toString() {
    return operands.stream().map(Object::toString).collect(Collectors.joining(" or ", "(", ")"));
  }
}
