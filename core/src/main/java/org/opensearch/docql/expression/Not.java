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

@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Not implements Expression {

  private final Expression operand;

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitNot(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return ImmutableList.of(operand);
  }

  @Override
  public String toString() {
    return "(not " + operand + ")";
  }
}
