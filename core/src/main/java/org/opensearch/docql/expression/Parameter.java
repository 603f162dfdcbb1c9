/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A statement parameter, positional ({@code $1}) or named ({@code $name}). */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Parameter implements Expression {

  private final String name;

  public boolean isPositional() {
    return name.chars().allMatch(Character::isDigit);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitParameter(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public boolean isStatic() {
    return true;
  }

  @Override
  public String toString() {
    return "$" + name;
  }
}
