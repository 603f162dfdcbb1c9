/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** An array literal {@code [e1, e2, ...]}. */
@Getter
@EqualsAndHashCode
public class ArrayConstruct implements Expression {

  private final List<Expression> elements;

  public ArrayConstruct(List<Expression> elements) {
    this.elements = ImmutableList.copyOf(elements);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitArrayConstruct(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return elements;
  }

  @Override
  public String toString() {
    return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
  }
}
