/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A call to a named function, for example {@code lower(o.name)} in an index key or {@code
 * count(o.id)} in an aggregate. Function names are case-insensitive and kept in lower case.
 */
@Getter
@EqualsAndHashCode
public class FunctionCall implements Expression {

  private final String name;

  private final List<Expression> arguments;

  public FunctionCall(String name, List<Expression> arguments) {
    this.name = name.toLowerCase(Locale.ROOT);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public static FunctionCall of(String name, Expression... arguments) {
    return new FunctionCall(name, ImmutableList.copyOf(arguments));
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitFunctionCall(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return arguments;
  }

  @Override
  public boolean isStatic() {
    return false;
  }

  @Override
  public String toString() {
    return arguments.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", name + "(", ")"));
  }
}
