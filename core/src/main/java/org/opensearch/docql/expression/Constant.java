/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A literal value: null, a boolean, a long, a double or a string. */
@Getter
@EqualsAndHashCode
public class Constant implements Expression {

  public static final Constant NULL = new Constant(null);
  public static final Constant TRUE = new Constant(Boolean.TRUE);
  public static final Constant FALSE = new Constant(Boolean.FALSE);

  private final Object value;

  private Constant(Object value) {
    this.value = value;
  }

  public static Constant of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return new Constant(((Number) value).longValue());
    }
    if (value instanceof Float) {
      return new Constant(((Float) value).doubleValue());
    }
    Preconditions.checkArgument(
        value instanceof Boolean
            || value instanceof Long
            || value instanceof Double
            || value instanceof String,
        "unsupported constant type %s",
        value.getClass().getName());
    return new Constant(value);
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitConstant(this, context);
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
    if (value == null) {
      return "null";
    }
    if (value instanceof String) {
      return new TextNode((String) value).toString();
    }
    return value.toString();
  }
}
