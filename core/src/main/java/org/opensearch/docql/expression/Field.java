/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.docql.common.utils.StringUtils;

/** A document path such as {@code o.customer.id}. */
@Getter
@EqualsAndHashCode
public class Field implements Expression {

  private final List<String> path;

  public Field(List<String> path) {
    Preconditions.checkArgument(!path.isEmpty(), "field path must not be empty");
    this.path = ImmutableList.copyOf(path);
  }

  public static Field of(String... path) {
    return new Field(ImmutableList.copyOf(path));
  }

  /** First path element, which names the alias for formalized fields. */
  public String getHead() {
    return path.get(0);
  }

  /** Returns a copy of this field with the given element in front of the path. */
  public Field prefixedWith(String head) {
    return new Field(ImmutableList.<String>builder().add(head).addAll(path).build());
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitField(this, context);
  }

  @Override
  public List<Expression> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public boolean isStatic() {
    return false;
  }

  @Override
  public String toString() {
    return path.stream().map(StringUtils::quoteIdentifier).collect(Collectors.joining("."));
  }
}
