/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ComparisonOperator {
  EQ("="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  IN("in");

  private final String symbol;

  /** Operator that holds exactly when this one does not. IN has no single-operator negation. */
  public Optional<ComparisonOperator> negate() {
    switch (this) {
      case EQ:
        return Optional.of(NE);
      case NE:
        return Optional.of(EQ);
      case LT:
        return Optional.of(GE);
      case LE:
        return Optional.of(GT);
      case GT:
        return Optional.of(LE);
      case GE:
        return Optional.of(LT);
      default:
        return Optional.empty();
    }
  }

  /** Operator to use when the operands are swapped. IN cannot be swapped. */
  public Optional<ComparisonOperator> mirror() {
    switch (this) {
      case LT:
        return Optional.of(GT);
      case LE:
        return Optional.of(GE);
      case GT:
        return Optional.of(LT);
      case GE:
        return Optional.of(LE);
      case IN:
        return Optional.empty();
      default:
        return Optional.of(this);
    }
  }

  public static Optional<ComparisonOperator> fromSymbol(String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equalsIgnoreCase(symbol)).findFirst();
  }
}
