/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

/** Parses the canonical string form of an {@link Expression}. */
public interface ExpressionParser {

  /**
   * Parse an expression.
   *
   * @param text expression text
   * @return parsed expression
   * @throws ExpressionSyntaxException if the text is not a valid expression
   */
  Expression parse(String text);
}
