/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

/** Thrown when an expression string cannot be parsed. */
public class ExpressionSyntaxException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ExpressionSyntaxException(String message) {
    super(message);
  }

  public ExpressionSyntaxException(String message, Throwable cause) {
    super(message, cause);
  }
}
