/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

import lombok.Getter;

/** Base class of errors raised while building, encoding, decoding or caching plans. */
public class PlanException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  @Getter private final ErrorCode errorCode;

  public PlanException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public PlanException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
