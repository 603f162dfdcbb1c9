/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

/** Malformed encoded plan: wrong field type, missing or unknown operator tag. */
public class PlanDecodingException extends PlanException {

  private static final long serialVersionUID = 1L;

  public PlanDecodingException(String message) {
    super(ErrorCode.DECODING, message);
  }

  public PlanDecodingException(String message, Throwable cause) {
    super(ErrorCode.DECODING, message, cause);
  }
}
