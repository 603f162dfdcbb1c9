/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

/** The target index does not implement the capability a statement needs. */
public class UnsupportedCapabilityException extends PlanException {

  private static final long serialVersionUID = 1L;

  public UnsupportedCapabilityException(String message) {
    super(ErrorCode.UNSUPPORTED_CAPABILITY, message);
  }

  public UnsupportedCapabilityException(String message, Throwable cause) {
    super(ErrorCode.UNSUPPORTED_CAPABILITY, message, cause);
  }
}
