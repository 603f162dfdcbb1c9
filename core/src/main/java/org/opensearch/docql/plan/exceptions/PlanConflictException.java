/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

/** Two incompatible definitions were registered for the same plan element. */
public class PlanConflictException extends PlanException {

  private static final long serialVersionUID = 1L;

  public PlanConflictException(String message) {
    super(ErrorCode.CONFLICT, message);
  }

  public PlanConflictException(String message, Throwable cause) {
    super(ErrorCode.CONFLICT, message, cause);
  }
}
