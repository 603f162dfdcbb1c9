/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds.exceptions;

import org.opensearch.docql.plan.exceptions.ErrorCode;
import org.opensearch.docql.plan.exceptions.PlanException;

/** A stale prepared statement could not be compiled again. */
public class ReprepareException extends PlanException {

  private static final long serialVersionUID = 1L;

  public ReprepareException(String message) {
    super(ErrorCode.REPREPARE, message);
  }

  public ReprepareException(String message, Throwable cause) {
    super(ErrorCode.REPREPARE, message, cause);
  }
}
