/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds.exceptions;

import org.opensearch.docql.plan.exceptions.ErrorCode;
import org.opensearch.docql.plan.exceptions.PlanException;

/** A prepared statement name is already taken by a different statement, or cannot be computed. */
public class PreparedNameException extends PlanException {

  private static final long serialVersionUID = 1L;

  public PreparedNameException(String message) {
    super(ErrorCode.PREPARED_NAME, message);
  }

  public PreparedNameException(String message, Throwable cause) {
    super(ErrorCode.PREPARED_NAME, message, cause);
  }
}
