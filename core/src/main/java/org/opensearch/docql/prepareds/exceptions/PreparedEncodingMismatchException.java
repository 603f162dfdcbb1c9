/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds.exceptions;

import org.opensearch.docql.plan.exceptions.ErrorCode;
import org.opensearch.docql.plan.exceptions.PlanException;

/** An encoded plan does not belong to the prepared statement it was submitted for. */
public class PreparedEncodingMismatchException extends PlanException {

  private static final long serialVersionUID = 1L;

  public PreparedEncodingMismatchException(String message) {
    super(ErrorCode.ENCODING_MISMATCH, message);
  }
}
