/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds.exceptions;

import org.opensearch.docql.plan.exceptions.ErrorCode;
import org.opensearch.docql.plan.exceptions.PlanException;

/** No prepared statement is cached under a name. */
public class NoSuchPreparedException extends PlanException {

  private static final long serialVersionUID = 1L;

  public NoSuchPreparedException(String message) {
    super(ErrorCode.NO_SUCH_PREPARED, message);
  }
}
