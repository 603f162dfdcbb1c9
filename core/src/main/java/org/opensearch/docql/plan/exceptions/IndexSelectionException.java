/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

/** No usable access path could be built for a keyspace. */
public class IndexSelectionException extends PlanException {

  private static final long serialVersionUID = 1L;

  public IndexSelectionException(String message) {
    super(ErrorCode.PLAN, message);
  }

  public IndexSelectionException(String message, Throwable cause) {
    super(ErrorCode.PLAN, message, cause);
  }
}
