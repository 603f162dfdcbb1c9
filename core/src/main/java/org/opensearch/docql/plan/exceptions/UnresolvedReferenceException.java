/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

/** An encoded plan names a keyspace, indexer or index that no longer resolves. */
public class UnresolvedReferenceException extends PlanException {

  private static final long serialVersionUID = 1L;

  public UnresolvedReferenceException(String message) {
    super(ErrorCode.UNRESOLVED_REFERENCE, message);
  }

  public UnresolvedReferenceException(String message, Throwable cause) {
    super(ErrorCode.UNRESOLVED_REFERENCE, message, cause);
  }
}
