/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Stable error codes reported with every {@link PlanException}. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
  DECODING(4100, "Unable to decode plan"),
  UNRESOLVED_REFERENCE(4101, "Plan references metadata that no longer exists"),
  CONFLICT(4102, "Conflicting plan definition"),
  UNSUPPORTED_CAPABILITY(4103, "Operation not supported by the index"),
  PLAN(4104, "Unable to plan statement"),
  NO_SUCH_PREPARED(4040, "No such prepared statement"),
  PREPARED_NAME(4050, "Prepared name conflict"),
  ENCODING_MISMATCH(4060, "Encoded plan does not match the prepared statement"),
  REPREPARE(4070, "Unable to reprepare statement");

  private final int code;

  private final String reason;
}
