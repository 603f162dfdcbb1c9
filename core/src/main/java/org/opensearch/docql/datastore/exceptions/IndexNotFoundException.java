/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore.exceptions;

/** Thrown when an index lookup finds nothing. */
public class IndexNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public IndexNotFoundException(String message) {
    super(message);
  }
}
