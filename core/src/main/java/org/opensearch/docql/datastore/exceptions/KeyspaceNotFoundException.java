/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore.exceptions;

/** Thrown when a keyspace lookup finds nothing. */
public class KeyspaceNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public KeyspaceNotFoundException(String message) {
    super(message);
  }
}
