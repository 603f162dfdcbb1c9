/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore.exceptions;

/** Thrown when an indexer lookup finds nothing. */
public class IndexerNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public IndexerNotFoundException(String message) {
    super(message);
  }
}
