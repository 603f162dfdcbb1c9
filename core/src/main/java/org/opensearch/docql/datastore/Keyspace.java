/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import java.util.List;
import org.opensearch.docql.datastore.exceptions.IndexerNotFoundException;

/** A collection of documents with its indexers. */
public interface Keyspace {

  /** Stable identifier. A keyspace dropped and recreated under the same path gets a new id. */
  String getId();

  String getName();

  KeyspacePath getPath();

  /** Counter bumped on every metadata change relevant to compiled plans. */
  long getMetadataVersion();

  /**
   * Indexer of the given type.
   *
   * @throws IndexerNotFoundException if the keyspace has no such indexer
   */
  Indexer getIndexer(IndexType type);

  /** All indexers, in a stable order. */
  List<Indexer> getIndexers();
}
