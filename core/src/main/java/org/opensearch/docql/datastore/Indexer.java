/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import java.util.List;
import org.opensearch.docql.datastore.exceptions.IndexNotFoundException;

/** Index service of one type for one keyspace. */
public interface Indexer {

  String getId();

  IndexType getType();

  String getKeyspaceId();

  /** @throws IndexNotFoundException if no index has the id */
  Index getIndexById(String id);

  /** @throws IndexNotFoundException if no index has the name */
  Index getIndexByName(String name);

  /** All indexes, primary ones included, in declaration order. */
  List<Index> getIndexes();

  /** Primary indexes, in declaration order. */
  List<PrimaryIndex> getPrimaryIndexes();

  /** Reload index metadata from the index service. */
  void refresh();

  /** Counter bumped on every index create, drop, alter or state change. */
  long getMetadataVersion();
}
