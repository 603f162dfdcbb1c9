/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.AccessLevel;
import lombok.Getter;
import org.opensearch.docql.datastore.exceptions.IndexerNotFoundException;

@Getter
public class TestKeyspace implements Keyspace {

  private final TestDatastore datastore;

  private final String id;

  private final KeyspacePath path;

  @Getter(AccessLevel.NONE)
  private final AtomicLong version = new AtomicLong(1);

  @Getter(AccessLevel.NONE)
  private final Map<IndexType, TestIndexer> indexers = new LinkedHashMap<>();

  TestKeyspace(TestDatastore datastore, String id, KeyspacePath path) {
    this.datastore = datastore;
    this.id = id;
    this.path = path;
  }

  @Override
  public String getName() {
    return path.getKeyspace();
  }

  @Override
  public long getMetadataVersion() {
    return version.get();
  }

  public void bumpVersion() {
    version.incrementAndGet();
  }

  @Override
  public synchronized Indexer getIndexer(IndexType type) {
    TestIndexer indexer = indexers.get(type);
    if (indexer == null) {
      throw new IndexerNotFoundException("No " + type.getWireName() + " indexer on " + getName());
    }
    return indexer;
  }

  @Override
  public synchronized List<Indexer> getIndexers() {
    return ImmutableList.copyOf(indexers.values());
  }

  /** The secondary index indexer, created on first use. */
  public synchronized TestIndexer gsi() {
    return indexer(IndexType.GSI);
  }

  public synchronized TestIndexer indexer(IndexType type) {
    return indexers.computeIfAbsent(
        type, t -> new TestIndexer(datastore.nextId("indexer"), t, this));
  }
}
