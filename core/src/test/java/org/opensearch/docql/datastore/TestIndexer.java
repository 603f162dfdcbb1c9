/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import lombok.Getter;
import org.opensearch.docql.datastore.exceptions.IndexNotFoundException;
import org.opensearch.docql.expression.DefaultExpressionParser;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.expression.ExpressionParser;

/** Indexer of a {@link TestKeyspace}. Every index change bumps its version. */
public class TestIndexer implements Indexer {

  private static final ExpressionParser PARSER = new DefaultExpressionParser();

  @Getter private final String id;

  @Getter private final IndexType type;

  @Getter private final TestKeyspace keyspace;

  private final List<Index> indexes = new CopyOnWriteArrayList<>();

  private final AtomicLong version = new AtomicLong(1);

  private final AtomicInteger refreshCalls = new AtomicInteger();

  private final AtomicInteger indexByIdCalls = new AtomicInteger();

  TestIndexer(String id, IndexType type, TestKeyspace keyspace) {
    this.id = id;
    this.type = type;
    this.keyspace = keyspace;
  }

  @Override
  public String getKeyspaceId() {
    return keyspace.getId();
  }

  @Override
  public Index getIndexById(String indexId) {
    indexByIdCalls.incrementAndGet();
    return indexes.stream()
        .filter(index -> index.getId().equals(indexId))
        .findFirst()
        .orElseThrow(() -> new IndexNotFoundException("No index with id " + indexId));
  }

  @Override
  public Index getIndexByName(String name) {
    return indexes.stream()
        .filter(index -> index.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new IndexNotFoundException("No index named " + name));
  }

  @Override
  public List<Index> getIndexes() {
    return ImmutableList.copyOf(indexes);
  }

  @Override
  public List<PrimaryIndex> getPrimaryIndexes() {
    return indexes.stream()
        .filter(Index::isPrimary)
        .map(PrimaryIndex.class::cast)
        .collect(Collectors.toList());
  }

  @Override
  public void refresh() {
    refreshCalls.incrementAndGet();
  }

  @Override
  public long getMetadataVersion() {
    return version.get();
  }

  /** Online index over the key expressions. */
  public TestIndex createIndex(String name, String... keys) {
    return createPartialIndex(name, null, keys);
  }

  /** Online index over the key expressions, holding only documents matching the condition. */
  public TestIndex createPartialIndex(String name, String condition, String... keys) {
    List<Expression> rangeKey =
        Arrays.stream(keys).map(PARSER::parse).collect(Collectors.toList());
    TestIndex index =
        new TestIndex(
            keyspace.getDatastore().nextId("index"),
            name,
            this,
            rangeKey,
            condition == null ? null : PARSER.parse(condition));
    indexes.add(index);
    version.incrementAndGet();
    return index;
  }

  public TestPrimaryIndex createPrimaryIndex(String name) {
    TestPrimaryIndex index =
        new TestPrimaryIndex(keyspace.getDatastore().nextId("index"), name, this);
    indexes.add(index);
    version.incrementAndGet();
    return index;
  }

  public void dropIndex(String name) {
    indexes.remove(getIndexByName(name));
    version.incrementAndGet();
  }

  public void setState(String name, IndexState state) {
    ((TestIndex) getIndexByName(name)).setState(state);
    version.incrementAndGet();
  }

  public int getRefreshCalls() {
    return refreshCalls.get();
  }

  public int getIndexByIdCalls() {
    return indexByIdCalls.get();
  }
}
