/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.opensearch.docql.datastore.exceptions.KeyspaceNotFoundException;

/** In-memory datastore with call counting, for tests. */
public class TestDatastore implements Datastore {

  public static final String NAMESPACE = "default";

  private final Map<KeyspacePath, TestKeyspace> keyspaces = new LinkedHashMap<>();

  private final AtomicInteger ids = new AtomicInteger();

  private final AtomicInteger getKeyspaceCalls = new AtomicInteger();

  @Override
  public synchronized Keyspace getKeyspace(KeyspacePath path) {
    getKeyspaceCalls.incrementAndGet();
    TestKeyspace keyspace = keyspaces.get(path);
    if (keyspace == null) {
      throw new KeyspaceNotFoundException("Keyspace " + path.getFullName() + " not found");
    }
    return keyspace;
  }

  public synchronized TestKeyspace createKeyspace(String name) {
    return createKeyspace(KeyspacePath.of(NAMESPACE, name));
  }

  public synchronized TestKeyspace createKeyspace(KeyspacePath path) {
    TestKeyspace keyspace = new TestKeyspace(this, "ks-" + ids.incrementAndGet(), path);
    keyspaces.put(path, keyspace);
    return keyspace;
  }

  public synchronized void dropKeyspace(KeyspacePath path) {
    keyspaces.remove(path);
  }

  String nextId(String prefix) {
    return prefix + "-" + ids.incrementAndGet();
  }

  public int getKeyspaceCalls() {
    return getKeyspaceCalls.get();
  }
}
