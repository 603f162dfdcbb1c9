/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.docql.datastore.Datastore;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.IndexState;
import org.opensearch.docql.datastore.Indexer;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.datastore.exceptions.IndexNotFoundException;
import org.opensearch.docql.datastore.exceptions.IndexerNotFoundException;
import org.opensearch.docql.datastore.exceptions.KeyspaceNotFoundException;
import org.opensearch.docql.plan.PlanVerifier;

/**
 * Verifier used for one walk of a plan tree. References are re-resolved against the live
 * datastore; the versions observed along the way are collected so that they can become the new
 * stamps of the plan once the whole walk succeeded.
 */
@Log4j2
class StampingPlanVerifier implements PlanVerifier {

  private final Datastore datastore;

  /** Keyspace versions stamped by earlier verifications, by keyspace id. */
  private final Map<String, Long> stampedKeyspaceVersions;

  @Getter private final Map<String, MetadataStamp<Indexer>> indexerStamps = new HashMap<>();

  @Getter private final Map<String, MetadataStamp<Keyspace>> keyspaceStamps = new HashMap<>();

  StampingPlanVerifier(Datastore datastore, Map<String, Long> stampedKeyspaceVersions) {
    this.datastore = datastore;
    this.stampedKeyspaceVersions = stampedKeyspaceVersions;
  }

  @Override
  public boolean verifyIndex(Index index, Keyspace keyspace) {
    Keyspace current = resolve(keyspace);
    if (current == null) {
      return false;
    }
    Indexer indexer;
    Index live;
    try {
      indexer = current.getIndexer(index.getType());
      indexer.refresh();
      live = indexer.getIndexById(index.getId());
    } catch (IndexerNotFoundException | IndexNotFoundException e) {
      log.debug("Index {} of keyspace {} is gone", index.getName(), keyspace.getName());
      return false;
    }
    if (!Objects.equals(live.getName(), index.getName())) {
      log.debug("Index {} was renamed to {}", index.getName(), live.getName());
      return false;
    }
    if (live.getState() != IndexState.ONLINE) {
      log.debug("Index {} is {}", index.getName(), live.getState());
      return false;
    }
    indexerStamps.put(indexer.getId(), new MetadataStamp<>(indexer, indexer.getMetadataVersion()));
    return true;
  }

  @Override
  public boolean verifyKeyspace(Keyspace keyspace) {
    return resolve(keyspace) != null;
  }

  /** The live keyspace at the same path, or null if it changed since the plan was stamped. */
  private Keyspace resolve(Keyspace keyspace) {
    MetadataStamp<Keyspace> seen = keyspaceStamps.get(keyspace.getId());
    if (seen != null) {
      return seen.getTarget();
    }
    Keyspace current;
    try {
      current = datastore.getKeyspace(keyspace.getPath());
    } catch (KeyspaceNotFoundException e) {
      log.debug("Keyspace {} is gone", keyspace.getPath().getFullName());
      return null;
    }
    if (!current.getId().equals(keyspace.getId())) {
      log.debug("Keyspace {} was dropped and recreated", keyspace.getPath().getFullName());
      return null;
    }
    long version = current.getMetadataVersion();
    Long stamped = stampedKeyspaceVersions.get(current.getId());
    if (stamped != null && stamped != version) {
      log.debug(
          "Keyspace {} changed from version {} to {}",
          keyspace.getPath().getFullName(), stamped, version);
      return null;
    }
    keyspaceStamps.put(current.getId(), new MetadataStamp<>(current, version));
    return current;
  }
}
