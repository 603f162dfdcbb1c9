/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.docql.datastore.Datastore;
import org.opensearch.docql.datastore.Indexer;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.plan.Operator;

/**
 * A compiled statement: the root operator together with the identity of the statement it was
 * compiled from, and the metadata versions it was last verified against.
 *
 * <p>The operator tree never changes. Version stamps, transaction variants and subquery plans are
 * amended after construction; they are read under a shared lock and written under an exclusive
 * lock that is only held for the map update.
 */
@Log4j2
@Getter
@Setter
public class Prepared {

  /** Transaction variant hash used when none of the scanned keyspaces carries delta state. */
  public static final String DELETE_HASH = "(delete)";

  private static final String DELETE_TYPE = "DELETE";

  @Setter(AccessLevel.NONE)
  private final Operator operator;

  @Setter(AccessLevel.NONE)
  private final JsonNode signature;

  private String name;

  private String text;

  private String type;

  private int indexApiVersion;

  private long featureControls;

  private String namespace;

  private String queryContext;

  private String tenant;

  private boolean useFts;

  private boolean useCbo;

  private int planVersion = PlanVersion.CURRENT;

  private volatile String encodedPlan;

  /** Keyspace full name to whether it was scanned with uncommitted transaction writes. */
  private Map<String, Boolean> indexScanKeyspaces;

  private JsonNode optimizerHints;

  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private final Map<String, MetadataStamp<Indexer>> indexerStamps = new HashMap<>();

  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private final Map<String, MetadataStamp<Keyspace>> keyspaceStamps = new HashMap<>();

  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private final Map<String, Prepared> txPrepareds = new HashMap<>();

  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private volatile Map<String, Operator> subqueryPlans;

  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public Prepared(Operator operator, JsonNode signature) {
    this.operator = Preconditions.checkNotNull(operator, "operator");
    this.signature = signature;
    this.indexScanKeyspaces = new ScannedKeyspaceCollector().collect(operator);
  }

  public boolean isDelete() {
    return DELETE_TYPE.equalsIgnoreCase(type);
  }

  /** Relation of the protocol version this plan was encoded with to the current one. */
  public PlanVersion comparePlanVersion() {
    return PlanVersion.compare(planVersion);
  }

  /**
   * Cheap staleness check against the recorded stamps: every stamped indexer is refreshed and its
   * version compared, then every stamped keyspace version is compared. Nothing is re-resolved.
   *
   * @return false if any stamped version moved
   */
  public boolean metadataCheck() {
    List<MetadataStamp<Indexer>> indexers;
    List<MetadataStamp<Keyspace>> keyspaces;
    lock.readLock().lock();
    try {
      indexers = new ArrayList<>(indexerStamps.values());
      keyspaces = new ArrayList<>(keyspaceStamps.values());
    } finally {
      lock.readLock().unlock();
    }
    for (MetadataStamp<Indexer> stamp : indexers) {
      Indexer indexer = stamp.getTarget();
      indexer.refresh();
      if (indexer.getMetadataVersion() != stamp.getVersion()) {
        log.debug("Prepared {}: indexer {} changed", name, indexer.getId());
        return false;
      }
    }
    for (MetadataStamp<Keyspace> stamp : keyspaces) {
      if (stamp.getTarget().getMetadataVersion() != stamp.getVersion()) {
        log.debug("Prepared {}: keyspace {} changed", name, stamp.getTarget().getName());
        return false;
      }
    }
    return true;
  }

  /**
   * Full verification: every keyspace and index referenced by the plan and its subquery plans is
   * re-resolved against the datastore. On success the versions observed become the new stamps.
   *
   * @return false if the plan must be recompiled
   */
  public boolean verify(Datastore datastore) {
    Map<String, Long> stamped = new HashMap<>();
    List<Operator> subqueries;
    lock.readLock().lock();
    try {
      keyspaceStamps.forEach((id, stamp) -> stamped.put(id, stamp.getVersion()));
      subqueries = subqueryPlans == null ? List.of() : new ArrayList<>(subqueryPlans.values());
    } finally {
      lock.readLock().unlock();
    }

    StampingPlanVerifier verifier = new StampingPlanVerifier(datastore, stamped);
    if (!operator.verify(verifier)) {
      log.debug("Prepared {} failed verification", name);
      return false;
    }
    for (Operator subquery : subqueries) {
      if (!subquery.verify(verifier)) {
        log.debug("Prepared {} failed verification of a subquery plan", name);
        return false;
      }
    }

    lock.writeLock().lock();
    try {
      indexerStamps.putAll(verifier.getIndexerStamps());
      keyspaceStamps.putAll(verifier.getKeyspaceStamps());
    } finally {
      lock.writeLock().unlock();
    }
    return true;
  }

  /** Indexer stamps by indexer id. */
  public Map<String, Long> getIndexerVersions() {
    return versions(indexerStamps);
  }

  /** Keyspace stamps by keyspace id. */
  public Map<String, Long> getKeyspaceVersions() {
    return versions(keyspaceStamps);
  }

  private <T> Map<String, Long> versions(Map<String, MetadataStamp<T>> stamps) {
    lock.readLock().lock();
    try {
      ImmutableMap.Builder<String, Long> builder = ImmutableMap.builder();
      stamps.forEach((id, stamp) -> builder.put(id, stamp.getVersion()));
      return builder.build();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Find the variant of this plan to run inside a transaction whose uncommitted writes touch the
   * given keyspaces.
   *
   * @param deltaKeyspaces full names of the keyspaces with uncommitted writes
   * @param maxKeyspaces scanned keyspaces above which variants are not shared
   */
  public TxPreparedLookup getTxPrepared(Set<String> deltaKeyspaces, int maxKeyspaces) {
    Set<String> scanned = indexScanKeyspaces.keySet();
    if (!isDelete()
        && (scanned.isEmpty() || scanned.stream().noneMatch(deltaKeyspaces::contains))) {
      return TxPreparedLookup.base(this);
    }
    if (scanned.size() > maxKeyspaces) {
      return TxPreparedLookup.refused();
    }
    String hashCode = txHashCode(scanned, deltaKeyspaces);
    lock.readLock().lock();
    try {
      Prepared variant = txPrepareds.get(hashCode);
      return variant == null
          ? TxPreparedLookup.miss(hashCode)
          : TxPreparedLookup.hit(variant, hashCode);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Register a transaction variant.
   *
   * @return false if the variant table is full and the variant was not kept
   */
  public boolean setTxPrepared(Prepared variant, String hashCode, int maxVariants) {
    lock.writeLock().lock();
    try {
      if (!txPrepareds.containsKey(hashCode) && txPrepareds.size() >= maxVariants) {
        return false;
      }
      txPrepareds.put(hashCode, variant);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int getTxPreparedCount() {
    lock.readLock().lock();
    try {
      return txPrepareds.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Hash of the delta shape of a transaction: the sorted scanned keyspaces, each marked with
   * whether it has uncommitted writes. {@link #DELETE_HASH} when none has.
   */
  static String txHashCode(Set<String> scanned, Set<String> deltaKeyspaces) {
    List<String> names = new ArrayList<>(scanned);
    names.sort(null);
    if (names.stream().noneMatch(deltaKeyspaces::contains)) {
      return DELETE_HASH;
    }
    Hasher hasher = Hashing.murmur3_128().newHasher();
    for (String keyspace : names) {
      hasher.putString(keyspace, StandardCharsets.UTF_8);
      hasher.putBoolean(deltaKeyspaces.contains(keyspace));
    }
    return hasher.hash().toString();
  }

  public Operator getSubqueryPlan(String key) {
    Map<String, Operator> plans = subqueryPlans;
    if (plans == null) {
      return null;
    }
    lock.readLock().lock();
    try {
      return plans.get(key);
    } finally {
      lock.readLock().unlock();
    }
  }

  public void setSubqueryPlan(String key, Operator plan) {
    Map<String, Operator> plans = subqueryPlans;
    if (plans == null) {
      lock.writeLock().lock();
      try {
        if (subqueryPlans == null) {
          subqueryPlans = new HashMap<>();
        }
        plans = subqueryPlans;
      } finally {
        lock.writeLock().unlock();
      }
    }
    lock.writeLock().lock();
    try {
      plans.put(key, plan);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Copy the statement identity of another plan, as done when a stale plan is recompiled. */
  public void copyIdentity(Prepared other) {
    this.name = other.name;
    this.text = other.text;
    this.type = other.type;
    this.indexApiVersion = other.indexApiVersion;
    this.featureControls = other.featureControls;
    this.namespace = other.namespace;
    this.queryContext = other.queryContext;
    this.tenant = other.tenant;
    this.useFts = other.useFts;
    this.useCbo = other.useCbo;
  }

  @Override
  public String toString() {
    return "Prepared(" + name + ", " + text + ")";
  }
}
