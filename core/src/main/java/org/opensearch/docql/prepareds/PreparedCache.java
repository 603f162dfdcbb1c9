/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds;

import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.docql.common.codec.GzipBase64TextCodec;
import org.opensearch.docql.common.utils.StringUtils;
import org.opensearch.docql.config.PlannerSettings;
import org.opensearch.docql.datastore.Datastore;
import org.opensearch.docql.plan.exceptions.PlanException;
import org.opensearch.docql.plan.prepared.Prepared;
import org.opensearch.docql.plan.prepared.PreparedCodec;
import org.opensearch.docql.plan.prepared.TxPreparedLookup;
import org.opensearch.docql.prepareds.exceptions.NoSuchPreparedException;
import org.opensearch.docql.prepareds.exceptions.PreparedEncodingMismatchException;
import org.opensearch.docql.prepareds.exceptions.PreparedNameException;
import org.opensearch.docql.prepareds.exceptions.ReprepareException;

/**
 * Named prepared plans, bounded in size with least recently used eviction.
 *
 * <p>Entries are keyed by {@code name(queryContext)}, or by the bare name when there is no query
 * context. A lookup with {@link PreparedOption#VERIFY} makes sure the plan is still valid before
 * returning it: the first lookup of an entry verifies the plan in full and records metadata
 * versions; later lookups only compare versions, and verify again when they moved. A plan that
 * fails verification is recompiled through the {@link Repreparer} and replaces the cached one.
 */
@Log4j2
public class PreparedCache {

  /** Namespace of the realm identifiers statement names are derived under. */
  private static final UUID NAME_NAMESPACE =
      UUID.fromString("6ba7b811-9dad-11d1-80b4-00c04fd430c8");

  /** Statement types that are never cached by auto-prepare. */
  private static final Set<String> NOT_AUTO_PREPARED =
      ImmutableSet.of("EXPLAIN", "EXECUTE", "PREPARE");

  @Getter private final PlannerSettings settings;

  private final Datastore datastore;

  private final PreparedCodec codec;

  private final Repreparer repreparer;

  private final Cache<String, CacheEntry> cache;

  public PreparedCache(
      PlannerSettings settings, Datastore datastore, PreparedCodec codec, Repreparer repreparer) {
    this.settings = settings;
    this.datastore = datastore;
    this.codec = codec;
    this.repreparer = repreparer;
    this.cache = CacheBuilder.newBuilder().maximumSize(settings.getPreparedCacheLimit()).build();
  }

  public int getLimit() {
    return settings.getPreparedCacheLimit();
  }

  /**
   * Settings to prepare a request under. A request that does not name an index API version gets
   * the configured one.
   */
  public PrepareContext newContext(
      Integer indexApiVersion,
      long featureControls,
      boolean useFts,
      boolean useCbo,
      String queryContext,
      Set<String> deltaKeyspaces) {
    return new PrepareContext(
        indexApiVersion == null ? settings.getIndexApiVersion() : indexApiVersion,
        featureControls,
        useFts,
        useCbo,
        queryContext,
        deltaKeyspaces);
  }

  /** Cache key of a statement name within a query context. */
  public static String encodeName(String name, String queryContext) {
    if (Strings.isNullOrEmpty(queryContext)) {
      return name;
    }
    return name + "(" + queryContext + ")";
  }

  /**
   * Name of a prepared statement. The name depends on the text and on the settings the statement
   * is prepared under, so that one text prepared differently can be cached several times; it does
   * not depend on the query context.
   */
  public String getName(String text, String namespace, PrepareContext context) {
    return uuidV5(realm(context, namespace), text);
  }

  /** Name under which an ad hoc statement is cached by auto-prepare. */
  public String getAutoPrepareName(String text, PrepareContext context) {
    return uuidV5(realm(context, Strings.nullToEmpty(context.getQueryContext())), text);
  }

  private static String realm(PrepareContext context, String suffix) {
    return Long.toString(context.getIndexApiVersion(), 16)
        + "_"
        + Long.toString(context.getFeatureControls(), 16)
        + "_"
        + context.isUseFts()
        + "_"
        + context.isUseCbo()
        + "_"
        + Strings.nullToEmpty(suffix);
  }

  private static String uuidV5(String realm, String text) {
    return nameBasedUuid(nameBasedUuid(NAME_NAMESPACE, realm), text).toString();
  }

  /** Version 5 UUID of the name within the namespace. SHA-1 is what the UUID format prescribes. */
  @SuppressWarnings("deprecation")
  private static UUID nameBasedUuid(UUID namespace, String name) {
    byte[] prefix =
        ByteBuffer.allocate(16)
            .putLong(namespace.getMostSignificantBits())
            .putLong(namespace.getLeastSignificantBits())
            .array();
    byte[] hash =
        Hashing.sha1()
            .newHasher()
            .putBytes(prefix)
            .putString(name, StandardCharsets.UTF_8)
            .hash()
            .asBytes();
    hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
    hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);
    ByteBuffer bits = ByteBuffer.wrap(hash, 0, 16);
    return new UUID(bits.getLong(), bits.getLong());
  }

  /**
   * Statement text of a {@code PREPARE} without its {@code FORCE} option, so that forcing a
   * prepare does not make the text differ from the cached one.
   *
   * @param text full {@code PREPARE} text
   * @param offset start of the prepared statement within the text
   */
  public static String getText(String text, int offset) {
    String prepare = text.substring(0, offset);
    int i = prepare.toUpperCase(Locale.ROOT).indexOf("FORCE");
    if (i < 0) {
      return text;
    }
    if (i + 6 >= offset) {
      return prepare.substring(0, i) + text.substring(offset);
    }
    return prepare.substring(0, i) + prepare.substring(i + 6) + text.substring(offset);
  }

  /**
   * The verified plan of a statement, provided it was prepared with the same text and settings.
   *
   * @return the plan, or null if there is none for these text and settings
   */
  public Prepared getPlan(String name, String text, String namespace, PrepareContext context) {
    Prepared prepared;
    try {
      prepared =
          getPrepared(
              name,
              context.getQueryContext(),
              context.getDeltaKeyspaces(),
              EnumSet.of(PreparedOption.VERIFY));
    } catch (NoSuchPreparedException e) {
      return null;
    }
    if (!context.matches(prepared)
        || !Objects.equals(prepared.getNamespace(), namespace)
        || !Objects.equals(
            Strings.nullToEmpty(prepared.getQueryContext()),
            Strings.nullToEmpty(context.getQueryContext()))
        || !Objects.equals(prepared.getText(), text)) {
      return null;
    }
    return prepared;
  }

  /**
   * Look up a prepared plan.
   *
   * @param name statement name
   * @param queryContext query context the statement was prepared in, or empty
   * @param deltaKeyspaces keyspaces with uncommitted transaction writes, or null outside of a
   *     transaction
   * @param options lookup options
   * @return the plan to execute, a transaction variant inside a transaction
   * @throws NoSuchPreparedException if nothing is cached under the name, or the plan is stale and
   *     {@link PreparedOption#METACHECK} was requested
   * @throws ReprepareException if a stale plan could not be recompiled
   */
  public Prepared getPrepared(
      String name, String queryContext, Set<String> deltaKeyspaces, Set<PreparedOption> options) {
    Prepared prepared = getCached(name, queryContext, options);
    if (deltaKeyspaces != null && (!deltaKeyspaces.isEmpty() || prepared.isDelete())) {
      prepared = getTxPrepared(prepared, deltaKeyspaces);
    }
    return prepared;
  }

  private Prepared getCached(String name, String queryContext, Set<PreparedOption> options) {
    boolean track = options.contains(PreparedOption.TRACK);
    boolean metaCheck = options.contains(PreparedOption.METACHECK);
    boolean verify = metaCheck || options.contains(PreparedOption.VERIFY);

    String fullName = encodeName(name, queryContext);
    CacheEntry entry = lookup(fullName, track);
    if (entry == null) {
      throw new NoSuchPreparedException("No such prepared statement: " + fullName);
    }
    Prepared prepared = entry.getPrepared();
    if (!verify) {
      return prepared;
    }

    boolean good;
    if (entry.isPopulated()) {
      good = prepared.metadataCheck();
      if (!good && !metaCheck) {
        good = prepared.verify(datastore);
      }
    } else {
      entry.getLock().lock();
      try {
        good = entry.isPopulated() || prepared.verify(datastore);
        if (good) {
          entry.setPopulated(true);
        }
      } finally {
        entry.getLock().unlock();
      }
    }
    if (good) {
      return prepared;
    }

    if (metaCheck) {
      log.debug("Prepared statement {} is stale", fullName);
      throw new NoSuchPreparedException("Prepared statement is stale: " + fullName);
    }
    log.debug("Prepared statement {} is stale, preparing it again", fullName);
    Prepared fresh = reprepare(prepared, null);
    addPrepared(fresh);
    return fresh;
  }

  private CacheEntry lookup(String fullName, boolean track) {
    CacheEntry entry = cache.getIfPresent(fullName);
    if (entry != null && track) {
      entry.recordUse(Instant.now());
    }
    return entry;
  }

  private Prepared getTxPrepared(Prepared prepared, Set<String> deltaKeyspaces) {
    TxPreparedLookup lookup =
        prepared.getTxPrepared(deltaKeyspaces, settings.getMaxTxPreparedKeyspaces());
    switch (lookup.getOutcome()) {
      case BASE:
      case HIT:
        return lookup.getPrepared();
      case MISS:
        Prepared variant = reprepare(prepared, deltaKeyspaces);
        if (!prepared.setTxPrepared(
            variant, lookup.getHashCode(), settings.getMaxTxPreparedVariants())) {
          log.debug("Transaction variants of {} are full", prepared.getName());
        }
        return variant;
      default:
        return reprepare(prepared, deltaKeyspaces);
    }
  }

  /**
   * Cache a plan, replacing a plan of the same statement.
   *
   * @throws PreparedNameException if the name is taken by a different statement
   */
  public void addPrepared(Prepared prepared) {
    boolean added =
        add(prepared, false, false, entry -> sameText(entry.getPrepared(), prepared));
    if (!added) {
      throw new PreparedNameException(
          "duplicate name: " + encodeName(prepared.getName(), prepared.getQueryContext()));
    }
  }

  /** @throws NoSuchPreparedException if nothing is cached under the name */
  public void deletePrepared(String fullName) {
    if (cache.asMap().remove(fullName) == null) {
      throw new NoSuchPreparedException("No such prepared statement: " + fullName);
    }
  }

  /**
   * Cache a plan received in encoded form. The plan is verified, and recompiled when stale, since
   * it may have been encoded against other metadata.
   *
   * @param name statement name the plan was submitted for
   * @param queryContext query context the plan was submitted for, or empty
   * @param encoded encoded plan
   * @param track count the decoding as a use of the statement
   * @throws org.opensearch.docql.plan.exceptions.PlanDecodingException if the plan is malformed
   * @throws PreparedEncodingMismatchException if the plan is not the one of the named statement
   */
  public Prepared decodePrepared(String name, String queryContext, String encoded, boolean track) {
    if (Strings.isNullOrEmpty(encoded) || GzipBase64TextCodec.EMPTY.equals(encoded)) {
      return getPrepared(
          name,
          queryContext,
          null,
          track
              ? EnumSet.of(PreparedOption.TRACK, PreparedOption.VERIFY)
              : EnumSet.of(PreparedOption.VERIFY));
    }

    Prepared prepared = codec.decode(encoded);
    if (!Strings.isNullOrEmpty(queryContext)) {
      if (!name.equals(prepared.getName())) {
        throw nameMismatch(name, prepared.getName());
      }
      if (!queryContext.equals(prepared.getQueryContext())) {
        throw new PreparedEncodingMismatchException(
            StringUtils.format(
                "Query context %s of %s does not match encoded query context %s",
                queryContext, name, prepared.getQueryContext()));
      }
    } else {
      String encodedName = encodeName(prepared.getName(), prepared.getQueryContext());
      if (!name.equals(encodedName)) {
        throw nameMismatch(name, encodedName);
      }
    }

    boolean good = prepared.verify(datastore);
    if (!good) {
      prepared = reprepare(prepared, null);
    }
    Prepared decoded = prepared;
    boolean added =
        add(
            decoded,
            good,
            track,
            entry -> entry.getPrepared() == decoded || sameText(entry.getPrepared(), decoded));
    if (!added) {
      throw new PreparedEncodingMismatchException(
          "Encoded plan does not match the statement cached as " + name);
    }
    return decoded;
  }

  private static PreparedEncodingMismatchException nameMismatch(String name, String encodedName) {
    return new PreparedEncodingMismatchException(
        StringUtils.format("Name %s does not match encoded name %s", name, encodedName));
  }

  /**
   * Cached plan of an ad hoc statement. Only metadata versions are checked: a plan that is still
   * valid but may no longer be the best one is not used.
   *
   * @return the plan, or null if the statement must be planned
   */
  public Prepared getAutoPreparePlan(
      String name, String text, String namespace, PrepareContext context) {
    Prepared prepared;
    try {
      prepared =
          getPrepared(
              name,
              "",
              context.getDeltaKeyspaces(),
              EnumSet.of(PreparedOption.TRACK, PreparedOption.METACHECK));
    } catch (NoSuchPreparedException e) {
      return null;
    } catch (PlanException e) {
      log.info("Auto prepare plan fetching failed for {}", name, e);
      return null;
    }
    if (!Objects.equals(text, prepared.getText())) {
      log.info("Auto prepare found mismatching name and statement {} {}", name, text);
      return null;
    }
    if (!context.matches(prepared) || !Objects.equals(prepared.getNamespace(), namespace)) {
      return null;
    }
    return prepared;
  }

  /**
   * Cache the plan of an ad hoc statement. Statements that explain, execute or prepare, and
   * statements with parameters, are not cached.
   *
   * @param statementType type of the statement, such as {@code SELECT}
   * @param parameterCount number of parameters of the statement
   * @return true if the plan was cached
   */
  public boolean addAutoPreparePlan(String statementType, int parameterCount, Prepared prepared) {
    if (Strings.isNullOrEmpty(statementType)
        || NOT_AUTO_PREPARED.contains(statementType.toUpperCase(Locale.ROOT))
        || parameterCount > 0) {
      return false;
    }
    return add(
        prepared,
        false,
        true,
        entry -> {
          boolean same = sameText(entry.getPrepared(), prepared);
          if (!same) {
            log.info(
                "Auto prepare found mismatching name and statement {} {} {}",
                prepared.getName(), prepared.getText(), entry.getPrepared().getText());
          }
          return same;
        });
  }

  /**
   * Insert the plan, or amend the existing entry of the same key when {@code amend} accepts it.
   *
   * @return false if an existing entry refused the plan
   */
  private boolean add(
      Prepared prepared, boolean populated, boolean track, Predicate<CacheEntry> amend) {
    String fullName = encodeName(prepared.getName(), prepared.getQueryContext());
    Instant when = Instant.now();
    boolean[] added = {true};
    cache
        .asMap()
        .compute(
            fullName,
            (key, entry) -> {
              if (entry == null) {
                CacheEntry created = new CacheEntry(prepared, populated);
                if (track) {
                  created.recordUse(when);
                }
                return created;
              }
              if (!amend.test(entry)) {
                added[0] = false;
                return entry;
              }
              entry.setPrepared(prepared);
              entry.setPopulated(false);
              if (track) {
                entry.recordUse(when);
              }
              return entry;
            });
    return added[0];
  }

  private Prepared reprepare(Prepared prepared, Set<String> deltaKeyspaces) {
    Prepared fresh;
    try {
      fresh = repreparer.reprepare(prepared, deltaKeyspaces);
    } catch (ReprepareException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ReprepareException(
          StringUtils.format("Unable to prepare %s again: %s", prepared.getName(), e.getMessage()),
          e);
    }
    if (fresh == null) {
      throw new ReprepareException("Unable to prepare " + prepared.getName() + " again");
    }
    fresh.copyIdentity(prepared);
    if (fresh.getEncodedPlan() == null) {
      codec.buildEncodedPlan(fresh);
    }
    return fresh;
  }

  private static boolean sameText(Prepared cached, Prepared prepared) {
    return Objects.equals(cached.getText(), prepared.getText());
  }

  /** Add the execution times of a run of the plan to the statistics of its entry. */
  public void recordPreparedMetrics(Prepared prepared, Duration requestTime, Duration serviceTime) {
    if (prepared == null || Strings.isNullOrEmpty(prepared.getName())) {
      return;
    }
    CacheEntry entry =
        cache.getIfPresent(encodeName(prepared.getName(), prepared.getQueryContext()));
    if (entry != null) {
      entry.recordTimes(requestTime, serviceTime);
    }
  }

  public Optional<CacheEntry> getEntry(String fullName) {
    return Optional.ofNullable(cache.getIfPresent(fullName));
  }

  public long count() {
    return cache.size();
  }

  public List<String> names() {
    return ImmutableList.copyOf(cache.asMap().keySet());
  }

  public void forEach(BiConsumer<String, CacheEntry> action) {
    cache.asMap().forEach(action);
  }
}
