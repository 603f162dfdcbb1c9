/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.prepareds;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.docql.common.codec.GzipBase64TextCodec;
import org.opensearch.docql.config.PlannerSettings;
import org.opensearch.docql.datastore.TestDatastore;
import org.opensearch.docql.datastore.TestIndex;
import org.opensearch.docql.datastore.TestIndexer;
import org.opensearch.docql.datastore.TestKeyspace;
import org.opensearch.docql.expression.DefaultExpressionParser;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.OperatorRegistry;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.exceptions.UnresolvedReferenceException;
import org.opensearch.docql.plan.prepared.Prepared;
import org.opensearch.docql.plan.prepared.PreparedCodec;
import org.opensearch.docql.plan.prepared.TxPreparedLookup;
import org.opensearch.docql.plan.scan.IndexScan3;
import org.opensearch.docql.prepareds.exceptions.NoSuchPreparedException;
import org.opensearch.docql.prepareds.exceptions.PreparedEncodingMismatchException;
import org.opensearch.docql.prepareds.exceptions.PreparedNameException;
import org.opensearch.docql.prepareds.exceptions.ReprepareException;

@ExtendWith(MockitoExtension.class)
class PreparedCacheTest {

  private static final String TEXT = "SELECT * FROM orders";

  private static final Set<PreparedOption> NONE = EnumSet.noneOf(PreparedOption.class);

  private static final Set<PreparedOption> VERIFY = EnumSet.of(PreparedOption.VERIFY);

  @Mock private Repreparer repreparer;

  private TestDatastore datastore;

  private TestKeyspace orders;

  private TestIndexer gsi;

  private TestIndex customerIndex;

  private KeyspaceTerm term;

  private PlannerSettings settings;

  private PreparedCodec codec;

  private PreparedCache cache;

  @BeforeEach
  public void setup() {
    datastore = new TestDatastore();
    orders = datastore.createKeyspace("orders");
    gsi = orders.gsi();
    customerIndex = gsi.createIndex("idx_customer", "customerId");
    term = KeyspaceTerm.of(orders.getPath(), "o");
    settings = new PlannerSettings();
    codec =
        new PreparedCodec(
            new GzipBase64TextCodec(),
            new PlanDecodingContext(
                datastore, new DefaultExpressionParser(), new OperatorRegistry()));
    cache = new PreparedCache(settings, datastore, codec, repreparer);
  }

  @Test
  void testAddAndGetPrepared() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);

    assertSame(prepared, cache.getPrepared("q1", "", null, NONE));
    assertEquals(1, cache.count());
    assertEquals(ImmutableList.of("q1"), cache.names());
  }

  @Test
  void testGetUnknownPrepared() {
    NoSuchPreparedException e =
        assertThrows(
            NoSuchPreparedException.class, () -> cache.getPrepared("q1", "", null, VERIFY));
    assertEquals("No such prepared statement: q1", e.getMessage());
  }

  @Test
  void testQueryContextIsPartOfTheKey() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    prepared.setQueryContext("default:shop.sales");
    cache.addPrepared(prepared);

    assertEquals(ImmutableList.of("q1(default:shop.sales)"), cache.names());
    assertSame(prepared, cache.getPrepared("q1", "default:shop.sales", null, NONE));
    assertThrows(NoSuchPreparedException.class, () -> cache.getPrepared("q1", "", null, NONE));
  }

  @Test
  void testFirstLookupVerifiesAndLaterLookupsOnlyCompareVersions() {
    // Given
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    int lookups = gsi.getIndexByIdCalls();
    int refreshes = gsi.getRefreshCalls();

    // When
    assertSame(prepared, cache.getPrepared("q1", "", null, VERIFY));

    // Then
    assertEquals(lookups + 1, gsi.getIndexByIdCalls());
    assertTrue(cache.getEntry("q1").orElseThrow().isPopulated());

    // When
    assertSame(prepared, cache.getPrepared("q1", "", null, VERIFY));

    // Then
    assertEquals(lookups + 1, gsi.getIndexByIdCalls());
    assertEquals(refreshes + 2, gsi.getRefreshCalls());
    verifyNoInteractions(repreparer);
  }

  @Test
  void testChangedIndexerIsVerifiedAgainWithoutRepreparing() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    cache.getPrepared("q1", "", null, VERIFY);
    gsi.createIndex("idx_total", "total");
    int lookups = gsi.getIndexByIdCalls();

    assertSame(prepared, cache.getPrepared("q1", "", null, VERIFY));

    assertEquals(lookups + 1, gsi.getIndexByIdCalls());
    verifyNoInteractions(repreparer);
  }

  @Test
  void testStalePlanIsPreparedAgain() {
    // Given
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    cache.getPrepared("q1", "", null, VERIFY);
    gsi.dropIndex("idx_customer");
    TestIndex replacement = gsi.createIndex("idx_customer_v2", "customerId");
    Prepared fresh =
        new Prepared(IndexScan3.of(orders, term, replacement, ImmutableList.of()), null);
    when(repreparer.reprepare(same(prepared), isNull())).thenReturn(fresh);

    // When
    Prepared result = cache.getPrepared("q1", "", null, VERIFY);

    // Then
    assertSame(fresh, result);
    assertEquals("q1", fresh.getName());
    assertEquals(TEXT, fresh.getText());
    assertNotNull(fresh.getEncodedPlan());
    assertSame(fresh, cache.getPrepared("q1", "", null, NONE));
    assertFalse(cache.getEntry("q1").orElseThrow().isPopulated());
  }

  @Test
  void testStalePlanWithMetadataCheckOnlyIsNotFound() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    gsi.dropIndex("idx_customer");

    assertThrows(
        NoSuchPreparedException.class,
        () -> cache.getPrepared("q1", "", null, EnumSet.of(PreparedOption.METACHECK)));
    verifyNoInteractions(repreparer);
  }

  @Test
  void testRepreparerFailureIsReported() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    gsi.dropIndex("idx_customer");
    IllegalStateException cause = new IllegalStateException("keyspace is gone");
    when(repreparer.reprepare(any(), any())).thenThrow(cause);

    ReprepareException e =
        assertThrows(ReprepareException.class, () -> cache.getPrepared("q1", "", null, VERIFY));
    assertSame(cause, e.getCause());
  }

  @Test
  void testRepreparerWithoutPlanIsReported() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    gsi.dropIndex("idx_customer");
    when(repreparer.reprepare(any(), any())).thenReturn(null);

    assertThrows(ReprepareException.class, () -> cache.getPrepared("q1", "", null, VERIFY));
  }

  @Test
  void testDuplicateNameWithOtherTextIsRejected() {
    cache.addPrepared(prepared("q1", TEXT, customerIndex));
    Prepared same = prepared("q1", TEXT, customerIndex);

    cache.addPrepared(same);
    assertSame(same, cache.getPrepared("q1", "", null, NONE));

    PreparedNameException e =
        assertThrows(
            PreparedNameException.class,
            () -> cache.addPrepared(prepared("q1", "SELECT 1", customerIndex)));
    assertEquals("duplicate name: q1", e.getMessage());
  }

  @Test
  void testDeletePrepared() {
    cache.addPrepared(prepared("q1", TEXT, customerIndex));

    cache.deletePrepared("q1");

    assertEquals(0, cache.count());
    assertThrows(NoSuchPreparedException.class, () -> cache.deletePrepared("q1"));
  }

  @Test
  void testDecodePreparedCachesVerifiedPlan() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    String encoded = codec.buildEncodedPlan(prepared);

    Prepared decoded = cache.decodePrepared("q1", "", encoded, true);

    assertEquals(TEXT, decoded.getText());
    assertSame(decoded, cache.getPrepared("q1", "", null, NONE));
    CacheEntry entry = cache.getEntry("q1").orElseThrow();
    assertTrue(entry.isPopulated());
    assertEquals(1, entry.getUses());
    assertNotNull(entry.getLastUse());
  }

  @Test
  void testDecodePreparedInQueryContext() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    prepared.setQueryContext("default:shop.sales");
    String encoded = codec.buildEncodedPlan(prepared);

    cache.decodePrepared("q1", "default:shop.sales", encoded, false);

    assertEquals(ImmutableList.of("q1(default:shop.sales)"), cache.names());
    assertThrows(
        PreparedEncodingMismatchException.class,
        () -> cache.decodePrepared("q1", "default:shop.other", encoded, false));
  }

  @Test
  void testDecodePreparedWithOtherNameIsRejected() {
    String encoded = codec.buildEncodedPlan(prepared("q1", TEXT, customerIndex));

    PreparedEncodingMismatchException e =
        assertThrows(
            PreparedEncodingMismatchException.class,
            () -> cache.decodePrepared("q2", "", encoded, false));
    assertEquals("Name q2 does not match encoded name q1", e.getMessage());
  }

  @Test
  void testDecodePreparedOfOtherStatementUnderSameNameIsRejected() {
    cache.addPrepared(prepared("q1", "SELECT 1", customerIndex));
    String encoded = codec.buildEncodedPlan(prepared("q1", TEXT, customerIndex));

    assertThrows(
        PreparedEncodingMismatchException.class,
        () -> cache.decodePrepared("q1", "", encoded, false));
  }

  @Test
  void testEmptyEncodedPlanFallsBackToLookup() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);

    assertSame(prepared, cache.decodePrepared("q1", "", GzipBase64TextCodec.EMPTY, false));
    assertSame(prepared, cache.decodePrepared("q1", "", "", true));
    assertEquals(1, cache.getEntry("q1").orElseThrow().getUses());
    assertThrows(
        NoSuchPreparedException.class,
        () -> cache.decodePrepared("q2", "", GzipBase64TextCodec.EMPTY, false));
  }

  @Test
  void testDecodePreparedOverDroppedIndexFails() {
    String encoded = codec.buildEncodedPlan(prepared("q1", TEXT, customerIndex));
    gsi.dropIndex("idx_customer");

    assertThrows(
        UnresolvedReferenceException.class, () -> cache.decodePrepared("q1", "", encoded, false));
  }

  @Test
  void testAutoPreparePlan() {
    PrepareContext context = context(false, null);
    String name = cache.getAutoPrepareName(TEXT, context);
    Prepared prepared = prepared(name, TEXT, customerIndex);

    assertFalse(cache.addAutoPreparePlan("EXPLAIN", 0, prepared));
    assertFalse(cache.addAutoPreparePlan("SELECT", 1, prepared));
    assertTrue(cache.addAutoPreparePlan("select", 0, prepared));

    assertSame(prepared, cache.getAutoPreparePlan(name, TEXT, "default", context));
    assertNull(cache.getAutoPreparePlan(name, "SELECT 1", "default", context));
    assertNull(cache.getAutoPreparePlan(name, TEXT, "default", context(true, null)));
    assertNull(cache.getAutoPreparePlan(name, TEXT, "other", context));
    assertNull(cache.getAutoPreparePlan("unknown", TEXT, "default", context));
    assertEquals(5, cache.getEntry(name).orElseThrow().getUses());
  }

  @Test
  void testStaleAutoPreparePlanIsNotUsed() {
    PrepareContext context = context(false, null);
    String name = cache.getAutoPrepareName(TEXT, context);
    cache.addAutoPreparePlan("SELECT", 0, prepared(name, TEXT, customerIndex));
    gsi.dropIndex("idx_customer");

    assertNull(cache.getAutoPreparePlan(name, TEXT, "default", context));
    verifyNoInteractions(repreparer);
  }

  @Test
  void testGetPlanChecksTextAndSettings() {
    PrepareContext context = context(false, "");
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);

    assertSame(prepared, cache.getPlan("q1", TEXT, "default", context));
    assertNull(cache.getPlan("q1", "SELECT 1", "default", context));
    assertNull(cache.getPlan("q1", TEXT, "default", context(true, "")));
    assertNull(cache.getPlan("q2", TEXT, "default", context));
  }

  @Test
  void testTransactionVariantIsPreparedOnceAndShared() {
    // Given
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    Set<String> delta = ImmutableSet.of("default:orders");
    Prepared variant =
        new Prepared(IndexScan3.of(orders, term, customerIndex, ImmutableList.of()), null);
    when(repreparer.reprepare(same(prepared), eq(delta))).thenReturn(variant);

    // When
    Prepared first = cache.getPrepared("q1", "", delta, VERIFY);
    Prepared second = cache.getPrepared("q1", "", delta, VERIFY);

    // Then
    assertSame(variant, first);
    assertSame(variant, second);
    assertSame(prepared, cache.getPrepared("q1", "", ImmutableSet.of(), VERIFY));
    assertSame(prepared, cache.getPrepared("q1", "", ImmutableSet.of("default:other"), VERIFY));
    verify(repreparer, times(1)).reprepare(any(), any());
    assertEquals(1, prepared.getTxPreparedCount());
  }

  @Test
  void testDeleteWithoutDeltaUsesDeleteVariant() {
    // Given
    Prepared prepared = prepared("d1", "DELETE FROM orders", customerIndex);
    prepared.setType("DELETE");
    cache.addPrepared(prepared);
    Set<String> delta = ImmutableSet.of();
    Prepared variant =
        new Prepared(IndexScan3.of(orders, term, customerIndex, ImmutableList.of()), null);
    when(repreparer.reprepare(same(prepared), eq(delta))).thenReturn(variant);

    // When
    Prepared first = cache.getPrepared("d1", "", delta, VERIFY);
    Prepared second = cache.getPrepared("d1", "", delta, VERIFY);

    // Then
    assertSame(variant, first);
    assertSame(variant, second);
    TxPreparedLookup lookup =
        prepared.getTxPrepared(delta, settings.getMaxTxPreparedKeyspaces());
    assertEquals(TxPreparedLookup.Outcome.HIT, lookup.getOutcome());
    assertEquals(Prepared.DELETE_HASH, lookup.getHashCode());
    verify(repreparer, times(1)).reprepare(any(), any());
  }

  @Test
  void testRefusedTransactionVariantIsPreparedOnEveryLookup() {
    // Given
    settings.setMaxTxPreparedKeyspaces(0);
    PreparedCache strict = new PreparedCache(settings, datastore, codec, repreparer);
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    strict.addPrepared(prepared);
    Set<String> delta = ImmutableSet.of("default:orders");
    when(repreparer.reprepare(same(prepared), eq(delta)))
        .thenAnswer(
            invocation ->
                new Prepared(IndexScan3.of(orders, term, customerIndex, ImmutableList.of()), null));

    // When
    Prepared first = strict.getPrepared("q1", "", delta, VERIFY);
    Prepared second = strict.getPrepared("q1", "", delta, VERIFY);

    // Then
    assertNotSame(first, second);
    assertNotSame(prepared, first);
    verify(repreparer, times(2)).reprepare(any(), any());
    assertEquals(0, prepared.getTxPreparedCount());
  }

  @Test
  void testConcurrentFirstLookupsVerifyOnce() throws Exception {
    // Given
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    int lookups = gsi.getIndexByIdCalls();
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Prepared>> results = new ArrayList<>();

    // When
    try {
      for (int i = 0; i < threads; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return cache.getPrepared("q1", "", null, VERIFY);
                }));
      }
      start.countDown();
      for (Future<Prepared> result : results) {
        assertSame(prepared, result.get(10, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }

    // Then
    assertEquals(lookups + 1, gsi.getIndexByIdCalls());
    assertTrue(cache.getEntry("q1").orElseThrow().isPopulated());
    verifyNoInteractions(repreparer);
  }

  @Test
  void testRecordPreparedMetrics() {
    Prepared prepared = prepared("q1", TEXT, customerIndex);
    cache.addPrepared(prepared);
    CacheEntry entry = cache.getEntry("q1").orElseThrow();
    assertEquals(Duration.ZERO, entry.getMinServiceTime());

    cache.recordPreparedMetrics(prepared, Duration.ofMillis(30), Duration.ofMillis(20));
    cache.recordPreparedMetrics(prepared, Duration.ofMillis(10), Duration.ofMillis(5));

    assertEquals(Duration.ofMillis(40), entry.getRequestTime());
    assertEquals(Duration.ofMillis(10), entry.getMinRequestTime());
    assertEquals(Duration.ofMillis(30), entry.getMaxRequestTime());
    assertEquals(Duration.ofMillis(25), entry.getServiceTime());
    assertEquals(Duration.ofMillis(5), entry.getMinServiceTime());
    assertEquals(Duration.ofMillis(20), entry.getMaxServiceTime());
  }

  @Test
  void testCacheIsBounded() {
    settings.setPreparedCacheLimit(2);
    PreparedCache small = new PreparedCache(settings, datastore, codec, repreparer);

    for (int i = 0; i < 5; i++) {
      small.addPrepared(prepared("q" + i, TEXT, customerIndex));
    }

    assertEquals(2, small.getLimit());
    assertTrue(small.count() <= 2);
  }

  @Test
  void testNameIsVersion5UuidOfTextAndSettings() {
    PrepareContext context = new PrepareContext(3, 0x4c, false, false, "", null);

    String name = cache.getName(TEXT, "default", context);

    assertEquals("06d7941e-8277-5995-8c8c-fafdb79e722c", name);
    assertEquals(5, UUID.fromString(name).version());
    assertEquals(name, cache.getName(TEXT, "default", context));
    context.setQueryContext("default:shop.sales");
    assertEquals(name, cache.getName(TEXT, "default", context));
    context.setUseCbo(true);
    assertNotEquals(name, cache.getName(TEXT, "default", context));
  }

  @Test
  void testNewContextDefaultsToConfiguredIndexApiVersion() {
    settings.setIndexApiVersion(4);

    PrepareContext defaulted = cache.newContext(null, 0x4c, false, true, "", null);
    PrepareContext named = cache.newContext(2, 0x4c, false, true, "", null);

    assertEquals(4, defaulted.getIndexApiVersion());
    assertEquals(0x4c, defaulted.getFeatureControls());
    assertTrue(defaulted.isUseCbo());
    assertEquals(2, named.getIndexApiVersion());
    assertNotEquals(
        cache.getName(TEXT, "default", defaulted), cache.getName(TEXT, "default", named));
  }

  @Test
  void testAutoPrepareNameDependsOnQueryContext() {
    assertNotEquals(
        cache.getAutoPrepareName(TEXT, context(false, "")),
        cache.getAutoPrepareName(TEXT, context(false, "default:shop.sales")));
  }

  @Test
  void testGetTextStripsForce() {
    String text = "PREPARE FORCE p1 FROM SELECT 1";

    assertEquals("PREPARE p1 FROM SELECT 1", PreparedCache.getText(text, text.indexOf("SELECT")));
    assertEquals(
        "PREPARE p1 FROM SELECT 1",
        PreparedCache.getText("PREPARE p1 FROM SELECT 1", "PREPARE p1 FROM ".length()));
  }

  private Prepared prepared(String name, String text, TestIndex index) {
    Prepared prepared =
        new Prepared(IndexScan3.of(orders, term, index, ImmutableList.of()), null);
    prepared.setName(name);
    prepared.setText(text);
    prepared.setType("SELECT");
    prepared.setNamespace("default");
    prepared.setIndexApiVersion(3);
    return prepared;
  }

  private static PrepareContext context(boolean useCbo, String queryContext) {
    return new PrepareContext(3, 0, false, useCbo, queryContext, null);
  }
}
