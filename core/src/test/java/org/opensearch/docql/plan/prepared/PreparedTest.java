/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.docql.datastore.IndexState;
import org.opensearch.docql.datastore.KeyspacePath;
import org.opensearch.docql.datastore.TestDatastore;
import org.opensearch.docql.datastore.TestIndex;
import org.opensearch.docql.datastore.TestIndexer;
import org.opensearch.docql.datastore.TestKeyspace;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.query.Fetch;
import org.opensearch.docql.plan.query.Sequence;
import org.opensearch.docql.plan.scan.IndexScan3;
import org.opensearch.docql.plan.scan.PrimaryScan3;
import org.opensearch.docql.plan.scan.UnionScan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PreparedTest {

  private static final String ORDERS = "default:orders";

  private static final String CUSTOMERS = "default:customers";

  private TestDatastore datastore;

  private TestKeyspace orders;

  private TestIndexer ordersGsi;

  private TestIndex customerIndex;

  private KeyspaceTerm ordersTerm;

  private Prepared prepared;

  @BeforeEach
  void setUp() {
    datastore = new TestDatastore();
    orders = datastore.createKeyspace("orders");
    ordersGsi = orders.gsi();
    customerIndex = ordersGsi.createIndex("idx_customer", "customerId");
    ordersTerm = KeyspaceTerm.of(KeyspacePath.of(TestDatastore.NAMESPACE, "orders"), "o");
    prepared = new Prepared(selectPlan(false), null);
    prepared.setName("q1");
  }

  @Test
  void should_collect_scanned_keyspaces_with_delta_flag() {
    TestKeyspace customers = datastore.createKeyspace("customers");
    KeyspaceTerm customersTerm = KeyspaceTerm.of(customers.getPath(), "c");
    Operator plan =
        new Sequence(
            ImmutableList.of(
                new UnionScan(
                    ImmutableList.of(
                        IndexScan3.of(orders, ordersTerm, customerIndex, ImmutableList.of()),
                        scan(true)),
                    null,
                    null,
                    null),
                new PrimaryScan3(
                    customers, customersTerm, customers.gsi().createPrimaryIndex("#primary"),
                    null, null, false, OptimizerEstimates.UNAVAILABLE)),
            null);

    assertEquals(
        ImmutableMap.of(CUSTOMERS, false, ORDERS, true),
        new Prepared(plan, null).getIndexScanKeyspaces());
  }

  @Test
  void should_pass_metadata_check_and_stamp_versions_after_verify() {
    assertTrue(prepared.verify(datastore));

    assertEquals(ImmutableMap.of(ordersGsi.getId(), 2L), prepared.getIndexerVersions());
    assertEquals(ImmutableMap.of(orders.getId(), 1L), prepared.getKeyspaceVersions());
    int lookups = ordersGsi.getIndexByIdCalls();
    assertTrue(prepared.metadataCheck());
    assertEquals(lookups, ordersGsi.getIndexByIdCalls());
    assertEquals(2, ordersGsi.getRefreshCalls());
  }

  @Test
  void should_self_heal_after_unrelated_index_change() {
    // Given
    assertTrue(prepared.verify(datastore));

    // When
    ordersGsi.createIndex("idx_total", "total");

    // Then
    assertFalse(prepared.metadataCheck());
    assertTrue(prepared.verify(datastore));
    assertTrue(prepared.metadataCheck());
    assertEquals(ImmutableMap.of(ordersGsi.getId(), 3L), prepared.getIndexerVersions());
  }

  @Test
  void should_fail_verification_when_index_dropped() {
    assertTrue(prepared.verify(datastore));

    ordersGsi.dropIndex("idx_customer");

    assertFalse(prepared.metadataCheck());
    assertFalse(prepared.verify(datastore));
  }

  @Test
  void should_fail_verification_when_index_goes_offline() {
    ordersGsi.setState("idx_customer", IndexState.DEFERRED);

    assertFalse(prepared.verify(datastore));
  }

  @Test
  void should_fail_verification_when_keyspace_changed() {
    assertTrue(prepared.verify(datastore));

    orders.bumpVersion();

    assertFalse(prepared.metadataCheck());
    assertFalse(prepared.verify(datastore));
  }

  @Test
  void should_fail_verification_when_keyspace_recreated() {
    datastore.dropKeyspace(orders.getPath());
    TestKeyspace recreated = datastore.createKeyspace("orders");
    recreated.gsi().createIndex("idx_customer", "customerId");

    assertFalse(prepared.verify(datastore));
  }

  @Test
  void should_verify_subquery_plans() {
    TestIndex totalIndex = ordersGsi.createIndex("idx_total", "total");
    Operator subquery = IndexScan3.of(orders, ordersTerm, totalIndex, ImmutableList.of());
    prepared.setSubqueryPlan("sq1", subquery);
    assertSame(subquery, prepared.getSubqueryPlan("sq1"));
    assertNull(prepared.getSubqueryPlan("sq2"));
    assertTrue(prepared.verify(datastore));

    ordersGsi.dropIndex("idx_total");

    assertFalse(prepared.verify(datastore));
  }

  @Test
  void should_use_base_plan_outside_delta_keyspaces() {
    TxPreparedLookup lookup = prepared.getTxPrepared(ImmutableSet.of(CUSTOMERS), 2);

    assertEquals(TxPreparedLookup.Outcome.BASE, lookup.getOutcome());
    assertSame(prepared, lookup.getPrepared());
    assertTrue(lookup.isUsable());
  }

  @Test
  void should_miss_then_hit_transaction_variant() {
    // Given
    Set<String> delta = ImmutableSet.of(ORDERS);
    TxPreparedLookup miss = prepared.getTxPrepared(delta, 2);
    assertEquals(TxPreparedLookup.Outcome.MISS, miss.getOutcome());
    assertFalse(miss.isUsable());

    // When
    Prepared variant = new Prepared(selectPlan(true), null);
    assertTrue(prepared.setTxPrepared(variant, miss.getHashCode(), 16));

    // Then
    TxPreparedLookup hit = prepared.getTxPrepared(delta, 2);
    assertEquals(TxPreparedLookup.Outcome.HIT, hit.getOutcome());
    assertSame(variant, hit.getPrepared());
    assertEquals(1, prepared.getTxPreparedCount());
  }

  @Test
  void should_refuse_variants_above_keyspace_bound() {
    TxPreparedLookup lookup = prepared.getTxPrepared(ImmutableSet.of(ORDERS), 0);

    assertEquals(TxPreparedLookup.Outcome.REFUSED, lookup.getOutcome());
    assertNull(lookup.getPrepared());
  }

  @Test
  void should_use_delete_hash_for_delete_without_delta() {
    prepared.setType("delete");

    TxPreparedLookup lookup = prepared.getTxPrepared(ImmutableSet.of(), 2);

    assertEquals(TxPreparedLookup.Outcome.MISS, lookup.getOutcome());
    assertEquals(Prepared.DELETE_HASH, lookup.getHashCode());
  }

  @Test
  void should_hash_delta_shape_deterministically() {
    String hash = Prepared.txHashCode(ImmutableSet.of(ORDERS, CUSTOMERS), ImmutableSet.of(ORDERS));

    assertEquals(
        hash, Prepared.txHashCode(ImmutableSet.of(CUSTOMERS, ORDERS), ImmutableSet.of(ORDERS)));
    assertNotEquals(
        hash, Prepared.txHashCode(ImmutableSet.of(ORDERS, CUSTOMERS), ImmutableSet.of(CUSTOMERS)));
    assertNotEquals(
        hash,
        Prepared.txHashCode(
            ImmutableSet.of(ORDERS, CUSTOMERS), ImmutableSet.of(ORDERS, CUSTOMERS)));
    assertEquals(
        Prepared.DELETE_HASH,
        Prepared.txHashCode(ImmutableSet.of(ORDERS), ImmutableSet.of("default:other")));
  }

  @Test
  void should_bound_number_of_variants() {
    Prepared variant = new Prepared(selectPlan(true), null);

    assertTrue(prepared.setTxPrepared(variant, "h1", 1));
    assertFalse(prepared.setTxPrepared(variant, "h2", 1));
    assertTrue(prepared.setTxPrepared(variant, "h1", 1));
    assertEquals(1, prepared.getTxPreparedCount());
  }

  @Test
  void should_compare_plan_version() {
    assertEquals(PlanVersion.EQUAL, prepared.comparePlanVersion());
    prepared.setPlanVersion(PlanVersion.CURRENT - 1);
    assertEquals(PlanVersion.BEHIND, prepared.comparePlanVersion());
    prepared.setPlanVersion(PlanVersion.CURRENT + 1);
    assertEquals(PlanVersion.AHEAD, prepared.comparePlanVersion());
  }

  @Test
  void should_copy_statement_identity() {
    prepared.setText("SELECT * FROM orders");
    prepared.setQueryContext("default:shop.sales");
    prepared.setUseCbo(true);
    Prepared recompiled = new Prepared(selectPlan(false), null);

    recompiled.copyIdentity(prepared);

    assertEquals("q1", recompiled.getName());
    assertEquals("SELECT * FROM orders", recompiled.getText());
    assertEquals("default:shop.sales", recompiled.getQueryContext());
    assertTrue(recompiled.isUseCbo());
  }

  private Operator selectPlan(boolean hasDeltaKeyspace) {
    return new Sequence(
        ImmutableList.of(
            scan(hasDeltaKeyspace), new Fetch(orders, ordersTerm, ImmutableList.of(), null)),
        null);
  }

  private IndexScan3 scan(boolean hasDeltaKeyspace) {
    return new IndexScan3(
        orders, ordersTerm, customerIndex, ImmutableList.of(), false, false, false, null,
        ImmutableList.of(), null, null, ImmutableList.of(), ImmutableMap.of(), null,
        hasDeltaKeyspace, null, OptimizerEstimates.UNAVAILABLE);
  }
}
