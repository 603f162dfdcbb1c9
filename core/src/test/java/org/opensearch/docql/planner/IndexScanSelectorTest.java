/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.docql.datastore.IndexState;
import org.opensearch.docql.datastore.IndexType;
import org.opensearch.docql.datastore.TestDatastore;
import org.opensearch.docql.datastore.TestIndex;
import org.opensearch.docql.datastore.TestKeyspace;
import org.opensearch.docql.datastore.TestPrimaryIndex;
import org.opensearch.docql.expression.Constant;
import org.opensearch.docql.expression.DefaultExpressionParser;
import org.opensearch.docql.expression.ExpressionParser;
import org.opensearch.docql.expression.Parameter;
import org.opensearch.docql.plan.Inclusion;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.Range2;
import org.opensearch.docql.plan.Span2;
import org.opensearch.docql.plan.exceptions.IndexSelectionException;
import org.opensearch.docql.plan.scan.IndexScan3;
import org.opensearch.docql.plan.scan.PrimaryScan3;
import org.opensearch.docql.plan.scan.UnionScan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class IndexScanSelectorTest {

  private final ExpressionParser parser = new DefaultExpressionParser();

  private final IndexScanSelector selector = new IndexScanSelector(1024);

  private TestDatastore datastore;

  private TestKeyspace orders;

  private KeyspaceTerm term;

  @BeforeEach
  void setUp() {
    datastore = new TestDatastore();
    orders = datastore.createKeyspace("orders");
    term = KeyspaceTerm.of(orders.getPath(), "o");
  }

  @Test
  void should_scan_composite_index_on_equality_and_range() {
    // Given
    orders.gsi().createIndex("idx_c", "c");
    TestIndex ab = orders.gsi().createIndex("idx_ab", "a", "b");

    // When
    IndexScan3 scan = indexScan(select("a = 5 AND b > 10"));

    // Then
    assertSame(ab, scan.getIndex());
    assertEquals(
        ImmutableList.of(
            new Span2(
                ImmutableList.of(),
                ImmutableList.of(
                    Range2.point(Constant.of(5L)),
                    new Range2(Constant.of(10L), null, Inclusion.NEITHER)),
                true)),
        scan.getSpans());
  }

  @Test
  void should_seek_single_point_span() {
    TestIndex customer = orders.gsi().createIndex("idx_customer", "customerId");

    IndexScan3 scan = indexScan(select("customerId = \"c1\""));

    assertSame(customer, scan.getIndex());
    assertEquals(1, scan.getSpans().size());
    Span2 span = scan.getSpans().get(0);
    assertEquals(ImmutableList.of(Constant.of("c1")), span.getSeek());
    assertEquals(ImmutableList.of(Range2.point(Constant.of("c1"))), span.getRanges());
    assertEquals(Inclusion.BOTH, span.getRanges().get(0).getInclusion());
    assertTrue(span.isExact());
  }

  @Test
  void should_match_alias_qualified_and_unqualified_fields() {
    TestIndex customer = orders.gsi().createIndex("idx_customer", "customerId");

    assertSame(customer, indexScan(select("o.customerId = $cid")).getIndex());
    assertEquals(
        ImmutableList.of(new Parameter("cid")),
        indexScan(select("$cid = customerId")).getSpans().get(0).getSeek());
  }

  @Test
  void should_wrap_multiple_spans_in_union_scan() {
    orders.gsi().createIndex("idx_status", "status");

    Operator op = select("status IN [\"open\", \"paid\", \"open\"]");

    UnionScan union = assertInstanceOf(UnionScan.class, op);
    assertEquals(1, union.getScans().size());
    IndexScan3 scan = assertInstanceOf(IndexScan3.class, union.getScans().get(0));
    assertEquals(2, scan.getSpans().size());
    assertTrue(scan.getSpans().stream().allMatch(Span2::isExact));
  }

  @Test
  void should_fall_back_to_primary_scan_when_no_index_qualifies() {
    orders.gsi().createIndex("idx_c", "c");
    TestPrimaryIndex primary = orders.gsi().createPrimaryIndex("#primary");

    PrimaryScan3 scan = assertInstanceOf(PrimaryScan3.class, select("a = 1 OR c = 2"));

    assertSame(primary, scan.getIndex());
    assertInstanceOf(PrimaryScan3.class, selector.selectScan(orders, term, null));
    assertInstanceOf(PrimaryScan3.class, select("a != 1"));
  }

  @Test
  void should_fail_without_any_usable_index() {
    orders.gsi().createIndex("idx_c", "c");

    assertThrows(IndexSelectionException.class, () -> select("a = 1"));
  }

  @Test
  void should_fail_when_primary_index_is_offline() {
    orders.gsi().createPrimaryIndex("#primary");
    orders.gsi().setState("#primary", IndexState.BUILDING);

    assertThrows(IndexSelectionException.class, () -> select("a = 1"));
  }

  @Test
  void should_scan_nothing_when_predicate_cannot_hold() {
    // Given
    TestIndex customer = orders.gsi().createIndex("idx_customer", "customerId");
    orders.gsi().createPrimaryIndex("#primary");

    // When
    IndexScan3 scan = indexScan(select("o.customerId = \"c1\" AND o.customerId = \"c2\""));

    // Then
    assertSame(customer, scan.getIndex());
    assertEquals(
        ImmutableList.of(new Span2(ImmutableList.of(), ImmutableList.of(Range2.EMPTY), true)),
        scan.getSpans());
    assertFalse(scan.getSpans().get(0).matches(ImmutableList.of("c1")));
    assertFalse(scan.getSpans().get(0).matches(ImmutableList.of("c2")));
    assertFalse(scan.getSpans().get(0).matches(Collections.singletonList(null)));
  }

  @Test
  void should_skip_offline_and_text_indexes() {
    orders.gsi().createIndex("idx_building", "customerId");
    orders.gsi().setState("idx_building", IndexState.BUILDING);
    orders.indexer(IndexType.FTS).createIndex("fts_customer", "customerId");
    TestPrimaryIndex primary = orders.gsi().createPrimaryIndex("#primary");

    assertSame(primary, ((PrimaryScan3) select("customerId = \"c1\"")).getIndex());
  }

  @Test
  void should_honor_index_hints() {
    orders.gsi().createIndex("idx_first", "customerId");
    TestIndex second = orders.gsi().createIndex("idx_second", "customerId");
    KeyspaceTerm hinted = term.withIndexHints(ImmutableList.of("idx_second"));

    Operator op = selector.selectScan(orders, hinted, parser.parse("customerId = \"c1\""));

    assertSame(second, indexScan(op).getIndex());
  }

  @Test
  void should_prefer_hinted_primary_index() {
    orders.gsi().createPrimaryIndex("#primary");
    TestPrimaryIndex hintedPrimary = orders.gsi().createPrimaryIndex("#primary2");
    KeyspaceTerm hinted = term.withIndexHints(ImmutableList.of("#primary2"));

    Operator op = selector.selectScan(orders, hinted, null);

    assertSame(hintedPrimary, ((PrimaryScan3) op).getIndex());
  }

  @Test
  void should_prefer_partial_index_implied_by_predicate() {
    orders.gsi().createIndex("idx_total", "total");
    TestIndex open =
        orders.gsi().createPartialIndex("idx_total_open", "status = \"open\"", "total");

    Operator op = select("total > 100 AND status = \"open\"");

    assertSame(open, indexScan(op).getIndex());
    assertFalse(indexScan(op).getSpans().get(0).isExact());
  }

  @Test
  void should_use_unfiltered_index_when_partial_condition_not_implied() {
    TestIndex total = orders.gsi().createIndex("idx_total", "total");
    orders.gsi().createPartialIndex("idx_total_open", "status = \"open\"", "total");

    assertSame(total, indexScan(select("total > 100")).getIndex());
  }

  @Test
  void should_choose_partial_index_with_equivalent_condition_at_once() {
    orders.gsi().createPartialIndex("idx_big", "total > 10", "total");
    TestIndex exact = orders.gsi().createPartialIndex("idx_big_exact", "total > 100", "total");

    assertSame(exact, indexScan(select("o.total > 100")).getIndex());
  }

  @Test
  void should_drop_trailing_keys_above_span_limit() {
    orders.gsi().createIndex("idx_ab", "a", "b");
    IndexScanSelector bounded = new IndexScanSelector(2);

    Operator op = bounded.selectScan(orders, term, parser.parse("a IN [1, 2] AND b IN [3, 4]"));

    IndexScan3 scan = assertInstanceOf(IndexScan3.class, ((UnionScan) op).getScans().get(0));
    assertEquals(2, scan.getSpans().size());
    assertEquals(1, scan.getSpans().get(0).getRanges().size());
    assertFalse(scan.getSpans().get(0).isExact());
  }

  @Test
  void should_skip_index_whose_leading_key_exceeds_span_limit() {
    orders.gsi().createIndex("idx_a", "a");
    orders.gsi().createPrimaryIndex("#primary");
    IndexScanSelector bounded = new IndexScanSelector(2);

    Operator op = bounded.selectScan(orders, term, parser.parse("a IN [1, 2, 3]"));

    assertInstanceOf(PrimaryScan3.class, op);
  }

  @Test
  void should_mark_scan_of_delta_keyspace() {
    orders.gsi().createIndex("idx_customer", "customerId");

    Operator op = selector.selectScan(orders, term, parser.parse("customerId = \"c1\""), true);

    assertTrue(indexScan(op).hasDeltaKeyspace());
  }

  private Operator select(String where) {
    return selector.selectScan(orders, term, parser.parse(where));
  }

  private static IndexScan3 indexScan(Operator op) {
    return assertInstanceOf(IndexScan3.class, op);
  }
}
