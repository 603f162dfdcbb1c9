/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.docql.datastore.IndexType;
import org.opensearch.docql.datastore.KeyspacePath;
import org.opensearch.docql.datastore.TestDatastore;
import org.opensearch.docql.datastore.TestIndex;
import org.opensearch.docql.datastore.TestKeyspace;
import org.opensearch.docql.datastore.TestPrimaryIndex;
import org.opensearch.docql.expression.DefaultExpressionParser;
import org.opensearch.docql.expression.ExpressionParser;
import org.opensearch.docql.plan.ddl.CreateIndex;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;
import org.opensearch.docql.plan.exceptions.UnresolvedReferenceException;
import org.opensearch.docql.plan.exec.Explain;
import org.opensearch.docql.plan.join.HashJoin;
import org.opensearch.docql.plan.legacy.IndexScan;
import org.opensearch.docql.plan.query.Fetch;
import org.opensearch.docql.plan.query.Filter;
import org.opensearch.docql.plan.query.FinalProject;
import org.opensearch.docql.plan.query.InitialProject;
import org.opensearch.docql.plan.query.Limit;
import org.opensearch.docql.plan.query.ResultTerm;
import org.opensearch.docql.plan.query.Sequence;
import org.opensearch.docql.plan.scan.IndexScan3;
import org.opensearch.docql.plan.scan.PrimaryScan3;
import org.opensearch.docql.plan.txn.StartTransaction;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OperatorEncodingTest {

  private final ExpressionParser parser = new DefaultExpressionParser();

  private TestDatastore datastore;

  private TestKeyspace orders;

  private TestIndex customerIndex;

  private TestPrimaryIndex primaryIndex;

  private PlanDecodingContext context;

  private KeyspaceTerm term;

  @BeforeEach
  void setUp() {
    datastore = new TestDatastore();
    orders = datastore.createKeyspace("orders");
    customerIndex = orders.gsi().createIndex("idx_customer", "customerId");
    primaryIndex = orders.gsi().createPrimaryIndex("#primary");
    context = new PlanDecodingContext(datastore, parser, new OperatorRegistry());
    term = KeyspaceTerm.of(KeyspacePath.of(TestDatastore.NAMESPACE, "orders"), "o");
  }

  @Test
  void should_reencode_decoded_select_plan_identically() {
    // Given
    Span2 span =
        new Span2(
            ImmutableList.of(parser.parse("\"c1\"")),
            ImmutableList.of(Range2.point(parser.parse("\"c1\""))),
            true);
    Operator plan =
        new Sequence(
            ImmutableList.of(
                new IndexScan3(
                    orders, term, customerIndex, ImmutableList.of(span), false, false, false,
                    null, ImmutableList.of(), null, parser.parse("$lim"), ImmutableList.of(),
                    ImmutableMap.of(), null, true, null,
                    new OptimizerEstimates(12.5, 3, -1, 0)),
                new Fetch(orders, term, ImmutableList.of("total"), null),
                new Filter(parser.parse("o.customerId = \"c1\" and o.total > 10"), null),
                new InitialProject(
                    ImmutableList.of(
                        new ResultTerm(parser.parse("o.total"), "total", false),
                        new ResultTerm(parser.parse("o"), null, true)),
                    true,
                    null),
                new FinalProject(),
                new Limit(parser.parse("10"), null)),
            null);

    // When
    Operator decoded = roundTrip(plan);

    // Then
    IndexScan3 scan = (IndexScan3) decoded.getChildren().get(0);
    assertSame(customerIndex, scan.getIndex());
    assertSame(orders, scan.getKeyspace());
    assertEquals(ImmutableList.of(span), scan.getSpans());
    assertTrue(scan.hasDeltaKeyspace());
    assertEquals(12.5, scan.getCost());
    assertEquals(0.0, scan.getFrCost());
    assertEquals(-1.0, scan.getSize());
  }

  @Test
  void should_reencode_hash_join_with_bit_filters_identically() {
    BitFilters filters =
        new BitFilters()
            .add("o", customerIndex.getName(), customerIndex.getId(),
                ImmutableList.of(parser.parse("o.customerId")));
    Operator build =
        new PrimaryScan3(
            orders, term, primaryIndex, null, null, false, OptimizerEstimates.UNAVAILABLE);
    HashJoin join =
        new HashJoin(
            parser.parse("c.id = o.customerId"),
            ImmutableList.of(parser.parse("o.customerId")),
            ImmutableList.of(parser.parse("c.id")),
            ImmutableList.of("o"),
            true,
            filters,
            build,
            null);

    HashJoin decoded = (HashJoin) roundTrip(join);

    assertEquals(filters, decoded.getBuildBitFilters());
    assertTrue(decoded.isOuter());
  }

  @Test
  void should_reencode_statements_without_estimates_identically() {
    roundTrip(new Explain(new Sequence(ImmutableList.of(new FinalProject()), null), "SELECT 1"));
    roundTrip(new StartTransaction(PlanJson.newObject().put("durability_level", "majority")));
    roundTrip(
        new CreateIndex(
            orders,
            term,
            "idx_total",
            ImmutableList.of(parser.parse("total"), parser.parse("lower(status)")),
            parser.parse("total > 0"),
            IndexType.GSI,
            PlanJson.newObject().put("defer_build", true),
            false));
  }

  @Test
  void should_decode_legacy_scan_with_capitalized_span_fields() {
    String json =
        ("{'#operator':'IndexScan','index':'idx_customer','index_id':'%s','using':'gsi',"
                + "'namespace':'default','keyspace':'orders','as':'o',"
                + "'spans':[{'Seek':['5'],'Range':{'Low':['5'],'High':['5'],'Inclusion':3}}]}")
            .replace('\'', '"');
    json = String.format(json, customerIndex.getId());

    Operator decoded = context.decodeOperator(parse(json));

    IndexScan scan = assertInstanceOf(IndexScan.class, decoded);
    assertEquals(Inclusion.BOTH, scan.getSpans().get(0).getInclusion());
    assertEquals(json, PlanJson.toJson(decoded.encode()));
  }

  @Test
  void should_omit_optional_fields_at_default() {
    ObjectNode node = IndexScan3.of(orders, term, customerIndex, ImmutableList.of()).encode();

    assertEquals("IndexScan3", node.get(Operator.OPERATOR_FIELD).textValue());
    assertEquals(Operator.OPERATOR_FIELD, node.fieldNames().next());
    assertFalse(node.has("reverse"));
    assertFalse(node.has("limit"));
    assertFalse(node.has("has_delta_keyspace"));
    assertFalse(node.has("optimizer_estimates"));
    assertFalse(node.has("nested_loop"));
  }

  @Test
  void should_fail_on_unknown_operator_tag() {
    assertThrows(
        PlanDecodingException.class,
        () -> context.decodeOperator(parse("{\"#operator\":\"Teleport\"}")));
    assertThrows(PlanDecodingException.class, () -> context.decodeOperator(parse("{}")));
  }

  @Test
  void should_fail_on_field_of_wrong_type() {
    String json = "{\"#operator\":\"Filter\",\"condition\":42}";

    assertThrows(PlanDecodingException.class, () -> context.decodeOperator(parse(json)));
  }

  @Test
  void should_fail_on_invalid_expression_text() {
    String json = "{\"#operator\":\"Filter\",\"condition\":\"a = \"}";

    assertThrows(PlanDecodingException.class, () -> context.decodeOperator(parse(json)));
  }

  @Test
  void should_fail_when_referenced_index_was_dropped() {
    ObjectNode encoded = IndexScan3.of(orders, term, customerIndex, ImmutableList.of()).encode();
    orders.gsi().dropIndex("idx_customer");

    assertThrows(UnresolvedReferenceException.class, () -> context.decodeOperator(encoded));
  }

  @Test
  void should_fail_when_referenced_keyspace_was_dropped() {
    ObjectNode encoded = new Fetch(orders, term, ImmutableList.of(), null).encode();
    datastore.dropKeyspace(term.getPath());

    assertThrows(UnresolvedReferenceException.class, () -> context.decodeOperator(encoded));
  }

  @Test
  void should_reject_primary_scan_over_secondary_index() {
    ObjectNode encoded =
        new PrimaryScan3(
                orders, term, customerIndex, null, null, false, OptimizerEstimates.UNAVAILABLE)
            .encode();

    assertThrows(PlanDecodingException.class, () -> context.decodeOperator(encoded));
  }

  private Operator roundTrip(Operator operator) {
    String json = PlanJson.toJson(operator.encode());
    Operator decoded = context.decodeOperator(parse(json));
    assertEquals(operator.getOperatorType(), decoded.getOperatorType());
    assertEquals(json, PlanJson.toJson(decoded.encode()));
    return decoded;
  }

  private static ObjectNode parse(String json) {
    return PlanJson.parseObject(json.getBytes(StandardCharsets.UTF_8));
  }
}
