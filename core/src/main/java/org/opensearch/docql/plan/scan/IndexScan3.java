/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.BitFilters;
import org.opensearch.docql.plan.IndexReference;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;
import org.opensearch.docql.plan.ReadonlyOperator;
import org.opensearch.docql.plan.Span2;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/**
 * Range scan of a secondary index. Several spans return the union of their entries, which may
 * hold the same document more than once.
 */
@Getter
public class IndexScan3 extends ReadonlyOperator implements KeyspaceScan {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private List<Span2> spans = ImmutableList.of();

  private boolean reverse;

  private boolean distinct;

  private boolean dynamicIn;

  private IndexProjection projection;

  private List<IndexKeyOrder> orderTerms = ImmutableList.of();

  private Expression offset;

  private Expression limit;

  private List<Expression> covers = ImmutableList.of();

  /** Covered expressions whose value is fixed by the index condition. */
  private Map<Expression, Expression> filterCovers = ImmutableMap.of();

  private Expression filter;

  @Getter(AccessLevel.NONE)
  private boolean hasDeltaKeyspace;

  private BitFilters probeBitFilters = BitFilters.frozenCopyOf(null);

  public IndexScan3() {}

  public IndexScan3(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      List<Span2> spans,
      boolean reverse,
      boolean distinct,
      boolean dynamicIn,
      IndexProjection projection,
      List<IndexKeyOrder> orderTerms,
      Expression offset,
      Expression limit,
      List<Expression> covers,
      Map<Expression, Expression> filterCovers,
      Expression filter,
      boolean hasDeltaKeyspace,
      BitFilters probeBitFilters,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.spans = ImmutableList.copyOf(spans);
    this.reverse = reverse;
    this.distinct = distinct;
    this.dynamicIn = dynamicIn;
    this.projection = projection;
    this.orderTerms = ImmutableList.copyOf(orderTerms);
    this.offset = offset;
    this.limit = limit;
    this.covers = ImmutableList.copyOf(covers);
    this.filterCovers = ImmutableMap.copyOf(filterCovers);
    this.filter = filter;
    this.hasDeltaKeyspace = hasDeltaKeyspace;
    this.probeBitFilters = BitFilters.frozenCopyOf(probeBitFilters);
  }

  /** Plain range scan over the spans, without covering, ordering or pagination. */
  public static IndexScan3 of(
      Keyspace keyspace, KeyspaceTerm term, Index index, List<Span2> spans) {
    return new IndexScan3(
        keyspace, term, index, spans, false, false, false, null, ImmutableList.of(), null, null,
        ImmutableList.of(), ImmutableMap.of(), null, false, null,
        OptimizerEstimates.UNAVAILABLE);
  }

  public boolean isCovering() {
    return !covers.isEmpty();
  }

  @Override
  public boolean hasDeltaKeyspace() {
    return hasDeltaKeyspace;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INDEX_SCAN3;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitIndexScan3(this, context);
  }

  @Override
  public Operator newInstance() {
    return new IndexScan3();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    Span2.writeAll(node, "spans", spans);
    PlanJson.putFlag(node, "reverse", reverse);
    PlanJson.putFlag(node, "distinct", distinct);
    PlanJson.putFlag(node, "has_dynamic_in", dynamicIn);
    if (projection != null) {
      node.set("index_projection", projection.encode());
    }
    if (!orderTerms.isEmpty()) {
      ArrayNode order = node.putArray("index_order");
      orderTerms.forEach(keyOrder -> order.add(keyOrder.encode()));
    }
    PlanJson.putExpression(node, "offset", offset);
    PlanJson.putExpression(node, "limit", limit);
    PlanJson.putExpressions(node, "covers", covers);
    if (!filterCovers.isEmpty()) {
      ObjectNode fc = node.putObject("filter_covers");
      filterCovers.forEach((k, v) -> fc.put(k.toString(), v.toString()));
    }
    PlanJson.putExpression(node, "filter", filter);
    PlanJson.putFlag(node, "has_delta_keyspace", hasDeltaKeyspace);
    probeBitFilters.writeTo(node, "probe_bit_filters");
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    spans = ImmutableList.copyOf(Span2.readAll(node, "spans", context));
    reverse = PlanJson.optBoolean(node, "reverse");
    distinct = PlanJson.optBoolean(node, "distinct");
    dynamicIn = PlanJson.optBoolean(node, "has_dynamic_in");
    ObjectNode proj = PlanJson.optObject(node, "index_projection");
    projection = proj == null ? null : IndexProjection.decode(proj);
    orderTerms =
        ImmutableList.copyOf(PlanJson.optObjects(node, "index_order", IndexKeyOrder::decode));
    offset = PlanJson.optExpression(node, "offset", context);
    limit = PlanJson.optExpression(node, "limit", context);
    covers = ImmutableList.copyOf(PlanJson.optExpressions(node, "covers", context));
    filterCovers = decodeFilterCovers(node, context);
    filter = PlanJson.optExpression(node, "filter", context);
    hasDeltaKeyspace = PlanJson.optBoolean(node, "has_delta_keyspace");
    probeBitFilters = BitFilters.readFrom(node, "probe_bit_filters", context);
  }

  private static Map<Expression, Expression> decodeFilterCovers(
      ObjectNode node, PlanDecodingContext context) {
    ObjectNode fc = PlanJson.optObject(node, "filter_covers");
    if (fc == null) {
      return ImmutableMap.of();
    }
    Map<Expression, Expression> covers = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = fc.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().isTextual()) {
        throw new PlanDecodingException("IndexScan3: filter_covers values must be strings");
      }
      covers.put(
          context.parseExpression(field.getKey()),
          context.parseExpression(field.getValue().textValue()));
    }
    return ImmutableMap.copyOf(covers);
  }
}
