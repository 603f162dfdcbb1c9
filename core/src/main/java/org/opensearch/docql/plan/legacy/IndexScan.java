/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.legacy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.IndexReference;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.LegacyOperator;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;
import org.opensearch.docql.plan.Span;
import org.opensearch.docql.plan.scan.KeyspaceScan;

/** Index scan over composite-range spans. */
@Getter
public class IndexScan extends LegacyOperator implements KeyspaceScan {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private List<Span> spans = ImmutableList.of();

  private boolean distinct;

  private Expression limit;

  private List<Expression> covers = ImmutableList.of();

  public IndexScan() {}

  public IndexScan(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      List<Span> spans,
      boolean distinct,
      Expression limit,
      List<Expression> covers) {
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.spans = ImmutableList.copyOf(spans);
    this.distinct = distinct;
    this.limit = limit;
    this.covers = ImmutableList.copyOf(covers);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INDEX_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitIndexScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new IndexScan();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    Span.writeAll(node, "spans", spans);
    PlanJson.putFlag(node, "distinct", distinct);
    PlanJson.putExpression(node, "limit", limit);
    PlanJson.putExpressions(node, "covers", covers);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    spans = ImmutableList.copyOf(Span.readAll(node, "spans", context));
    distinct = PlanJson.optBoolean(node, "distinct");
    limit = PlanJson.optExpression(node, "limit", context);
    covers = ImmutableList.copyOf(PlanJson.optExpressions(node, "covers", context));
  }
}
