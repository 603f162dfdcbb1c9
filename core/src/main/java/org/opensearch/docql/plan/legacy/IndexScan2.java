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
import org.opensearch.docql.plan.Span2;
import org.opensearch.docql.plan.scan.KeyspaceScan;

@Getter
public class IndexScan2 extends LegacyOperator implements KeyspaceScan {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private List<Span2> spans = ImmutableList.of();

  private boolean reverse;

  private boolean distinct;

  private Expression offset;

  private Expression limit;

  private List<Expression> covers = ImmutableList.of();

  public IndexScan2() {}

  public IndexScan2(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      List<Span2> spans,
      boolean reverse,
      boolean distinct,
      Expression offset,
      Expression limit,
      List<Expression> covers) {
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.spans = ImmutableList.copyOf(spans);
    this.reverse = reverse;
    this.distinct = distinct;
    this.offset = offset;
    this.limit = limit;
    this.covers = ImmutableList.copyOf(covers);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INDEX_SCAN2;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitIndexScan2(this, context);
  }

  @Override
  public Operator newInstance() {
    return new IndexScan2();
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
    PlanJson.putExpression(node, "offset", offset);
    PlanJson.putExpression(node, "limit", limit);
    PlanJson.putExpressions(node, "covers", covers);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    spans = ImmutableList.copyOf(Span2.readAll(node, "spans", context));
    reverse = PlanJson.optBoolean(node, "reverse");
    distinct = PlanJson.optBoolean(node, "distinct");
    offset = PlanJson.optExpression(node, "offset", context);
    limit = PlanJson.optExpression(node, "limit", context);
    covers = ImmutableList.copyOf(PlanJson.optExpressions(node, "covers", context));
  }
}
