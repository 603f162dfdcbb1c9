/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.join;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.expression.Expression;
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

/** Lookup join through an index on the inner keyspace. */
@Getter
public class IndexJoin extends ReadonlyOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private Expression onKey;

  private String forAlias;

  private boolean outer;

  public IndexJoin() {}

  public IndexJoin(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      Expression onKey,
      String forAlias,
      boolean outer,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.onKey = onKey;
    this.forAlias = forAlias;
    this.outer = outer;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INDEX_JOIN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitIndexJoin(this, context);
  }

  @Override
  public Operator newInstance() {
    return new IndexJoin();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    PlanJson.putExpression(node, "on_key", onKey);
    PlanJson.putString(node, "for", forAlias);
    PlanJson.putFlag(node, "outer", outer);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    onKey = PlanJson.optExpression(node, "on_key", context);
    forAlias = PlanJson.optString(node, "for");
    outer = PlanJson.optBoolean(node, "outer");
  }
}
