/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.legacy;

import com.fasterxml.jackson.databind.node.ObjectNode;
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
import org.opensearch.docql.plan.scan.KeyspaceScan;

@Getter
public class PrimaryScan extends LegacyOperator implements KeyspaceScan {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private Expression limit;

  public PrimaryScan() {}

  public PrimaryScan(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      Expression limit) {
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.limit = limit;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.PRIMARY_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitPrimaryScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new PrimaryScan();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    PlanJson.putExpression(node, "limit", limit);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    limit = PlanJson.optExpression(node, "limit", context);
  }
}
