/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.dml;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;
import org.opensearch.docql.plan.ReadwriteOperator;

@Getter
public class SendUpdate extends ReadwriteOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Expression limit;

  public SendUpdate() {}

  public SendUpdate(
      Keyspace keyspace,
      KeyspaceTerm term,
      Expression limit,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.limit = limit;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.SEND_UPDATE;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitSendUpdate(this, context);
  }

  @Override
  public Operator newInstance() {
    return new SendUpdate();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    PlanJson.putExpression(node, "limit", limit);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    limit = PlanJson.optExpression(node, "limit", context);
  }
}
