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
public class SendUpsert extends ReadwriteOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Expression key;

  private Expression value;

  private Expression options;

  private Expression limit;

  public SendUpsert() {}

  public SendUpsert(
      Keyspace keyspace,
      KeyspaceTerm term,
      Expression key,
      Expression value,
      Expression options,
      Expression limit,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.key = key;
    this.value = value;
    this.options = options;
    this.limit = limit;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.SEND_UPSERT;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitSendUpsert(this, context);
  }

  @Override
  public Operator newInstance() {
    return new SendUpsert();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    PlanJson.putExpression(node, "key", key);
    PlanJson.putExpression(node, "value", value);
    PlanJson.putExpression(node, "options", options);
    PlanJson.putExpression(node, "limit", limit);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    key = PlanJson.optExpression(node, "key", context);
    value = PlanJson.optExpression(node, "value", context);
    options = PlanJson.optExpression(node, "options", context);
    limit = PlanJson.optExpression(node, "limit", context);
  }
}
