/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.join;

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
import org.opensearch.docql.plan.ReadonlyOperator;

/** Join on document keys (ON KEYS). */
@Getter
public class Join extends ReadonlyOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Expression onKeys;

  private boolean outer;

  public Join() {}

  public Join(
      Keyspace keyspace,
      KeyspaceTerm term,
      Expression onKeys,
      boolean outer,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.onKeys = onKeys;
    this.outer = outer;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.JOIN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Join();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    PlanJson.putExpression(node, "on_keys", onKeys);
    PlanJson.putFlag(node, "outer", outer);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    onKeys = PlanJson.optExpression(node, "on_keys", context);
    outer = PlanJson.optBoolean(node, "outer");
  }
}
