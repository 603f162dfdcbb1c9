/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.plan.ExecutionOperator;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;

/** Infers the document schema of a keyspace. */
@Getter
public class InferKeyspace extends ExecutionOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private JsonNode with;

  public InferKeyspace() {}

  public InferKeyspace(
      Keyspace keyspace,
      KeyspaceTerm term,
      JsonNode with) {
    this.keyspace = keyspace;
    this.term = term;
    this.with = with;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.INFER_KEYSPACE;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitInferKeyspace(this, context);
  }

  @Override
  public Operator newInstance() {
    return new InferKeyspace();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    if (with != null) {
      node.set("with", with.deepCopy());
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    with = PlanJson.optValue(node, "with");
  }
}
