/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.ddl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.plan.DdlOperator;
import org.opensearch.docql.plan.IndexReference;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;

@Getter
public class DropIndex extends DdlOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private boolean failIfNotExists;

  public DropIndex() {}

  public DropIndex(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      boolean failIfNotExists) {
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.failIfNotExists = failIfNotExists;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.DROP_INDEX;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitDropIndex(this, context);
  }

  @Override
  public Operator newInstance() {
    return new DropIndex();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    PlanJson.putFlag(node, "if_exists", !failIfNotExists);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    failIfNotExists = !PlanJson.optBoolean(node, "if_exists");
  }
}
