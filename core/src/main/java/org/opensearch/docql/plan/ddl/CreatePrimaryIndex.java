/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.ddl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.IndexType;
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
public class CreatePrimaryIndex extends DdlOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private String name;

  private IndexType using;

  private JsonNode with;

  private boolean failIfExists;

  public CreatePrimaryIndex() {}

  public CreatePrimaryIndex(
      Keyspace keyspace,
      KeyspaceTerm term,
      String name,
      IndexType using,
      JsonNode with,
      boolean failIfExists) {
    this.keyspace = keyspace;
    this.term = term;
    this.name = name;
    this.using = using;
    this.with = with;
    this.failIfExists = failIfExists;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.CREATE_PRIMARY_INDEX;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitCreatePrimaryIndex(this, context);
  }

  @Override
  public Operator newInstance() {
    return new CreatePrimaryIndex();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    PlanJson.putString(node, "index", name);
    node.put(IndexReference.USING_FIELD, using.getWireName());
    if (with != null) {
      node.set("with", with.deepCopy());
    }
    PlanJson.putFlag(node, "if_not_exists", !failIfExists);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    name = PlanJson.optString(node, "index");
    using = IndexReference.readType(node);
    with = PlanJson.optValue(node, "with");
    failIfExists = !PlanJson.optBoolean(node, "if_not_exists");
  }
}
