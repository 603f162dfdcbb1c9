/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.ddl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.IndexCapability;
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
import org.opensearch.docql.plan.exceptions.UnsupportedCapabilityException;

/** Changes settings of an index. Only indexes with the ALTER capability can be altered. */
@Getter
public class AlterIndex extends DdlOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private JsonNode with;

  public AlterIndex() {}

  public AlterIndex(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      JsonNode with) {
    checkAlterable(index);
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.with = with;
  }

  private static void checkAlterable(Index index) {
    if (!index.supports(IndexCapability.ALTER)) {
      throw new UnsupportedCapabilityException(
          "ALTER INDEX is not supported by index " + index.getName());
    }
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.ALTER_INDEX;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitAlterIndex(this, context);
  }

  @Override
  public Operator newInstance() {
    return new AlterIndex();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    if (with != null) {
      node.set("with", with.deepCopy());
    }
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    checkAlterable(index);
    with = PlanJson.optValue(node, "with");
  }
}
