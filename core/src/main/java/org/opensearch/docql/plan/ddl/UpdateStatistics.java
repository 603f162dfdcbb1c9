/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.ddl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.DdlOperator;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;

/** Collects optimizer statistics for keyspace expressions. */
@Getter
public class UpdateStatistics extends DdlOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private List<Expression> terms = ImmutableList.of();

  private JsonNode with;

  private boolean delete;

  public UpdateStatistics() {}

  public UpdateStatistics(
      Keyspace keyspace,
      KeyspaceTerm term,
      List<Expression> terms,
      JsonNode with,
      boolean delete) {
    this.keyspace = keyspace;
    this.term = term;
    this.terms = ImmutableList.copyOf(terms);
    this.with = with;
    this.delete = delete;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.UPDATE_STATISTICS;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitUpdateStatistics(this, context);
  }

  @Override
  public Operator newInstance() {
    return new UpdateStatistics();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    PlanJson.putExpressions(node, "terms", terms);
    if (with != null) {
      node.set("with", with.deepCopy());
    }
    PlanJson.putFlag(node, "delete", delete);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    terms = ImmutableList.copyOf(PlanJson.optExpressions(node, "terms", context));
    with = PlanJson.optValue(node, "with");
    delete = PlanJson.optBoolean(node, "delete");
  }
}
