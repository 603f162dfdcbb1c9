/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Fetches full documents for the keys produced by a scan. */
@Getter
public class Fetch extends ReadonlyOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private List<String> earlyProjection = ImmutableList.of();

  public Fetch() {}

  public Fetch(
      Keyspace keyspace,
      KeyspaceTerm term,
      List<String> earlyProjection,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.earlyProjection = ImmutableList.copyOf(earlyProjection);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.FETCH;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitFetch(this, context);
  }

  @Override
  public Operator newInstance() {
    return new Fetch();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    PlanJson.putStrings(node, "early_projection", earlyProjection);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    earlyProjection = ImmutableList.copyOf(PlanJson.optStrings(node, "early_projection"));
  }
}
