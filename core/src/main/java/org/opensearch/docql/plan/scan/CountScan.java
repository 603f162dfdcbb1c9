/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanVerifier;
import org.opensearch.docql.plan.ReadonlyOperator;

/** Answers COUNT(*) on a whole keyspace from its metadata. */
@Getter
public class CountScan extends ReadonlyOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  public CountScan() {}

  public CountScan(
      Keyspace keyspace,
      KeyspaceTerm term,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.COUNT_SCAN;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitCountScan(this, context);
  }

  @Override
  public Operator newInstance() {
    return new CountScan();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
  }
}
