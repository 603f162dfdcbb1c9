/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.Getter;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.IndexReference;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OperatorType;
import org.opensearch.docql.plan.OperatorVisitor;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.PlanVerifier;
import org.opensearch.docql.plan.ReadonlyOperator;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/** Full scan of a keyspace through its primary index. */
@Getter
public class PrimaryScan3 extends ReadonlyOperator implements KeyspaceScan {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private Index index;

  private Expression offset;

  private Expression limit;

  @Getter(AccessLevel.NONE)
  private boolean hasDeltaKeyspace;

  public PrimaryScan3() {}

  public PrimaryScan3(
      Keyspace keyspace,
      KeyspaceTerm term,
      Index index,
      Expression offset,
      Expression limit,
      boolean hasDeltaKeyspace,
      OptimizerEstimates estimates) {
    super(estimates);
    this.keyspace = keyspace;
    this.term = term;
    this.index = index;
    this.offset = offset;
    this.limit = limit;
    this.hasDeltaKeyspace = hasDeltaKeyspace;
  }

  @Override
  public boolean hasDeltaKeyspace() {
    return hasDeltaKeyspace;
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.PRIMARY_SCAN3;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitPrimaryScan3(this, context);
  }

  @Override
  public Operator newInstance() {
    return new PrimaryScan3();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyIndex(index, keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    IndexReference.writeTo(node, index);
    term.writeTo(node);
    PlanJson.putExpression(node, "offset", offset);
    PlanJson.putExpression(node, "limit", limit);
    PlanJson.putFlag(node, "has_delta_keyspace", hasDeltaKeyspace);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    index = context.resolveIndex(keyspace, node);
    if (!index.isPrimary()) {
      throw new PlanDecodingException(
          "PrimaryScan3: index " + index.getName() + " is not a primary index");
    }
    offset = PlanJson.optExpression(node, "offset", context);
    limit = PlanJson.optExpression(node, "limit", context);
    hasDeltaKeyspace = PlanJson.optBoolean(node, "has_delta_keyspace");
  }
}
