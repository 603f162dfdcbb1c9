/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.ddl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
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

/** Builds deferred indexes. */
@Getter
public class BuildIndexes extends DdlOperator {

  private Keyspace keyspace;

  private KeyspaceTerm term;

  private IndexType using;

  private List<String> names = ImmutableList.of();

  public BuildIndexes() {}

  public BuildIndexes(
      Keyspace keyspace,
      KeyspaceTerm term,
      IndexType using,
      List<String> names) {
    this.keyspace = keyspace;
    this.term = term;
    this.using = using;
    this.names = ImmutableList.copyOf(names);
  }

  @Override
  public OperatorType getOperatorType() {
    return OperatorType.BUILD_INDEXES;
  }

  @Override
  public <R, C> R accept(OperatorVisitor<R, C> visitor, C context) {
    return visitor.visitBuildIndexes(this, context);
  }

  @Override
  public Operator newInstance() {
    return new BuildIndexes();
  }

  @Override
  public boolean verify(PlanVerifier verifier) {
    return verifier.verifyKeyspace(keyspace);
  }

  @Override
  protected void encodeFields(ObjectNode node) {
    term.writeTo(node);
    node.put(IndexReference.USING_FIELD, using.getWireName());
    PlanJson.putStrings(node, "names", names);
  }

  @Override
  protected void decodeFields(ObjectNode node, PlanDecodingContext context) {
    term = KeyspaceTerm.readFrom(node);
    keyspace = context.resolveKeyspace(term);
    using = IndexReference.readType(node);
    names = ImmutableList.copyOf(PlanJson.optStrings(node, "names"));
  }
}
