/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.List;

/**
 * A node of a compiled plan. Plans are trees: every operator exclusively owns its children, and a
 * tree is not modified once built or decoded.
 *
 * <p>Decoding is two-step. {@link OperatorRegistry} creates a zero-valued instance from the {@code
 * #operator} tag of an encoded record, and {@link #decode(ObjectNode, PlanDecodingContext)} fills
 * it in. For every operator, {@code decode(encode())} yields an operator whose encoding is the same
 * as the original one.
 */
public interface Operator {

  /** Field holding the operator tag in every encoded record. */
  String OPERATOR_FIELD = "#operator";

  OperatorType getOperatorType();

  /**
   * Dispatch to the visitor method for this kind of operator.
   *
   * @param visitor visitor
   * @param context visitor context
   * @param <R> result type
   * @param <C> context type
   * @return visitor result
   */
  <R, C> R accept(OperatorVisitor<R, C> visitor, C context);

  /** True for operators that do not modify data. */
  boolean isReadonly();

  /** Optimizer estimates, {@link OptimizerEstimates#UNAVAILABLE} when no optimizer ran. */
  OptimizerEstimates getEstimates();

  default double getCost() {
    return getEstimates().getCost();
  }

  default double getCardinality() {
    return getEstimates().getCardinality();
  }

  default double getSize() {
    return getEstimates().getSize();
  }

  default double getFrCost() {
    return getEstimates().getFrCost();
  }

  /** A new zero-valued operator of the same kind. */
  Operator newInstance();

  /** Encode this operator and its subtree. The {@code #operator} tag is the first field. */
  ObjectNode encode();

  /**
   * Fill in a zero-valued operator from its encoded record.
   *
   * @param node encoded record
   * @param context decoding collaborators
   * @throws org.opensearch.docql.plan.exceptions.PlanDecodingException if the record is malformed
   * @throws org.opensearch.docql.plan.exceptions.UnresolvedReferenceException if a keyspace or
   *     index named by the record no longer exists
   */
  void decode(ObjectNode node, PlanDecodingContext context);

  /** Direct children, in plan order. */
  default List<Operator> getChildren() {
    return Collections.emptyList();
  }

  /**
   * Check that every keyspace and index this subtree references is still valid.
   *
   * @return false if the subtree must not be executed any more
   */
  default boolean verify(PlanVerifier verifier) {
    for (Operator child : getChildren()) {
      if (!child.verify(verifier)) {
        return false;
      }
    }
    return true;
  }
}
