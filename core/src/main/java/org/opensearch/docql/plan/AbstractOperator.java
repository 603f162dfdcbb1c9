/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/**
 * Skeleton of the encode/decode contract. Subclasses write and read their own fields; the tag and
 * the optimizer estimates are handled here.
 */
public abstract class AbstractOperator implements Operator {

  @Override
  public final ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    node.put(OPERATOR_FIELD, getOperatorType().getWireName());
    encodeFields(node);
    getEstimates().writeTo(node);
    return node;
  }

  @Override
  public void decode(ObjectNode node, PlanDecodingContext context) {
    String tag = PlanJson.optString(node, OPERATOR_FIELD);
    if (!getOperatorType().getWireName().equals(tag)) {
      throw new PlanDecodingException(
          "Expected " + getOperatorType().getWireName() + " record but found " + tag);
    }
    decodeFields(node, context);
  }

  /** Write operator-specific fields. Optional fields at their default are omitted. */
  protected abstract void encodeFields(ObjectNode node);

  /** Read the fields written by {@link #encodeFields(ObjectNode)}. */
  protected abstract void decodeFields(ObjectNode node, PlanDecodingContext context);

  @Override
  public String toString() {
    return PlanJson.toJson(encode());
  }
}
