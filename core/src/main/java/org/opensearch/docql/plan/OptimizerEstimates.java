/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/**
 * Cost, cardinality, size and first-result cost computed by the optimizer. A negative value means
 * "not available", which is different from a known zero and is never encoded.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class OptimizerEstimates {

  public static final double NOT_AVAILABLE = -1.0;

  public static final OptimizerEstimates UNAVAILABLE =
      new OptimizerEstimates(NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE);

  static final String FIELD = "optimizer_estimates";

  private final double cost;

  private final double cardinality;

  private final double size;

  private final double frCost;

  public boolean isAvailable() {
    return cost >= 0 || cardinality >= 0 || size >= 0 || frCost >= 0;
  }

  /** Writes {@code optimizer_estimates} with the available values, or nothing. */
  public void writeTo(ObjectNode node) {
    if (!isAvailable()) {
      return;
    }
    ObjectNode estimates = node.putObject(FIELD);
    putIfAvailable(estimates, "cost", cost);
    putIfAvailable(estimates, "cardinality", cardinality);
    putIfAvailable(estimates, "size", size);
    putIfAvailable(estimates, "fr_cost", frCost);
  }

  /** Reads {@code optimizer_estimates}, returning {@link #UNAVAILABLE} if the field is absent. */
  public static OptimizerEstimates readFrom(ObjectNode node) {
    JsonNode estimates = node.get(FIELD);
    if (estimates == null) {
      return UNAVAILABLE;
    }
    if (!estimates.isObject()) {
      throw new PlanDecodingException(FIELD + " must be an object");
    }
    return new OptimizerEstimates(
        read(estimates, "cost"),
        read(estimates, "cardinality"),
        read(estimates, "size"),
        read(estimates, "fr_cost"));
  }

  private static void putIfAvailable(ObjectNode node, String field, double value) {
    if (value >= 0) {
      node.put(field, value);
    }
  }

  private static double read(JsonNode estimates, String field) {
    JsonNode value = estimates.get(field);
    if (value == null) {
      return NOT_AVAILABLE;
    }
    if (!value.isNumber()) {
      throw new PlanDecodingException(FIELD + "." + field + " must be a number");
    }
    return value.asDouble();
  }
}
