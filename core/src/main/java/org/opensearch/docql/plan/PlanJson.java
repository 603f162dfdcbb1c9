/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.opensearch.docql.common.utils.StringUtils;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/**
 * Helpers for reading and writing encoded plan records. Readers check field types strictly and
 * report any mismatch as a {@link PlanDecodingException}.
 */
public final class PlanJson {

  public static final ObjectMapper MAPPER = new ObjectMapper();

  private PlanJson() {}

  public static ObjectNode newObject() {
    return JsonNodeFactory.instance.objectNode();
  }

  public static ArrayNode newArray() {
    return JsonNodeFactory.instance.arrayNode();
  }

  /** Compact JSON text of the node. */
  public static String toJson(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize plan record", e);
    }
  }

  public static ObjectNode parseObject(byte[] json) {
    JsonNode node;
    try {
      node = MAPPER.readTree(json);
    } catch (IOException e) {
      throw new PlanDecodingException("Invalid plan JSON: " + e.getMessage(), e);
    }
    return asObject(node, "plan");
  }

  public static ObjectNode asObject(JsonNode node, String what) {
    if (node == null || !node.isObject()) {
      throw new PlanDecodingException(what + " must be an object");
    }
    return (ObjectNode) node;
  }

  public static String requireString(ObjectNode node, String field) {
    String value = optString(node, field);
    if (value == null) {
      throw new PlanDecodingException(
          StringUtils.format("%s: missing field %s", operatorName(node), field));
    }
    return value;
  }

  public static String optString(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      throw typeError(node, field, "a string");
    }
    return value.textValue();
  }

  public static boolean optBoolean(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null) {
      return false;
    }
    if (!value.isBoolean()) {
      throw typeError(node, field, "a boolean");
    }
    return value.booleanValue();
  }

  public static long optLong(ObjectNode node, String field, long defaultValue) {
    JsonNode value = node.get(field);
    if (value == null) {
      return defaultValue;
    }
    if (!value.isIntegralNumber()) {
      throw typeError(node, field, "an integer");
    }
    return value.longValue();
  }

  public static ObjectNode optObject(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null) {
      return null;
    }
    if (!value.isObject()) {
      throw typeError(node, field, "an object");
    }
    return (ObjectNode) value;
  }

  public static JsonNode optValue(ObjectNode node, String field) {
    return node.get(field);
  }

  /** Array elements of the field, or an empty list when the field is absent. */
  public static List<JsonNode> optArray(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null) {
      return Collections.emptyList();
    }
    if (!value.isArray()) {
      throw typeError(node, field, "an array");
    }
    List<JsonNode> elements = new ArrayList<>(value.size());
    value.forEach(elements::add);
    return elements;
  }

  public static List<String> optStrings(ObjectNode node, String field) {
    List<String> values = new ArrayList<>();
    for (JsonNode element : optArray(node, field)) {
      if (!element.isTextual()) {
        throw typeError(node, field, "an array of strings");
      }
      values.add(element.textValue());
    }
    return values;
  }

  /** Decodes each element of an array field with the reader. */
  public static <T> List<T> optObjects(
      ObjectNode node, String field, Function<ObjectNode, T> reader) {
    List<T> values = new ArrayList<>();
    for (JsonNode element : optArray(node, field)) {
      values.add(reader.apply(asObject(element, field + " element")));
    }
    return values;
  }

  public static void putString(ObjectNode node, String field, String value) {
    if (value != null && !value.isEmpty()) {
      node.put(field, value);
    }
  }

  public static void putFlag(ObjectNode node, String field, boolean value) {
    if (value) {
      node.put(field, true);
    }
  }

  public static void putExpression(ObjectNode node, String field, Expression expr) {
    if (expr != null) {
      node.put(field, expr.toString());
    }
  }

  public static void putExpressions(ObjectNode node, String field, List<Expression> exprs) {
    if (exprs != null && !exprs.isEmpty()) {
      ArrayNode array = node.putArray(field);
      exprs.forEach(expr -> array.add(expr.toString()));
    }
  }

  public static void putStrings(ObjectNode node, String field, List<String> values) {
    if (values != null && !values.isEmpty()) {
      ArrayNode array = node.putArray(field);
      values.forEach(array::add);
    }
  }

  public static Expression optExpression(
      ObjectNode node, String field, PlanDecodingContext context) {
    String text = optString(node, field);
    return text == null ? null : context.parseExpression(text);
  }

  public static List<Expression> optExpressions(
      ObjectNode node, String field, PlanDecodingContext context) {
    List<Expression> exprs = new ArrayList<>();
    for (String text : optStrings(node, field)) {
      exprs.add(context.parseExpression(text));
    }
    return exprs;
  }

  private static PlanDecodingException typeError(ObjectNode node, String field, String expected) {
    return new PlanDecodingException(
        StringUtils.format("%s: field %s must be %s", operatorName(node), field, expected));
  }

  private static String operatorName(ObjectNode node) {
    JsonNode tag = node.get(Operator.OPERATOR_FIELD);
    return tag != null && tag.isTextual() ? tag.textValue() : "record";
  }
}
