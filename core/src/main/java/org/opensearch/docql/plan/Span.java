/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.docql.expression.Expression;

/**
 * Span of the legacy index scans: one composite range whose low and high bounds are lists of key
 * values. Field names are capitalized in the encoding.
 */
@Getter
@EqualsAndHashCode
public class Span {

  private final List<Expression> seek;

  private final List<Expression> low;

  private final List<Expression> high;

  private final Inclusion inclusion;

  public Span(
      List<Expression> seek, List<Expression> low, List<Expression> high, Inclusion inclusion) {
    this.seek = seek == null ? ImmutableList.of() : ImmutableList.copyOf(seek);
    this.low = low == null ? ImmutableList.of() : ImmutableList.copyOf(low);
    this.high = high == null ? ImmutableList.of() : ImmutableList.copyOf(high);
    this.inclusion = inclusion;
  }

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    PlanJson.putExpressions(node, "Seek", seek);
    ObjectNode range = node.putObject("Range");
    PlanJson.putExpressions(range, "Low", low);
    PlanJson.putExpressions(range, "High", high);
    range.put("Inclusion", inclusion.getCode());
    return node;
  }

  public static Span decode(ObjectNode node, PlanDecodingContext context) {
    ObjectNode range = PlanJson.optObject(node, "Range");
    if (range == null) {
      range = PlanJson.newObject();
    }
    return new Span(
        PlanJson.optExpressions(node, "Seek", context),
        PlanJson.optExpressions(range, "Low", context),
        PlanJson.optExpressions(range, "High", context),
        Inclusion.fromCode(PlanJson.optLong(range, "Inclusion", 0)));
  }

  public static void writeAll(ObjectNode node, String field, List<Span> spans) {
    ArrayNode array = node.putArray(field);
    spans.forEach(span -> array.add(span.encode()));
  }

  public static List<Span> readAll(ObjectNode node, String field, PlanDecodingContext context) {
    return PlanJson.optObjects(node, field, span -> decode(span, context));
  }
}
