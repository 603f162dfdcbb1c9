/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.docql.expression.Expression;

/**
 * Scan range over a composite index: one {@link Range2} per leading index key. A document
 * qualifies when each of its key values falls in the corresponding range. Spans made of point
 * ranges only also carry the point values as {@code seek}. {@code exact} means the span alone
 * decides the predicate and no filter is needed on top of it.
 */
@Getter
@EqualsAndHashCode
public class Span2 {

  private final List<Expression> seek;

  private final List<Range2> ranges;

  private final boolean exact;

  public Span2(List<Expression> seek, List<Range2> ranges, boolean exact) {
    this.seek = seek == null ? ImmutableList.of() : ImmutableList.copyOf(seek);
    this.ranges = ImmutableList.copyOf(ranges);
    this.exact = exact;
  }

  /** True if any range of the span is provably empty. */
  public boolean isEmpty() {
    return ranges.stream().anyMatch(Range2::isEmpty);
  }

  /**
   * Evaluate the span against the key values of one index entry.
   *
   * @param keyValues values of the index keys, at least one per range
   */
  public boolean matches(List<?> keyValues) {
    Preconditions.checkArgument(
        keyValues.size() >= ranges.size(), "expected %s key values", ranges.size());
    for (int i = 0; i < ranges.size(); i++) {
      if (!ranges.get(i).contains(keyValues.get(i))) {
        return false;
      }
    }
    return true;
  }

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    PlanJson.putExpressions(node, "seek", seek);
    ArrayNode array = node.putArray("range");
    ranges.forEach(range -> array.add(range.encode()));
    PlanJson.putFlag(node, "exact", exact);
    return node;
  }

  public static Span2 decode(ObjectNode node, PlanDecodingContext context) {
    return new Span2(
        PlanJson.optExpressions(node, "seek", context),
        PlanJson.optObjects(node, "range", range -> Range2.decode(range, context)),
        PlanJson.optBoolean(node, "exact"));
  }

  public static void writeAll(ObjectNode node, String field, List<Span2> spans) {
    ArrayNode array = node.putArray(field);
    spans.forEach(span -> array.add(span.encode()));
  }

  public static List<Span2> readAll(ObjectNode node, String field, PlanDecodingContext context) {
    return PlanJson.optObjects(node, field, span -> decode(span, context));
  }

  @Override
  public String toString() {
    return PlanJson.toJson(encode());
  }
}
