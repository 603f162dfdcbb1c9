/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.docql.common.utils.StringUtils;
import org.opensearch.docql.plan.exceptions.PlanConflictException;

/** Bit filters of one keyspace alias, at most one per index. */
@ToString
@EqualsAndHashCode
public class BitFilterTerm {

  @Getter private final String alias;

  private final List<BitFilterIndex> indexes = new ArrayList<>();

  public BitFilterTerm(String alias) {
    this.alias = alias;
  }

  public List<BitFilterIndex> getIndexes() {
    return Collections.unmodifiableList(indexes);
  }

  /**
   * Add a bit filter. An identical definition for the same index is ignored.
   *
   * @throws PlanConflictException if the index already has a filter on other expressions
   */
  void add(BitFilterIndex filter) {
    for (BitFilterIndex existing : indexes) {
      if (existing.getIndexId().equals(filter.getIndexId())) {
        if (existing.getExpressions().equals(filter.getExpressions())) {
          return;
        }
        throw new PlanConflictException(
            StringUtils.format(
                "Conflicting bit filters for alias %s on index %s: %s and %s",
                alias, filter.getIndexName(), existing.getExpressions(),
                filter.getExpressions()));
      }
    }
    indexes.add(filter);
  }

  public ObjectNode encode() {
    ObjectNode node = PlanJson.newObject();
    node.put("alias", alias);
    ArrayNode array = node.putArray("index_bit_filters");
    indexes.forEach(index -> array.add(index.encode()));
    return node;
  }

  public static BitFilterTerm decode(ObjectNode node, PlanDecodingContext context) {
    BitFilterTerm term = new BitFilterTerm(PlanJson.requireString(node, "alias"));
    for (BitFilterIndex index :
        PlanJson.optObjects(
            node, "index_bit_filters", index -> BitFilterIndex.decode(index, context))) {
      term.add(index);
    }
    return term;
  }
}
