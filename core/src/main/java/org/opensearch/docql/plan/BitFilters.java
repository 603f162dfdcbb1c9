/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.opensearch.docql.expression.Expression;

/**
 * Bit filters grouped by keyspace alias. A hash join holds the build side ones, an index scan the
 * probe side ones for its own alias. Filled in while the plan is built; operators keep a frozen
 * copy, which rejects further additions.
 */
@ToString
@EqualsAndHashCode
public class BitFilters {

  private final Map<String, BitFilterTerm> terms = new LinkedHashMap<>();

  @EqualsAndHashCode.Exclude private boolean frozen;

  /**
   * Register a bit filter for an index of an alias.
   *
   * @throws org.opensearch.docql.plan.exceptions.PlanConflictException if the alias already has
   *     a bit filter for the index on different expressions
   * @throws UnsupportedOperationException if the filters are frozen
   */
  public BitFilters add(String alias, String indexName, String indexId, List<Expression> exprs) {
    if (frozen) {
      throw new UnsupportedOperationException("Bit filters of a built operator cannot be changed");
    }
    terms
        .computeIfAbsent(alias, BitFilterTerm::new)
        .add(new BitFilterIndex(indexName, indexId, exprs));
    return this;
  }

  public List<BitFilterTerm> getTerms() {
    return ImmutableList.copyOf(terms.values());
  }

  public List<BitFilterIndex> getIndexes(String alias) {
    BitFilterTerm term = terms.get(alias);
    return term == null ? ImmutableList.of() : term.getIndexes();
  }

  public boolean isFrozen() {
    return frozen;
  }

  /** Frozen copy of the filters, unaffected by later additions to the source. Null gives none. */
  public static BitFilters frozenCopyOf(BitFilters source) {
    if (source != null && source.frozen) {
      return source;
    }
    BitFilters copy = new BitFilters();
    if (source != null) {
      copy.addAll(source);
    }
    copy.frozen = true;
    return copy;
  }

  private void addAll(BitFilters source) {
    for (BitFilterTerm term : source.terms.values()) {
      for (BitFilterIndex index : term.getIndexes()) {
        add(term.getAlias(), index.getIndexName(), index.getIndexId(), index.getExpressions());
      }
    }
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  /** Writes the terms as an array under the field, or nothing when there are none. */
  public void writeTo(ObjectNode node, String field) {
    if (terms.isEmpty()) {
      return;
    }
    ArrayNode array = node.putArray(field);
    terms.values().forEach(term -> array.add(term.encode()));
  }

  /** Reads the filters written by {@link #writeTo}. The result is frozen. */
  public static BitFilters readFrom(ObjectNode node, String field, PlanDecodingContext context) {
    BitFilters filters = new BitFilters();
    for (BitFilterTerm term :
        PlanJson.optObjects(node, field, term -> BitFilterTerm.decode(term, context))) {
      for (BitFilterIndex index : term.getIndexes()) {
        filters.add(term.getAlias(), index.getIndexName(), index.getIndexId(),
            index.getExpressions());
      }
    }
    filters.frozen = true;
    return filters;
  }
}
