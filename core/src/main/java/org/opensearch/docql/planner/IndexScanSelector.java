/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.planner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.docql.common.utils.StringUtils;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.IndexState;
import org.opensearch.docql.datastore.IndexType;
import org.opensearch.docql.datastore.Indexer;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.datastore.PrimaryIndex;
import org.opensearch.docql.expression.And;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.expression.Formalizer;
import org.opensearch.docql.expression.NnfNormalizer;
import org.opensearch.docql.plan.KeyspaceTerm;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.OptimizerEstimates;
import org.opensearch.docql.plan.Range2;
import org.opensearch.docql.plan.Span2;
import org.opensearch.docql.plan.exceptions.IndexSelectionException;
import org.opensearch.docql.plan.scan.IndexScan3;
import org.opensearch.docql.plan.scan.PrimaryScan3;
import org.opensearch.docql.plan.scan.UnionScan;

/**
 * Chooses the access path of one keyspace for a predicate.
 *
 * <p>Online secondary indexes are considered in indexer order, then declaration order. An index
 * qualifies when the predicate constrains its leading key. Among qualifying indexes, one whose
 * partial condition is equivalent to the predicate wins at once; otherwise the first index whose
 * condition is implied by the predicate, then the first index without a condition. When nothing
 * qualifies, the keyspace is scanned through an online primary index.
 *
 * <p>The selection is sound, not optimal: every document satisfying the predicate is returned by
 * the chosen scan, but costs are not compared and indexes are never intersected.
 */
@Log4j2
@RequiredArgsConstructor
public class IndexScanSelector {

  /** Upper bound on the spans of one index scan. */
  @Getter private final int maxSpans;

  private final NnfNormalizer normalizer = new NnfNormalizer();

  public Operator selectScan(Keyspace keyspace, KeyspaceTerm term, Expression where) {
    return selectScan(keyspace, term, where, false);
  }

  /**
   * Build the scan of the keyspace for the predicate.
   *
   * @param keyspace keyspace to scan
   * @param term keyspace reference of the statement, with its alias and index hints
   * @param where predicate over the keyspace, or null
   * @param hasDeltaKeyspace whether the keyspace carries uncommitted transaction writes
   * @return an index scan, an index scan under a deduplicating union, or a primary scan
   * @throws IndexSelectionException if no access path can be built
   */
  public Operator selectScan(
      Keyspace keyspace, KeyspaceTerm term, Expression where, boolean hasDeltaKeyspace) {
    Preconditions.checkNotNull(keyspace, "keyspace");
    Preconditions.checkNotNull(term, "term");
    Formalizer formalizer = new Formalizer(term.getAlias());
    Expression pred = where == null ? null : normalizer.normalize(formalizer.formalize(where));

    if (pred != null) {
      Candidate chosen = chooseIndex(keyspace, term, pred, formalizer);
      if (chosen != null) {
        log.debug(
            "Using index {} on {} with {} span(s)",
            chosen.index.getName(), keyspace.getName(), chosen.spans.size());
        return indexScan(keyspace, term, chosen, hasDeltaKeyspace);
      }
    }
    return primaryScan(keyspace, term, hasDeltaKeyspace);
  }

  private Candidate chooseIndex(
      Keyspace keyspace, KeyspaceTerm term, Expression pred, Formalizer formalizer) {
    Candidate filtered = null;
    Candidate unfiltered = null;
    for (Index index : candidates(keyspace, term)) {
      Candidate candidate = sargable(index, pred, formalizer);
      if (candidate == null) {
        continue;
      }
      if (candidate.condition == null) {
        if (unfiltered == null) {
          unfiltered = candidate;
        }
      } else if (candidate.condition.equals(pred)) {
        return candidate;
      } else if (filtered == null && Subsets.subsetOf(pred, candidate.condition)) {
        filtered = candidate;
      }
    }
    return filtered != null ? filtered : unfiltered;
  }

  /** Online secondary indexes, restricted to the hinted ones when the term has hints. */
  private List<Index> candidates(Keyspace keyspace, KeyspaceTerm term) {
    List<Index> candidates = new ArrayList<>();
    for (Indexer indexer : keyspace.getIndexers()) {
      if (indexer.getType() == IndexType.FTS) {
        continue;
      }
      for (Index index : indexer.getIndexes()) {
        if (index.isPrimary()
            || index.getRangeKey().isEmpty()
            || index.getState() != IndexState.ONLINE) {
          continue;
        }
        if (term.hasIndexHints() && !term.getIndexHints().contains(index.getName())) {
          continue;
        }
        candidates.add(index);
      }
    }
    return candidates;
  }

  /**
   * Spans of the index for the predicate, or null if the predicate does not constrain the leading
   * key, or constrains it to more spans than allowed. A predicate that no key value satisfies gets
   * a single span over {@link Range2#EMPTY}.
   */
  private Candidate sargable(Index index, Expression pred, Formalizer formalizer) {
    List<Expression> keys =
        index.getRangeKey().stream()
            .map(key -> normalizer.normalize(formalizer.formalize(key)))
            .collect(Collectors.toList());
    if (keys.get(0).isStatic()) {
      return null;
    }

    List<List<Range2>> keyRanges = new ArrayList<>();
    long combinations = 1;
    for (Expression key : keys) {
      List<Range2> ranges = Sarg.ranges(key, pred);
      if (ranges == null) {
        break;
      }
      if (combinations * Math.max(ranges.size(), 1) > maxSpans) {
        if (keyRanges.isEmpty()) {
          log.debug(
              "Skipping index {}: {} spans on its leading key", index.getName(), ranges.size());
          return null;
        }
        break;
      }
      keyRanges.add(ranges);
      combinations *= Math.max(ranges.size(), 1);
    }
    if (keyRanges.isEmpty()) {
      return null;
    }

    Expression condition =
        index.getCondition() == null
            ? null
            : normalizer.normalize(formalizer.formalize(index.getCondition()));
    List<Expression> spanned = keys.subList(0, keyRanges.size());
    boolean exact = isExact(spanned, keyRanges, pred);
    List<Span2> spans = new ArrayList<>();
    for (List<Range2> ranges : Lists.cartesianProduct(keyRanges)) {
      Span2 span = new Span2(seek(ranges), ranges, exact);
      if (!span.isEmpty()) {
        spans.add(span);
      }
    }
    if (spans.isEmpty()) {
      log.debug("Predicate {} cannot hold on index {}", pred, index.getName());
      spans.add(new Span2(ImmutableList.of(), ImmutableList.of(Range2.EMPTY), true));
    }
    return new Candidate(index, condition, spans);
  }

  /** Point values of a span made of point ranges only. */
  private static List<Expression> seek(List<Range2> ranges) {
    if (!ranges.stream().allMatch(Range2::isEqualRange)) {
      return ImmutableList.of();
    }
    return ranges.stream().map(Range2::getLow).collect(Collectors.toList());
  }

  /**
   * True if the spans decide the predicate alone: every conjunct is an exact constraint on one of
   * the spanned keys, and keys constrained by several conjuncts have constant ranges.
   */
  private static boolean isExact(
      List<Expression> keys, List<List<Range2>> keyRanges, Expression pred) {
    List<Expression> conjuncts =
        pred instanceof And ? ((And) pred).getOperands() : ImmutableList.of(pred);
    int[] constraints = new int[keys.size()];
    for (Expression conjunct : conjuncts) {
      boolean matched = false;
      for (int i = 0; i < keys.size(); i++) {
        if (Sarg.isExact(keys.get(i), conjunct)) {
          constraints[i]++;
          matched = true;
        }
      }
      if (!matched) {
        return false;
      }
    }
    for (int i = 0; i < keys.size(); i++) {
      if (constraints[i] > 1 && !keyRanges.get(i).stream().allMatch(Range2::isConstant)) {
        return false;
      }
    }
    return true;
  }

  private Operator indexScan(
      Keyspace keyspace, KeyspaceTerm term, Candidate chosen, boolean hasDeltaKeyspace) {
    IndexScan3 scan =
        new IndexScan3(
            keyspace, term, chosen.index, chosen.spans, false, false, false, null,
            ImmutableList.of(), null, null, ImmutableList.of(), ImmutableMap.of(), null,
            hasDeltaKeyspace, null, OptimizerEstimates.UNAVAILABLE);
    if (chosen.spans.size() == 1) {
      return scan;
    }
    return new UnionScan(ImmutableList.of(scan), null, null, OptimizerEstimates.UNAVAILABLE);
  }

  private Operator primaryScan(Keyspace keyspace, KeyspaceTerm term, boolean hasDeltaKeyspace) {
    List<PrimaryIndex> primaries = new ArrayList<>();
    for (Indexer indexer : keyspace.getIndexers()) {
      primaries.addAll(indexer.getPrimaryIndexes());
    }
    if (primaries.isEmpty()) {
      String message =
          StringUtils.format(
              "No index available on keyspace %s", keyspace.getPath().getFullName());
      log.error(message);
      throw new IndexSelectionException(message);
    }
    PrimaryIndex chosen = null;
    for (PrimaryIndex primary : primaries) {
      if (primary.getState() != IndexState.ONLINE) {
        continue;
      }
      if (!term.hasIndexHints() || term.getIndexHints().contains(primary.getName())) {
        chosen = primary;
        break;
      }
      if (chosen == null) {
        chosen = primary;
      }
    }
    if (chosen == null) {
      String message =
          StringUtils.format(
              "Primary index %s on keyspace %s is not online",
              primaries.get(0).getName(), keyspace.getPath().getFullName());
      log.error(message);
      throw new IndexSelectionException(message);
    }
    log.debug("Using primary index {} on {}", chosen.getName(), keyspace.getName());
    return new PrimaryScan3(
        keyspace, term, chosen, null, null, hasDeltaKeyspace, OptimizerEstimates.UNAVAILABLE);
  }

  @RequiredArgsConstructor
  private static class Candidate {
    private final Index index;
    private final Expression condition;
    private final List<Span2> spans;
  }
}
