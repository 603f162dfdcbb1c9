/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.Supplier;
import org.opensearch.docql.plan.ddl.AlterIndex;
import org.opensearch.docql.plan.ddl.BuildIndexes;
import org.opensearch.docql.plan.ddl.CreateIndex;
import org.opensearch.docql.plan.ddl.CreatePrimaryIndex;
import org.opensearch.docql.plan.ddl.DropIndex;
import org.opensearch.docql.plan.ddl.UpdateStatistics;
import org.opensearch.docql.plan.dml.Clone;
import org.opensearch.docql.plan.dml.SendDelete;
import org.opensearch.docql.plan.dml.SendInsert;
import org.opensearch.docql.plan.dml.SendUpdate;
import org.opensearch.docql.plan.dml.SendUpsert;
import org.opensearch.docql.plan.dml.Set;
import org.opensearch.docql.plan.dml.Unset;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;
import org.opensearch.docql.plan.exec.Advise;
import org.opensearch.docql.plan.exec.Explain;
import org.opensearch.docql.plan.exec.InferKeyspace;
import org.opensearch.docql.plan.exec.Prepare;
import org.opensearch.docql.plan.join.HashJoin;
import org.opensearch.docql.plan.join.HashNest;
import org.opensearch.docql.plan.join.IndexJoin;
import org.opensearch.docql.plan.join.IndexNest;
import org.opensearch.docql.plan.join.Join;
import org.opensearch.docql.plan.join.NestedLoopJoin;
import org.opensearch.docql.plan.legacy.IndexCountScan;
import org.opensearch.docql.plan.legacy.IndexScan2;
import org.opensearch.docql.plan.legacy.IndexScan;
import org.opensearch.docql.plan.legacy.ParentScan;
import org.opensearch.docql.plan.legacy.PrimaryScan;
import org.opensearch.docql.plan.query.Discard;
import org.opensearch.docql.plan.query.Distinct;
import org.opensearch.docql.plan.query.Fetch;
import org.opensearch.docql.plan.query.Filter;
import org.opensearch.docql.plan.query.FinalGroup;
import org.opensearch.docql.plan.query.FinalProject;
import org.opensearch.docql.plan.query.IndexCountProject;
import org.opensearch.docql.plan.query.InitialGroup;
import org.opensearch.docql.plan.query.InitialProject;
import org.opensearch.docql.plan.query.IntermediateGroup;
import org.opensearch.docql.plan.query.Let;
import org.opensearch.docql.plan.query.Limit;
import org.opensearch.docql.plan.query.Offset;
import org.opensearch.docql.plan.query.Order;
import org.opensearch.docql.plan.query.Parallel;
import org.opensearch.docql.plan.query.Sequence;
import org.opensearch.docql.plan.query.Unnest;
import org.opensearch.docql.plan.scan.CountScan;
import org.opensearch.docql.plan.scan.DistinctScan;
import org.opensearch.docql.plan.scan.DummyScan;
import org.opensearch.docql.plan.scan.ExpressionScan;
import org.opensearch.docql.plan.scan.IndexCountDistinctScan2;
import org.opensearch.docql.plan.scan.IndexCountScan2;
import org.opensearch.docql.plan.scan.IndexScan3;
import org.opensearch.docql.plan.scan.IntersectScan;
import org.opensearch.docql.plan.scan.KeyScan;
import org.opensearch.docql.plan.scan.OrderedIntersectScan;
import org.opensearch.docql.plan.scan.PrimaryScan3;
import org.opensearch.docql.plan.scan.UnionScan;
import org.opensearch.docql.plan.scan.ValueScan;
import org.opensearch.docql.plan.txn.CommitTransaction;
import org.opensearch.docql.plan.txn.RollbackTransaction;
import org.opensearch.docql.plan.txn.Savepoint;
import org.opensearch.docql.plan.txn.StartTransaction;
import org.opensearch.docql.plan.txn.TransactionIsolation;

/**
 * Maps every {@code #operator} tag to the factory of a zero-valued operator of that kind. The table
 * is built once and shared by all decoders.
 */
public class OperatorRegistry {

  private final Map<String, Supplier<Operator>> factories;

  public OperatorRegistry() {
    ImmutableMap.Builder<String, Supplier<Operator>> builder = ImmutableMap.builder();
    register(builder, OperatorType.PRIMARY_SCAN3, PrimaryScan3::new);
    register(builder, OperatorType.INDEX_SCAN3, IndexScan3::new);
    register(builder, OperatorType.UNION_SCAN, UnionScan::new);
    register(builder, OperatorType.INTERSECT_SCAN, IntersectScan::new);
    register(builder, OperatorType.ORDERED_INTERSECT_SCAN, OrderedIntersectScan::new);
    register(builder, OperatorType.DISTINCT_SCAN, DistinctScan::new);
    register(builder, OperatorType.KEY_SCAN, KeyScan::new);
    register(builder, OperatorType.VALUE_SCAN, ValueScan::new);
    register(builder, OperatorType.DUMMY_SCAN, DummyScan::new);
    register(builder, OperatorType.EXPRESSION_SCAN, ExpressionScan::new);
    register(builder, OperatorType.COUNT_SCAN, CountScan::new);
    register(builder, OperatorType.INDEX_COUNT_SCAN2, IndexCountScan2::new);
    register(builder, OperatorType.INDEX_COUNT_DISTINCT_SCAN2, IndexCountDistinctScan2::new);
    register(builder, OperatorType.PRIMARY_SCAN, PrimaryScan::new);
    register(builder, OperatorType.INDEX_SCAN, IndexScan::new);
    register(builder, OperatorType.INDEX_SCAN2, IndexScan2::new);
    register(builder, OperatorType.INDEX_COUNT_SCAN, IndexCountScan::new);
    register(builder, OperatorType.PARENT_SCAN, ParentScan::new);
    register(builder, OperatorType.FETCH, Fetch::new);
    register(builder, OperatorType.FILTER, Filter::new);
    register(builder, OperatorType.INITIAL_PROJECT, InitialProject::new);
    register(builder, OperatorType.FINAL_PROJECT, FinalProject::new);
    register(builder, OperatorType.INDEX_COUNT_PROJECT, IndexCountProject::new);
    register(builder, OperatorType.INITIAL_GROUP, InitialGroup::new);
    register(builder, OperatorType.INTERMEDIATE_GROUP, IntermediateGroup::new);
    register(builder, OperatorType.FINAL_GROUP, FinalGroup::new);
    register(builder, OperatorType.ORDER, Order::new);
    register(builder, OperatorType.OFFSET, Offset::new);
    register(builder, OperatorType.LIMIT, Limit::new);
    register(builder, OperatorType.DISTINCT, Distinct::new);
    register(builder, OperatorType.LET, Let::new);
    register(builder, OperatorType.UNNEST, Unnest::new);
    register(builder, OperatorType.SEQUENCE, Sequence::new);
    register(builder, OperatorType.PARALLEL, Parallel::new);
    register(builder, OperatorType.DISCARD, Discard::new);
    register(builder, OperatorType.HASH_JOIN, HashJoin::new);
    register(builder, OperatorType.NESTED_LOOP_JOIN, NestedLoopJoin::new);
    register(builder, OperatorType.INDEX_JOIN, IndexJoin::new);
    register(builder, OperatorType.JOIN, Join::new);
    register(builder, OperatorType.HASH_NEST, HashNest::new);
    register(builder, OperatorType.INDEX_NEST, IndexNest::new);
    register(builder, OperatorType.SEND_INSERT, SendInsert::new);
    register(builder, OperatorType.SEND_UPSERT, SendUpsert::new);
    register(builder, OperatorType.SEND_UPDATE, SendUpdate::new);
    register(builder, OperatorType.SEND_DELETE, SendDelete::new);
    register(builder, OperatorType.CLONE, Clone::new);
    register(builder, OperatorType.SET, Set::new);
    register(builder, OperatorType.UNSET, Unset::new);
    register(builder, OperatorType.CREATE_PRIMARY_INDEX, CreatePrimaryIndex::new);
    register(builder, OperatorType.CREATE_INDEX, CreateIndex::new);
    register(builder, OperatorType.DROP_INDEX, DropIndex::new);
    register(builder, OperatorType.ALTER_INDEX, AlterIndex::new);
    register(builder, OperatorType.BUILD_INDEXES, BuildIndexes::new);
    register(builder, OperatorType.UPDATE_STATISTICS, UpdateStatistics::new);
    register(builder, OperatorType.START_TRANSACTION, StartTransaction::new);
    register(builder, OperatorType.COMMIT_TRANSACTION, CommitTransaction::new);
    register(builder, OperatorType.ROLLBACK_TRANSACTION, RollbackTransaction::new);
    register(builder, OperatorType.TRANSACTION_ISOLATION, TransactionIsolation::new);
    register(builder, OperatorType.SAVEPOINT, Savepoint::new);
    register(builder, OperatorType.EXPLAIN, Explain::new);
    register(builder, OperatorType.PREPARE, Prepare::new);
    register(builder, OperatorType.ADVISE, Advise::new);
    register(builder, OperatorType.INFER_KEYSPACE, InferKeyspace::new);
    this.factories = builder.build();
  }

  private static void register(
      ImmutableMap.Builder<String, Supplier<Operator>> builder,
      OperatorType type,
      Supplier<Operator> factory) {
    builder.put(type.getWireName(), factory);
  }

  /**
   * Create a zero-valued operator for the tag.
   *
   * @throws PlanDecodingException if the tag is unknown
   */
  public Operator newInstance(String tag) {
    Supplier<Operator> factory = factories.get(tag);
    if (factory == null) {
      throw new PlanDecodingException("Unknown operator " + tag);
    }
    return factory.get();
  }

  public boolean isRegistered(String tag) {
    return factories.containsKey(tag);
  }
}
