/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

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
 * Visitor with one method per operator kind. Adding a kind adds a method here, so every
 * implementation has to decide how to handle it.
 *
 * @param <R> result type
 * @param <C> context type
 */
public interface OperatorVisitor<R, C> {

  // scan

  R visitPrimaryScan3(PrimaryScan3 op, C context);

  R visitIndexScan3(IndexScan3 op, C context);

  R visitUnionScan(UnionScan op, C context);

  R visitIntersectScan(IntersectScan op, C context);

  R visitOrderedIntersectScan(OrderedIntersectScan op, C context);

  R visitDistinctScan(DistinctScan op, C context);

  R visitKeyScan(KeyScan op, C context);

  R visitValueScan(ValueScan op, C context);

  R visitDummyScan(DummyScan op, C context);

  R visitExpressionScan(ExpressionScan op, C context);

  R visitCountScan(CountScan op, C context);

  R visitIndexCountScan2(IndexCountScan2 op, C context);

  R visitIndexCountDistinctScan2(IndexCountDistinctScan2 op, C context);

  // legacy

  R visitPrimaryScan(PrimaryScan op, C context);

  R visitIndexScan(IndexScan op, C context);

  R visitIndexScan2(IndexScan2 op, C context);

  R visitIndexCountScan(IndexCountScan op, C context);

  R visitParentScan(ParentScan op, C context);

  // query

  R visitFetch(Fetch op, C context);

  R visitFilter(Filter op, C context);

  R visitInitialProject(InitialProject op, C context);

  R visitFinalProject(FinalProject op, C context);

  R visitIndexCountProject(IndexCountProject op, C context);

  R visitInitialGroup(InitialGroup op, C context);

  R visitIntermediateGroup(IntermediateGroup op, C context);

  R visitFinalGroup(FinalGroup op, C context);

  R visitOrder(Order op, C context);

  R visitOffset(Offset op, C context);

  R visitLimit(Limit op, C context);

  R visitDistinct(Distinct op, C context);

  R visitLet(Let op, C context);

  R visitUnnest(Unnest op, C context);

  R visitSequence(Sequence op, C context);

  R visitParallel(Parallel op, C context);

  R visitDiscard(Discard op, C context);

  // join

  R visitHashJoin(HashJoin op, C context);

  R visitNestedLoopJoin(NestedLoopJoin op, C context);

  R visitIndexJoin(IndexJoin op, C context);

  R visitJoin(Join op, C context);

  R visitHashNest(HashNest op, C context);

  R visitIndexNest(IndexNest op, C context);

  // dml

  R visitSendInsert(SendInsert op, C context);

  R visitSendUpsert(SendUpsert op, C context);

  R visitSendUpdate(SendUpdate op, C context);

  R visitSendDelete(SendDelete op, C context);

  R visitClone(Clone op, C context);

  R visitSet(Set op, C context);

  R visitUnset(Unset op, C context);

  // ddl

  R visitCreatePrimaryIndex(CreatePrimaryIndex op, C context);

  R visitCreateIndex(CreateIndex op, C context);

  R visitDropIndex(DropIndex op, C context);

  R visitAlterIndex(AlterIndex op, C context);

  R visitBuildIndexes(BuildIndexes op, C context);

  R visitUpdateStatistics(UpdateStatistics op, C context);

  // txn

  R visitStartTransaction(StartTransaction op, C context);

  R visitCommitTransaction(CommitTransaction op, C context);

  R visitRollbackTransaction(RollbackTransaction op, C context);

  R visitTransactionIsolation(TransactionIsolation op, C context);

  R visitSavepoint(Savepoint op, C context);

  // exec

  R visitExplain(Explain op, C context);

  R visitPrepare(Prepare op, C context);

  R visitAdvise(Advise op, C context);

  R visitInferKeyspace(InferKeyspace op, C context);
}
