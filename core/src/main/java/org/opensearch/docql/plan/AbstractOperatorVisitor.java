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
 * {@link OperatorVisitor} that routes every kind to {@link #visitOperator(Operator, Object)}.
 * Subclasses override the kinds they treat specially.
 *
 * @param <R> result type
 * @param <C> context type
 */
public abstract class AbstractOperatorVisitor<R, C> implements OperatorVisitor<R, C> {

  /** Default handling for every operator kind. Visits the children and returns null. */
  public R visitOperator(Operator op, C context) {
    for (Operator child : op.getChildren()) {
      child.accept(this, context);
    }
    return null;
  }

  @Override
  public R visitPrimaryScan3(PrimaryScan3 op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexScan3(IndexScan3 op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitUnionScan(UnionScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIntersectScan(IntersectScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitOrderedIntersectScan(OrderedIntersectScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitDistinctScan(DistinctScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitKeyScan(KeyScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitValueScan(ValueScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitDummyScan(DummyScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitExpressionScan(ExpressionScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitCountScan(CountScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexCountScan2(IndexCountScan2 op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexCountDistinctScan2(IndexCountDistinctScan2 op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitPrimaryScan(PrimaryScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexScan(IndexScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexScan2(IndexScan2 op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexCountScan(IndexCountScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitParentScan(ParentScan op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitFetch(Fetch op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitFilter(Filter op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitInitialProject(InitialProject op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitFinalProject(FinalProject op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexCountProject(IndexCountProject op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitInitialGroup(InitialGroup op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIntermediateGroup(IntermediateGroup op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitFinalGroup(FinalGroup op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitOrder(Order op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitOffset(Offset op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitLimit(Limit op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitDistinct(Distinct op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitLet(Let op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitUnnest(Unnest op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSequence(Sequence op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitParallel(Parallel op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitDiscard(Discard op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitHashJoin(HashJoin op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitNestedLoopJoin(NestedLoopJoin op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexJoin(IndexJoin op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitJoin(Join op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitHashNest(HashNest op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitIndexNest(IndexNest op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSendInsert(SendInsert op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSendUpsert(SendUpsert op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSendUpdate(SendUpdate op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSendDelete(SendDelete op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitClone(Clone op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSet(Set op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitUnset(Unset op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitCreatePrimaryIndex(CreatePrimaryIndex op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitCreateIndex(CreateIndex op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitDropIndex(DropIndex op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitAlterIndex(AlterIndex op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitBuildIndexes(BuildIndexes op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitUpdateStatistics(UpdateStatistics op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitStartTransaction(StartTransaction op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitCommitTransaction(CommitTransaction op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitRollbackTransaction(RollbackTransaction op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitTransactionIsolation(TransactionIsolation op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitSavepoint(Savepoint op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitExplain(Explain op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitPrepare(Prepare op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitAdvise(Advise op, C context) {
    return visitOperator(op, context);
  }

  @Override
  public R visitInferKeyspace(InferKeyspace op, C context) {
    return visitOperator(op, context);
  }
}
