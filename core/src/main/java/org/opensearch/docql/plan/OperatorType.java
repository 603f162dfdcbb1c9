/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operator kinds and the tag each one is encoded under as {@code #operator}. */
@Getter
@RequiredArgsConstructor
public enum OperatorType {
  PRIMARY_SCAN3("PrimaryScan3"),
  INDEX_SCAN3("IndexScan3"),
  UNION_SCAN("UnionScan"),
  INTERSECT_SCAN("IntersectScan"),
  ORDERED_INTERSECT_SCAN("OrderedIntersectScan"),
  DISTINCT_SCAN("DistinctScan"),
  KEY_SCAN("KeyScan"),
  VALUE_SCAN("ValueScan"),
  DUMMY_SCAN("DummyScan"),
  EXPRESSION_SCAN("ExpressionScan"),
  COUNT_SCAN("CountScan"),
  INDEX_COUNT_SCAN2("IndexCountScan2"),
  INDEX_COUNT_DISTINCT_SCAN2("IndexCountDistinctScan2"),
  PRIMARY_SCAN("PrimaryScan"),
  INDEX_SCAN("IndexScan"),
  INDEX_SCAN2("IndexScan2"),
  INDEX_COUNT_SCAN("IndexCountScan"),
  PARENT_SCAN("ParentScan"),
  FETCH("Fetch"),
  FILTER("Filter"),
  INITIAL_PROJECT("InitialProject"),
  FINAL_PROJECT("FinalProject"),
  INDEX_COUNT_PROJECT("IndexCountProject"),
  INITIAL_GROUP("InitialGroup"),
  INTERMEDIATE_GROUP("IntermediateGroup"),
  FINAL_GROUP("FinalGroup"),
  ORDER("Order"),
  OFFSET("Offset"),
  LIMIT("Limit"),
  DISTINCT("Distinct"),
  LET("Let"),
  UNNEST("Unnest"),
  SEQUENCE("Sequence"),
  PARALLEL("Parallel"),
  DISCARD("Discard"),
  HASH_JOIN("HashJoin"),
  NESTED_LOOP_JOIN("NestedLoopJoin"),
  INDEX_JOIN("IndexJoin"),
  JOIN("Join"),
  HASH_NEST("HashNest"),
  INDEX_NEST("IndexNest"),
  SEND_INSERT("SendInsert"),
  SEND_UPSERT("SendUpsert"),
  SEND_UPDATE("SendUpdate"),
  SEND_DELETE("SendDelete"),
  CLONE("Clone"),
  SET("Set"),
  UNSET("Unset"),
  CREATE_PRIMARY_INDEX("CreatePrimaryIndex"),
  CREATE_INDEX("CreateIndex"),
  DROP_INDEX("DropIndex"),
  ALTER_INDEX("AlterIndex"),
  BUILD_INDEXES("BuildIndexes"),
  UPDATE_STATISTICS("UpdateStatistics"),
  START_TRANSACTION("StartTransaction"),
  COMMIT_TRANSACTION("CommitTransaction"),
  ROLLBACK_TRANSACTION("RollbackTransaction"),
  TRANSACTION_ISOLATION("TransactionIsolation"),
  SAVEPOINT("Savepoint"),
  EXPLAIN("Explain"),
  PREPARE("Prepare"),
  ADVISE("Advise"),
  INFER_KEYSPACE("InferKeyspace");

  private static final Map<String, OperatorType> BY_WIRE_NAME =
      Arrays.stream(values())
          .collect(Collectors.toMap(OperatorType::getWireName, Function.identity()));

  private final String wireName;

  /** Returns the kind encoded under the tag, or null for an unknown tag. */
  public static OperatorType fromWireName(String wireName) {
    return BY_WIRE_NAME.get(wireName);
  }
}
