/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.common.utils.StringUtils;
import org.opensearch.docql.datastore.Datastore;
import org.opensearch.docql.datastore.Index;
import org.opensearch.docql.datastore.IndexType;
import org.opensearch.docql.datastore.Indexer;
import org.opensearch.docql.datastore.Keyspace;
import org.opensearch.docql.datastore.exceptions.IndexNotFoundException;
import org.opensearch.docql.datastore.exceptions.IndexerNotFoundException;
import org.opensearch.docql.datastore.exceptions.KeyspaceNotFoundException;
import org.opensearch.docql.expression.Expression;
import org.opensearch.docql.expression.ExpressionParser;
import org.opensearch.docql.expression.ExpressionSyntaxException;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;
import org.opensearch.docql.plan.exceptions.UnresolvedReferenceException;

/**
 * Collaborators needed to turn encoded records back into operators: the live datastore for
 * keyspace and index references, the expression parser, and the operator registry.
 */
@Getter
@RequiredArgsConstructor
public class PlanDecodingContext {

  public static final String CHILD_FIELD = "~child";

  public static final String CHILDREN_FIELD = "~children";

  private final Datastore datastore;

  private final ExpressionParser parser;

  private final OperatorRegistry registry;

  /**
   * Decode an operator record of any kind.
   *
   * @param node encoded record
   * @return decoded operator
   */
  public Operator decodeOperator(JsonNode node) {
    ObjectNode record = PlanJson.asObject(node, "operator");
    String tag = PlanJson.optString(record, Operator.OPERATOR_FIELD);
    if (tag == null) {
      throw new PlanDecodingException("operator record has no " + Operator.OPERATOR_FIELD);
    }
    Operator operator = registry.newInstance(tag);
    operator.decode(record, this);
    return operator;
  }

  /** Decodes the required single child stored under the field. */
  public Operator decodeChild(ObjectNode node, String field) {
    JsonNode child = node.get(field);
    if (child == null) {
      throw new PlanDecodingException(
          StringUtils.format(
              "%s: missing field %s", node.path(Operator.OPERATOR_FIELD).asText(), field));
    }
    return decodeOperator(child);
  }

  /** Decodes the children stored as an array under the field. */
  public List<Operator> decodeChildren(ObjectNode node, String field) {
    List<Operator> children = new ArrayList<>();
    for (JsonNode child : PlanJson.optArray(node, field)) {
      children.add(decodeOperator(child));
    }
    return children;
  }

  public Expression parseExpression(String text) {
    try {
      return parser.parse(text);
    } catch (ExpressionSyntaxException e) {
      throw new PlanDecodingException("Invalid expression in plan: " + e.getMessage(), e);
    }
  }

  public Keyspace resolveKeyspace(KeyspaceTerm term) {
    try {
      return datastore.getKeyspace(term.getPath());
    } catch (KeyspaceNotFoundException e) {
      throw new UnresolvedReferenceException(
          "Keyspace " + term.getPath().getFullName() + " not found", e);
    }
  }

  /**
   * Resolve the index named by the {@code index}, {@code index_id} and {@code using} fields of a
   * record. The id is preferred; the name is used when the record carries no id.
   */
  public Index resolveIndex(Keyspace keyspace, ObjectNode node) {
    String name = PlanJson.requireString(node, IndexReference.INDEX_FIELD);
    String id = PlanJson.optString(node, IndexReference.INDEX_ID_FIELD);
    IndexType type = IndexReference.readType(node);
    try {
      Indexer indexer = keyspace.getIndexer(type);
      return id != null ? indexer.getIndexById(id) : indexer.getIndexByName(name);
    } catch (IndexerNotFoundException | IndexNotFoundException e) {
      throw new UnresolvedReferenceException(
          StringUtils.format(
              "Index %s (%s) on keyspace %s not found",
              name, type.getWireName(), keyspace.getPath().getFullName()),
          e);
    }
  }
}
