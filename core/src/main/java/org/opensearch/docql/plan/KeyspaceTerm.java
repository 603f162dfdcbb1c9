/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.docql.datastore.KeyspacePath;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/**
 * A keyspace as it appears in the FROM clause: its path, the alias documents are bound to, and
 * the {@code USE INDEX} hints. Hints steer planning only and are not part of the encoding.
 */
@Getter
@ToString
@EqualsAndHashCode
public class KeyspaceTerm {

  private final KeyspacePath path;

  private final String alias;

  private final boolean underNestedLoop;

  private final List<String> indexHints;

  public KeyspaceTerm(
      KeyspacePath path, String alias, boolean underNestedLoop, List<String> indexHints) {
    this.path = path;
    this.alias = Strings.isNullOrEmpty(alias) ? path.getKeyspace() : alias;
    this.underNestedLoop = underNestedLoop;
    this.indexHints = ImmutableList.copyOf(indexHints);
  }

  public static KeyspaceTerm of(KeyspacePath path, String alias) {
    return new KeyspaceTerm(path, alias, false, ImmutableList.of());
  }

  public KeyspaceTerm withIndexHints(List<String> hints) {
    return new KeyspaceTerm(path, alias, underNestedLoop, hints);
  }

  public boolean hasIndexHints() {
    return !indexHints.isEmpty();
  }

  /** Writes namespace, bucket, scope, keyspace, as and nested_loop. */
  public void writeTo(ObjectNode node) {
    node.put("namespace", path.getNamespace());
    PlanJson.putString(node, "bucket", path.getBucket());
    PlanJson.putString(node, "scope", path.getScope());
    node.put("keyspace", path.getKeyspace());
    node.put("as", alias);
    PlanJson.putFlag(node, "nested_loop", underNestedLoop);
  }

  public static KeyspaceTerm readFrom(ObjectNode node) {
    String namespace = PlanJson.requireString(node, "namespace");
    String bucket = PlanJson.optString(node, "bucket");
    String scope = PlanJson.optString(node, "scope");
    String keyspace = PlanJson.requireString(node, "keyspace");
    KeyspacePath path;
    if (Strings.isNullOrEmpty(bucket) && Strings.isNullOrEmpty(scope)) {
      path = KeyspacePath.of(namespace, keyspace);
    } else if (!Strings.isNullOrEmpty(bucket) && !Strings.isNullOrEmpty(scope)) {
      path = KeyspacePath.of(namespace, bucket, scope, keyspace);
    } else {
      throw new PlanDecodingException(
          "bucket and scope must be given together for keyspace " + keyspace);
    }
    return new KeyspaceTerm(
        path,
        PlanJson.optString(node, "as"),
        PlanJson.optBoolean(node, "nested_loop"),
        ImmutableList.of());
  }
}
