/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Address of a keyspace: either {@code namespace:keyspace} for a bucket's default collection or
 * {@code namespace:bucket.scope.keyspace} for a named collection.
 */
@Getter
@EqualsAndHashCode
public class KeyspacePath {

  private final String namespace;

  private final String bucket;

  private final String scope;

  private final String keyspace;

  private KeyspacePath(String namespace, String bucket, String scope, String keyspace) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace is required");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(keyspace), "keyspace is required");
    Preconditions.checkArgument(
        Strings.isNullOrEmpty(bucket) == Strings.isNullOrEmpty(scope),
        "bucket and scope must be given together");
    this.namespace = namespace;
    this.bucket = Strings.emptyToNull(bucket);
    this.scope = Strings.emptyToNull(scope);
    this.keyspace = keyspace;
  }

  public static KeyspacePath of(String namespace, String keyspace) {
    return new KeyspacePath(namespace, null, null, keyspace);
  }

  public static KeyspacePath of(String namespace, String bucket, String scope, String keyspace) {
    return new KeyspacePath(namespace, bucket, scope, keyspace);
  }

  public boolean isCollection() {
    return bucket != null;
  }

  /** Fully qualified name, the identity used in transaction delta sets. */
  public String getFullName() {
    return isCollection()
        ? namespace + ":" + bucket + "." + scope + "." + keyspace
        : namespace + ":" + keyspace;
  }

  @Override
  public String toString() {
    return getFullName();
  }
}
