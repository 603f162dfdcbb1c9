/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Kind of index service, written as the {@code using} field of index references. */
@Getter
@RequiredArgsConstructor
public enum IndexType {
  GSI("gsi"),
  FTS("fts"),
  SEQUENTIAL_SCAN("sequentialscan"),
  SYSTEM("system");

  private final String wireName;

  public static Optional<IndexType> fromWireName(String name) {
    return Arrays.stream(values()).filter(t -> t.wireName.equalsIgnoreCase(name)).findFirst();
  }
}
