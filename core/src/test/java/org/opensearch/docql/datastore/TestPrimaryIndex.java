/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

import com.google.common.collect.ImmutableList;

public class TestPrimaryIndex extends TestIndex implements PrimaryIndex {

  TestPrimaryIndex(String id, String name, TestIndexer indexer) {
    super(id, name, indexer, ImmutableList.of(), null, true);
  }
}
