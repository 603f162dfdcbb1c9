/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.datastore;

public enum IndexState {
  PENDING,
  DEFERRED,
  BUILDING,
  ONLINE,
  OFFLINE,
  SCHEDULED
}
