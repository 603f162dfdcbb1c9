/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Metadata version of an indexer or keyspace as seen when a plan was last verified, together with
 * the live object it was read from.
 *
 * @param <T> {@link org.opensearch.docql.datastore.Indexer} or {@link
 *     org.opensearch.docql.datastore.Keyspace}
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class MetadataStamp<T> {

  private final T target;

  private final long version;
}
