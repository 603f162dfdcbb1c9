/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.common.codec;

/** Turns raw bytes into a text-safe string that can be stored or transmitted, and back. */
public interface TextCodec {

  String encode(byte[] bytes);

  /**
   * Reverses {@link #encode(byte[])}.
   *
   * @throws IllegalArgumentException if the text is not a valid encoding
   */
  byte[] decode(String text);
}
