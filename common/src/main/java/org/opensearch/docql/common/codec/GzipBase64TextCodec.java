/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.common.codec;

import com.google.common.io.ByteStreams;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * {@link TextCodec} that gzip-compresses the payload and then encodes it with standard base64.
 * This is the portable form of an encoded plan.
 */
public class GzipBase64TextCodec implements TextCodec {

  /** Encoded form of an empty payload, accepted for compatibility with older clients. */
  public static final String EMPTY = "H4sIAAAAAAAA/wEAAP//AAAAAAAAAAA=";

  @Override
  public String encode(byte[] bytes) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
      gzip.write(bytes);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to compress payload", e);
    }
    return Base64.getEncoder().encodeToString(buffer.toByteArray());
  }

  @Override
  public byte[] decode(String text) {
    byte[] compressed = Base64.getDecoder().decode(text);
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return ByteStreams.toByteArray(gzip);
    } catch (IOException e) {
      throw new IllegalArgumentException("Payload is not gzip compressed: " + e.getMessage(), e);
    }
  }
}
