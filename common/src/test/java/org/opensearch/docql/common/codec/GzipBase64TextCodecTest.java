/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.common.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GzipBase64TextCodecTest {

  private final TextCodec codec = new GzipBase64TextCodec();

  @Test
  void should_restore_original_bytes() {
    byte[] payload = "{\"#operator\":\"DummyScan\"}".getBytes(StandardCharsets.UTF_8);

    String encoded = codec.encode(payload);

    assertArrayEquals(payload, codec.decode(encoded));
  }

  @Test
  void should_produce_base64_text() {
    String encoded = codec.encode("plan".getBytes(StandardCharsets.UTF_8));

    assertEquals(true, encoded.matches("[A-Za-z0-9+/=]+"));
  }

  @Test
  void should_decode_legacy_empty_plan() {
    assertEquals(0, codec.decode(GzipBase64TextCodec.EMPTY).length);
  }

  @Test
  void should_reject_text_that_is_not_base64() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("not base64 !"));
  }

  @Test
  void should_reject_base64_that_is_not_gzip() {
    String notGzip = java.util.Base64.getEncoder().encodeToString(new byte[] {1, 2, 3});

    assertThrows(IllegalArgumentException.class, () -> codec.decode(notGzip));
  }
}
