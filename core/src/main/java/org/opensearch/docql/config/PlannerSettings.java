/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

/** Tunables of the planner and of the prepared plan cache. */
@Data
@NoArgsConstructor
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlannerSettings {

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "docql-planner.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Maximum number of prepared plans kept in the cache. */
  private int preparedCacheLimit = 16384;

  /** Scanned keyspaces above which transaction variants of a plan are not shared. */
  private int maxTxPreparedKeyspaces = 2;

  /** Maximum number of transaction variants kept per prepared plan. */
  private int maxTxPreparedVariants = 16;

  /** Maximum number of spans of one index scan. */
  private int maxSpans = 1024;

  /** Index API version used when a request does not name one. */
  private int indexApiVersion = 3;

  /** Settings from {@value #RESOURCE} on the classpath, or the defaults if there is none. */
  public static PlannerSettings load() {
    try (InputStream in = PlannerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.info("{} not found, using default planner settings", RESOURCE);
        return new PlannerSettings();
      }
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
  }

  public static PlannerSettings load(InputStream in) throws IOException {
    return MAPPER.readValue(in, PlannerSettings.class).validate();
  }

  /**
   * Check that every limit is usable.
   *
   * @throws IllegalArgumentException if a limit is out of range
   */
  public PlannerSettings validate() {
    Preconditions.checkArgument(preparedCacheLimit > 0, "preparedCacheLimit must be positive");
    Preconditions.checkArgument(
        maxTxPreparedKeyspaces >= 0, "maxTxPreparedKeyspaces must not be negative");
    Preconditions.checkArgument(
        maxTxPreparedVariants >= 0, "maxTxPreparedVariants must not be negative");
    Preconditions.checkArgument(maxSpans > 0, "maxSpans must be positive");
    return this;
  }
}
