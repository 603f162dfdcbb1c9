/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.config;

import org.opensearch.docql.common.codec.GzipBase64TextCodec;
import org.opensearch.docql.datastore.Datastore;
import org.opensearch.docql.expression.DefaultExpressionParser;
import org.opensearch.docql.expression.ExpressionParser;
import org.opensearch.docql.plan.OperatorRegistry;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.prepared.PreparedCodec;
import org.opensearch.docql.planner.IndexScanSelector;
import org.opensearch.docql.prepareds.PreparedCache;
import org.opensearch.docql.prepareds.Repreparer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plan layer around a {@link Datastore} and a {@link Repreparer} registered by the
 * embedding query service.
 */
@Configuration
public class PlannerConfig {

  @Autowired
  private Datastore datastore;

  @Autowired
  private Repreparer repreparer;

  @Bean
  public PlannerSettings plannerSettings() {
    return PlannerSettings.load();
  }

  @Bean
  public ExpressionParser expressionParser() {
    return new DefaultExpressionParser();
  }

  @Bean
  public OperatorRegistry operatorRegistry() {
    return new OperatorRegistry();
  }

  @Bean
  public PlanDecodingContext planDecodingContext(
      ExpressionParser expressionParser, OperatorRegistry operatorRegistry) {
    return new PlanDecodingContext(datastore, expressionParser, operatorRegistry);
  }

  @Bean
  public PreparedCodec preparedCodec(PlanDecodingContext planDecodingContext) {
    return new PreparedCodec(new GzipBase64TextCodec(), planDecodingContext);
  }

  @Bean
  public IndexScanSelector indexScanSelector(PlannerSettings plannerSettings) {
    return new IndexScanSelector(plannerSettings.getMaxSpans());
  }

  /**
   * Prepared plan cache.
   *
   * @return PreparedCache.
   */
  @Bean
  public PreparedCache preparedCache(PlannerSettings plannerSettings, PreparedCodec preparedCodec) {
    return new PreparedCache(plannerSettings, datastore, preparedCodec, repreparer);
  }
}
