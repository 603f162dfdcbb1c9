/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.docql.datastore.Datastore;
import org.opensearch.docql.datastore.TestDatastore;
import org.opensearch.docql.plan.prepared.PreparedCodec;
import org.opensearch.docql.planner.IndexScanSelector;
import org.opensearch.docql.prepareds.PreparedCache;
import org.opensearch.docql.prepareds.Repreparer;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

@ExtendWith(MockitoExtension.class)
class PlannerConfigTest {

  @Mock private Repreparer repreparer;

  @Test
  void testPlanLayerBeans() {
    TestDatastore datastore = new TestDatastore();
    try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
      context.registerBean(Datastore.class, () -> datastore);
      context.registerBean(Repreparer.class, () -> repreparer);
      context.register(PlannerConfig.class);
      context.refresh();

      PlannerSettings settings = context.getBean(PlannerSettings.class);
      PreparedCache cache = context.getBean(PreparedCache.class);
      assertSame(settings, cache.getSettings());
      assertEquals(settings.getPreparedCacheLimit(), cache.getLimit());
      assertNotNull(context.getBean(PreparedCodec.class));
      assertNotNull(context.getBean(IndexScanSelector.class));
    }
  }
}
