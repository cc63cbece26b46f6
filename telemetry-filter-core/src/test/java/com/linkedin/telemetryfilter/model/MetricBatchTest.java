/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.telemetryfilter.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class MetricBatchTest {

  private static ResourceMetrics resource(String pid, int numMetrics) {
    Metric[] metrics = new Metric[numMetrics];
    for (int i = 0; i < numMetrics; i++) {
      metrics[i] = new Metric("m" + i, MetricType.GAUGE, Collections.singletonList(new DataPoint(i, 0L)));
    }
    return new ResourceMetrics(Map.of("process.pid", pid),
                               Collections.singletonList(new ScopeMetrics("scope", "1.0", Arrays.asList(metrics))));
  }

  @Test
  public void testCounts() {
    MetricBatch batch = new MetricBatch(Arrays.asList(resource("1", 2), resource("2", 3)));
    assertEquals(2, batch.resourceCount());
    assertEquals(5, batch.metricCount());
    assertFalse(batch.isEmpty());
    assertTrue(MetricBatch.empty().isEmpty());
    assertEquals(0, MetricBatch.empty().metricCount());
  }

  @Test
  public void testWithAttributesSharesMetrics() {
    ResourceMetrics original = resource("7", 1);
    ResourceMetrics annotated = original.withAttributes(Map.of("process.pid", "7", "extra", "x"));
    assertNull(original.attribute("extra"));
    assertEquals("x", annotated.attribute("extra"));
    assertSame(original.scopeMetrics().get(0), annotated.scopeMetrics().get(0));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testAttributesAreImmutable() {
    resource("1", 1).attributes().put("k", "v");
  }

  @Test
  public void testScalarKinds() {
    assertTrue(MetricType.GAUGE.isScalar());
    assertTrue(MetricType.SUM.isScalar());
    assertFalse(MetricType.HISTOGRAM.isScalar());
    assertFalse(MetricType.EXPONENTIAL_HISTOGRAM.isScalar());
    assertFalse(MetricType.SUMMARY.isScalar());
    assertEquals(5, MetricType.cachedValues().size());
  }
}
