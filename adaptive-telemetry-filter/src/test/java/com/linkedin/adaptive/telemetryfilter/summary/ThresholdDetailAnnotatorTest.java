/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.summary;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.adaptive.telemetryfilter.composite.CompositeScore;
import com.linkedin.adaptive.telemetryfilter.threshold.DynamicThresholdEngine;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Test;

import static com.linkedin.adaptive.telemetryfilter.AdaptiveTelemetryFilterUnitTestUtils.batch;
import static com.linkedin.adaptive.telemetryfilter.AdaptiveTelemetryFilterUnitTestUtils.filterConfig;
import static com.linkedin.adaptive.telemetryfilter.AdaptiveTelemetryFilterUnitTestUtils.process;
import static com.linkedin.adaptive.telemetryfilter.config.constants.ThresholdConfig.DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.ThresholdConfig.ENABLE_DYNAMIC_THRESHOLDS_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.ThresholdConfig.METRIC_THRESHOLD_PREFIX;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


/**
 * Unit test class for {@link ThresholdDetailAnnotator}.
 */
public class ThresholdDetailAnnotatorTest {
  private static final double EPSILON = 1E-9;
  private static final long NOW_MS = 1_700_000_000_500L;

  @Test
  public void testStaticThresholdDetails() {
    DynamicThresholdEngine engine = new DynamicThresholdEngine(filterConfig(), new MockTime(), new ReentrantReadWriteLock());
    ThresholdDetailAnnotator annotator = new ThresholdDetailAnnotator(Map.of("cpu", 50.0, "memory", 0.0), engine);
    Map<String, String> attributes = new HashMap<>();

    assertEquals(1, annotator.annotate(attributes, Map.of("cpu", 80.0, "memory", 10.0, "other", 1.0), null, NOW_MS));
    JsonObject detail = JsonParser.parseString(attributes.get("process.atp.threshold.cpu")).getAsJsonObject();
    assertEquals(50.0, detail.get("threshold").getAsDouble(), EPSILON);
    assertEquals(80.0, detail.get("observed_value").getAsDouble(), EPSILON);
    assertEquals("static", detail.get("threshold_type").getAsString());
    assertEquals(1_700_000_000L, detail.get("evaluation_timestamp").getAsLong());
    assertFalse(attributes.containsKey("process.atp.threshold.memory"));
    assertFalse(attributes.containsKey("process.atp.threshold.other"));
    assertFalse(attributes.containsKey(ThresholdDetailAnnotator.ATP_ATTRIBUTE));
  }

  @Test
  public void testDynamicThresholdAndCompositeDetails() {
    MockTime time = new MockTime();
    DynamicThresholdEngine engine = new DynamicThresholdEngine(filterConfig(METRIC_THRESHOLD_PREFIX + "cpu", "10",
                                                                            ENABLE_DYNAMIC_THRESHOLDS_CONFIG, "true",
                                                                            DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_CONFIG, "1000"),
                                                               time, new ReentrantReadWriteLock());
    time.sleep(1000L);
    assertTrue(engine.update(batch(process("1", Map.of("cpu", 15.0)))));
    ThresholdDetailAnnotator annotator = new ThresholdDetailAnnotator(Map.of("cpu", 10.0), engine);
    Map<String, String> attributes = new HashMap<>();

    annotator.annotate(attributes, Map.of("cpu", 12.0), new CompositeScore(1.8, 1.5, 2, "Score 1.80"), NOW_MS);
    JsonObject detail = JsonParser.parseString(attributes.get("process.atp.threshold.cpu")).getAsJsonObject();
    assertEquals("dynamic", detail.get("threshold_type").getAsString());
    assertEquals(10.6, detail.get("threshold").getAsDouble(), EPSILON);

    JsonObject multiMetric = JsonParser.parseString(attributes.get(ThresholdDetailAnnotator.ATP_ATTRIBUTE))
                                       .getAsJsonObject().getAsJsonObject("multi_metric");
    assertEquals(1.8, multiMetric.get("composite_score").getAsDouble(), EPSILON);
    assertEquals(1.5, multiMetric.get("threshold").getAsDouble(), EPSILON);
  }
}
