/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.threshold;

import com.linkedin.telemetryfilter.model.DataPoint;
import com.linkedin.telemetryfilter.model.Metric;
import com.linkedin.telemetryfilter.model.MetricBatch;
import com.linkedin.telemetryfilter.model.MetricType;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.adaptive.telemetryfilter.AdaptiveTelemetryFilterUnitTestUtils.batch;
import static com.linkedin.adaptive.telemetryfilter.AdaptiveTelemetryFilterUnitTestUtils.process;
import static com.linkedin.adaptive.telemetryfilter.AdaptiveTelemetryFilterUnitTestUtils.resource;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


/**
 * Unit test class for {@link DynamicThresholdEngine}.
 */
public class DynamicThresholdEngineTest {
  private static final double EPSILON = 1E-9;
  private static final long UPDATE_INTERVAL_MS = 1000L;
  private MockTime _time;

  @Before
  public void setUp() {
    _time = new MockTime();
  }

  private DynamicThresholdEngine engine(Map<String, Double> staticThresholds, Map<String, Double> maxs) {
    return new DynamicThresholdEngine(true, new TreeMap<>(staticThresholds), Collections.emptyMap(), maxs, 0.2,
                                      UPDATE_INTERVAL_MS, _time, new ReentrantReadWriteLock());
  }

  @Test
  public void testSeededWithPositiveStaticThresholds() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0, "memory", 0.0), Collections.emptyMap());
    assertEquals(10.0, engine.thresholdOf("cpu"), EPSILON);
    assertNull(engine.thresholdOf("memory"));
    assertEquals(1, engine.thresholds().size());
  }

  @Test
  public void testConvergesWithoutOvershoot() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0), Collections.emptyMap());
    MetricBatch batch = batch(process("1", Map.of("cpu", 10.0)), process("2", Map.of("cpu", 20.0)));
    // Target is 10 + 15 * 0.2.
    double target = 13.0;
    double previous = engine.thresholdOf("cpu");
    for (int i = 0; i < 40; i++) {
      _time.sleep(UPDATE_INTERVAL_MS);
      assertTrue(engine.maybeUpdate(batch));
      double current = engine.thresholdOf("cpu");
      assertTrue("Threshold must increase, was " + previous + " now " + current, current > previous);
      assertTrue("Threshold must not overshoot, now " + current, current <= target + EPSILON);
      previous = current;
    }
    assertEquals(target, previous, 0.01);
  }

  @Test
  public void testFirstUpdateIsSmoothed() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0), Collections.emptyMap());
    _time.sleep(UPDATE_INTERVAL_MS);
    engine.update(batch(process("1", Map.of("cpu", 15.0))));
    // 0.2 * 13 + 0.8 * 10
    assertEquals(10.6, engine.thresholdOf("cpu"), EPSILON);
  }

  @Test
  public void testAbsentMetricKeepsThreshold() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0, "memory", 100.0), Collections.emptyMap());
    _time.sleep(UPDATE_INTERVAL_MS);
    assertTrue(engine.update(batch(process("1", Map.of("cpu", 15.0)))));
    assertEquals(100.0, engine.thresholdOf("memory"), EPSILON);
    assertEquals(10.6, engine.thresholdOf("cpu"), EPSILON);
  }

  @Test
  public void testClampedToMaximum() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0), Map.of("cpu", 10.5));
    _time.sleep(UPDATE_INTERVAL_MS);
    engine.update(batch(process("1", Map.of("cpu", 50.0))));
    assertEquals(10.5, engine.thresholdOf("cpu"), EPSILON);
  }

  @Test
  public void testUpdatesAreThrottled() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0), Collections.emptyMap());
    MetricBatch batch = batch(process("1", Map.of("cpu", 15.0)));
    assertFalse(engine.update(batch));
    _time.sleep(UPDATE_INTERVAL_MS / 2);
    assertFalse(engine.maybeUpdate(batch));
    assertTrue(engine.update(batch));
    long lastUpdateMs = engine.lastUpdateMs();
    assertEquals(_time.milliseconds(), lastUpdateMs);
    assertFalse(engine.update(batch));
  }

  @Test
  public void testDisabledEngineNeverUpdates() {
    SortedMap<String, Double> statics = new TreeMap<>(Map.of("cpu", 10.0));
    DynamicThresholdEngine engine = new DynamicThresholdEngine(false, statics, Collections.emptyMap(), Collections.emptyMap(),
                                                               0.2, UPDATE_INTERVAL_MS, _time, new ReentrantReadWriteLock());
    _time.sleep(UPDATE_INTERVAL_MS);
    assertFalse(engine.maybeUpdate(batch(process("1", Map.of("cpu", 15.0)))));
    assertEquals(10.0, engine.thresholdOf("cpu"), EPSILON);
  }

  @Test
  public void testBatchAveragesSkipDistributions() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0, "latency", 5.0), Collections.emptyMap());
    Metric histogram = new Metric("latency", MetricType.HISTOGRAM, Collections.singletonList(new DataPoint(100.0, 0L)));
    MetricBatch batch = batch(process("1", Map.of("cpu", 10.0)), process("2", Map.of("cpu", 20.0)),
                              resource(Map.of("process.pid", "3"), histogram));
    Map<String, Double> averages = engine.batchAverages(batch);
    assertEquals(1, averages.size());
    assertEquals(15.0, averages.get("cpu"), EPSILON);
  }

  @Test
  public void testNonFiniteValuesDoNotCorruptThreshold() {
    DynamicThresholdEngine engine = engine(Map.of("cpu", 10.0), Collections.emptyMap());
    _time.sleep(UPDATE_INTERVAL_MS);
    assertTrue(engine.update(batch(process("1", Map.of("cpu", Double.NaN)),
                                   process("2", Map.of("cpu", Double.POSITIVE_INFINITY)))));
    assertEquals(10.0, engine.thresholdOf("cpu"), EPSILON);

    _time.sleep(UPDATE_INTERVAL_MS);
    engine.update(batch(process("1", Map.of("cpu", Double.NaN)), process("2", Map.of("cpu", 15.0))));
    // Only the finite value counts: 0.2 * 13 + 0.8 * 10
    assertEquals(10.6, engine.thresholdOf("cpu"), EPSILON);

    for (int i = 0; i < 5; i++) {
      _time.sleep(UPDATE_INTERVAL_MS);
      engine.update(batch(process("1", Map.of("cpu", 15.0))));
    }
    double threshold = engine.thresholdOf("cpu");
    assertTrue("Threshold must stay finite, was " + threshold, Double.isFinite(threshold));
    assertTrue(threshold > 10.6 && threshold < 13.0);
  }
}
