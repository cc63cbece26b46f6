/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.composite;

import com.linkedin.adaptive.telemetryfilter.threshold.DynamicThresholdEngine;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
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
 * Unit test class for {@link CompositeScorer}.
 */
public class CompositeScorerTest {
  private static final double EPSILON = 1E-9;
  private MockTime _time;
  private DynamicThresholdEngine _staticOnly;

  @Before
  public void setUp() {
    _time = new MockTime();
    _staticOnly = new DynamicThresholdEngine(filterConfig(), _time, new ReentrantReadWriteLock());
  }

  @Test
  public void testScoreIsWeightedSumOfRatios() {
    CompositeScorer scorer = new CompositeScorer(Map.of("cpu", 0.6, "memory", 0.4), Map.of("cpu", 10.0, "memory", 100.0),
                                                 _staticOnly, 1.5);
    CompositeScore score = scorer.score(Map.of("cpu", 20.0, "memory", 200.0));
    assertEquals(2.0, score.score(), EPSILON);
    assertEquals(2, score.contributingMetrics());
    assertEquals(1.5, score.threshold(), EPSILON);
    assertTrue(score.exceedsThreshold());
    assertTrue(score.trace(), score.trace().startsWith("Score 2.00 = (cpu:20.00/10.00×0.60) + (memory:"));
  }

  @Test
  public void testBelowCompositeThreshold() {
    CompositeScorer scorer = new CompositeScorer(Map.of("cpu", 0.5, "memory", 0.5), Map.of("cpu", 10.0, "memory", 100.0),
                                                 _staticOnly, 1.5);
    CompositeScore score = scorer.score(Map.of("cpu", 9.0, "memory", 90.0));
    assertEquals(0.9, score.score(), EPSILON);
    assertFalse(score.exceedsThreshold());
  }

  @Test
  public void testUnthresholdedMetricContributesConstant() {
    CompositeScorer scorer = new CompositeScorer(Map.of("io", 0.3), Collections.emptyMap(), _staticOnly, 1.5);
    assertEquals(0.2, scorer.score(Map.of("io", 5.0)).score(), EPSILON);
    assertEquals(0.2, scorer.score(Map.of("io", 5000.0)).score(), EPSILON);
  }

  @Test
  public void testNothingContributes() {
    CompositeScorer scorer = new CompositeScorer(Map.of("cpu", 1.0, "memory", 1.0), Map.of("memory", 0.0), _staticOnly, 1.5);
    // cpu is absent and the threshold of memory is not positive.
    CompositeScore score = scorer.score(Map.of("memory", 50.0));
    assertEquals(0.0, score.score(), EPSILON);
    assertEquals(0, score.contributingMetrics());
    assertEquals("Score 0.00", score.trace());
    assertFalse(score.exceedsThreshold());
  }

  @Test
  public void testUsesDynamicThresholdWhenEnabled() {
    DynamicThresholdEngine engine = new DynamicThresholdEngine(filterConfig(METRIC_THRESHOLD_PREFIX + "cpu", "10",
                                                                            ENABLE_DYNAMIC_THRESHOLDS_CONFIG, "true",
                                                                            DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_CONFIG, "1000"),
                                                               _time, new ReentrantReadWriteLock());
    _time.sleep(1000L);
    assertTrue(engine.update(batch(process("1", Map.of("cpu", 15.0)))));
    CompositeScorer scorer = new CompositeScorer(Map.of("cpu", 1.0), Map.of("cpu", 10.0), engine, 1.5);
    assertEquals(2.0, scorer.score(Map.of("cpu", 21.2)).score(), EPSILON);
  }
}
