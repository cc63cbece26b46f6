/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.common;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;


public class TelemetryFilterThreadFactoryTest {

  @Test
  public void testThreadsAreNamedInSequence() {
    TelemetryFilterThreadFactory factory = new TelemetryFilterThreadFactory("FilterBackground", false, Thread.MIN_PRIORITY, null);
    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });
    assertEquals("FilterBackground-0", first.getName());
    assertEquals("FilterBackground-1", second.getName());
    assertFalse(first.isDaemon());
    assertEquals(Thread.MIN_PRIORITY, first.getPriority());
    assertNotNull(first.getUncaughtExceptionHandler());
  }

  @Test
  public void testDefaultsToDaemonThreads() {
    Thread thread = new TelemetryFilterThreadFactory("FilterBackground").newThread(() -> { });
    assertTrue(thread.isDaemon());
    assertEquals(Thread.NORM_PRIORITY, thread.getPriority());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsInvalidPriority() {
    new TelemetryFilterThreadFactory("FilterBackground", true, Thread.MAX_PRIORITY + 1, null);
  }
}
