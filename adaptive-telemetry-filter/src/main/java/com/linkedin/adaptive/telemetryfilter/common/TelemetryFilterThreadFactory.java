/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Creates named threads for the background work of the filter, logging exceptions that escape a task.
 */
public class TelemetryFilterThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(TelemetryFilterThreadFactory.class);
  private final String _name;
  private final boolean _daemon;
  private final int _priority;
  private final AtomicInteger _id = new AtomicInteger(0);
  private final Logger _logger;

  public TelemetryFilterThreadFactory(String name) {
    this(name, true, Thread.NORM_PRIORITY, null);
  }

  public TelemetryFilterThreadFactory(String name, boolean daemon, int priority, Logger logger) {
    if (priority < Thread.MIN_PRIORITY || priority > Thread.MAX_PRIORITY) {
      throw new IllegalArgumentException("Invalid thread priority " + priority);
    }
    _name = name;
    _daemon = daemon;
    _priority = priority;
    _logger = logger == null ? LOG : logger;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, _name + "-" + _id.getAndIncrement());
    t.setDaemon(_daemon);
    t.setPriority(_priority);
    t.setUncaughtExceptionHandler((t1, e) -> _logger.error("Uncaught exception in " + t1.getName() + ": ", e));
    return t;
  }
}
