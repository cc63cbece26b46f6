/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.model;

import java.util.Collections;
import java.util.List;


/**
 * One delivery unit of the metrics pipeline: zero or more resources, each with zero or more metrics.
 */
public final class MetricBatch {
  private static final MetricBatch EMPTY = new MetricBatch(Collections.emptyList());
  private final List<ResourceMetrics> _resources;

  public MetricBatch(List<ResourceMetrics> resources) {
    _resources = List.copyOf(resources);
  }

  public static MetricBatch empty() {
    return EMPTY;
  }

  public List<ResourceMetrics> resources() {
    return _resources;
  }

  public int resourceCount() {
    return _resources.size();
  }

  public boolean isEmpty() {
    return _resources.isEmpty();
  }

  /**
   * @return Number of metrics across all resources of the batch.
   */
  public int metricCount() {
    int count = 0;
    for (ResourceMetrics resource : _resources) {
      count += resource.metricCount();
    }
    return count;
  }

  @Override
  public String toString() {
    return String.format("{resources=%d, metrics=%d}", _resources.size(), metricCount());
  }
}
