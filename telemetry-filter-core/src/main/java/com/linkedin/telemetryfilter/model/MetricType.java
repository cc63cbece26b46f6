/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The shape of a metric. Only scalar shapes carry a single number per data point; distribution-shaped metrics are
 * carried through unchanged but never scored.
 */
public enum MetricType {
  GAUGE(true),
  SUM(true),
  HISTOGRAM(false),
  EXPONENTIAL_HISTOGRAM(false),
  SUMMARY(false);

  private static final List<MetricType> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final boolean _scalar;

  MetricType(boolean scalar) {
    _scalar = scalar;
  }

  /**
   * @return {@code true} for instantaneous and running-total kinds, {@code false} for distribution-shaped kinds.
   */
  public boolean isScalar() {
    return _scalar;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<MetricType> cachedValues() {
    return CACHED_VALUES;
  }
}
