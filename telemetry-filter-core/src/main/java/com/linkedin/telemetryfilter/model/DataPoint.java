/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * A single observation of a metric. For distribution-shaped metrics the value holds the sum of the distribution.
 */
public final class DataPoint {
  private final double _value;
  private final long _timeMs;
  private final Map<String, String> _attributes;

  public DataPoint(double value, long timeMs) {
    this(value, timeMs, Collections.emptyMap());
  }

  public DataPoint(double value, long timeMs, Map<String, String> attributes) {
    _value = value;
    _timeMs = timeMs;
    _attributes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(attributes)));
  }

  public double value() {
    return _value;
  }

  public long timeMs() {
    return _timeMs;
  }

  public Map<String, String> attributes() {
    return _attributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DataPoint that = (DataPoint) o;
    return Double.compare(that._value, _value) == 0 && _timeMs == that._timeMs && _attributes.equals(that._attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_value, _timeMs, _attributes);
  }

  @Override
  public String toString() {
    return String.format("{value=%f, timeMs=%d, attributes=%s}", _value, _timeMs, _attributes);
  }
}
