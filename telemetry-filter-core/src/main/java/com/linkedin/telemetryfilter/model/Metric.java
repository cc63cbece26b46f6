/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;


/**
 * A named metric with its data points for one resource in one batch.
 */
public final class Metric {
  private final String _name;
  private final String _description;
  private final String _unit;
  private final MetricType _type;
  private final List<DataPoint> _dataPoints;

  public Metric(String name, MetricType type, List<DataPoint> dataPoints) {
    this(name, "", "", type, dataPoints);
  }

  public Metric(String name, String description, String unit, MetricType type, List<DataPoint> dataPoints) {
    _name = Objects.requireNonNull(name, "Metric name cannot be null");
    _description = description == null ? "" : description;
    _unit = unit == null ? "" : unit;
    _type = Objects.requireNonNull(type, "Metric type cannot be null");
    _dataPoints = List.copyOf(dataPoints);
  }

  public String name() {
    return _name;
  }

  public String description() {
    return _description;
  }

  public String unit() {
    return _unit;
  }

  public MetricType type() {
    return _type;
  }

  public List<DataPoint> dataPoints() {
    return Collections.unmodifiableList(_dataPoints);
  }

  @Override
  public String toString() {
    return String.format("{name=%s, type=%s, dataPoints=%d}", _name, _type, _dataPoints.size());
  }
}
