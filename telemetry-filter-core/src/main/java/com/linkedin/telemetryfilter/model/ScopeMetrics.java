/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.model;

import java.util.List;


/**
 * Metrics produced by one instrumentation scope.
 */
public final class ScopeMetrics {
  private final String _name;
  private final String _version;
  private final List<Metric> _metrics;

  public ScopeMetrics(String name, String version, List<Metric> metrics) {
    _name = name == null ? "" : name;
    _version = version == null ? "" : version;
    _metrics = List.copyOf(metrics);
  }

  public String name() {
    return _name;
  }

  public String version() {
    return _version;
  }

  public List<Metric> metrics() {
    return _metrics;
  }
}
