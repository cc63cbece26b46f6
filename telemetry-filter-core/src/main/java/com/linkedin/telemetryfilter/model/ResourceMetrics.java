/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;


/**
 * All metrics of one monitored resource (a host, process, device or service instance) in one batch. Instances are
 * immutable; {@link #withAttributes(Map)} produces an annotated copy that shares the metrics.
 */
public final class ResourceMetrics {
  private final Map<String, String> _attributes;
  private final List<ScopeMetrics> _scopeMetrics;

  public ResourceMetrics(Map<String, String> attributes, List<ScopeMetrics> scopeMetrics) {
    _attributes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(attributes)));
    _scopeMetrics = List.copyOf(scopeMetrics);
  }

  /**
   * @return Resource attributes in insertion order.
   */
  public Map<String, String> attributes() {
    return _attributes;
  }

  /**
   * @param key Attribute key.
   * @return The attribute value, or {@code null} if the resource does not carry the attribute.
   */
  public String attribute(String key) {
    return _attributes.get(key);
  }

  public List<ScopeMetrics> scopeMetrics() {
    return _scopeMetrics;
  }

  /**
   * @return Number of metrics across all scopes of this resource.
   */
  public int metricCount() {
    int count = 0;
    for (ScopeMetrics scope : _scopeMetrics) {
      count += scope.metrics().size();
    }
    return count;
  }

  /**
   * @param attributes Replacement attributes.
   * @return A copy of this resource carrying the given attributes and the same metrics.
   */
  public ResourceMetrics withAttributes(Map<String, String> attributes) {
    return new ResourceMetrics(attributes, _scopeMetrics);
  }

  @Override
  public String toString() {
    return String.format("{attributes=%s, metrics=%d}", _attributes, metricCount());
  }
}
