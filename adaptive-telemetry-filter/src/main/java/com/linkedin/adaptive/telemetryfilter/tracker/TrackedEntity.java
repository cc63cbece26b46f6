/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * The state kept across batches for one resource identity. Timestamps are in milliseconds, 0 means never.
 *
 * Instances are not thread safe; they are only mutated by the {@link EntityTracker} while it holds its write lock.
 */
public class TrackedEntity {
  private final String _identity;
  private final long _firstSeenMs;
  private long _lastExceededMs;
  private long _lastAnomalyDetectedMs;
  private final Map<String, Double> _currentValues;
  private final Map<String, Double> _maxValues;
  private final Map<String, MetricHistory> _metricHistory;
  private final Map<String, String> _attributes;

  public TrackedEntity(String identity, long firstSeenMs, Map<String, String> attributes) {
    this(identity, firstSeenMs, 0L, 0L, new HashMap<>(), new HashMap<>(), new HashMap<>(), attributes);
  }

  TrackedEntity(String identity,
                long firstSeenMs,
                long lastExceededMs,
                long lastAnomalyDetectedMs,
                Map<String, Double> currentValues,
                Map<String, Double> maxValues,
                Map<String, MetricHistory> metricHistory,
                Map<String, String> attributes) {
    _identity = Objects.requireNonNull(identity, "Identity cannot be null");
    _firstSeenMs = firstSeenMs;
    _lastExceededMs = lastExceededMs;
    _lastAnomalyDetectedMs = lastAnomalyDetectedMs;
    _currentValues = currentValues;
    _maxValues = maxValues;
    _metricHistory = metricHistory;
    _attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Rebuild a tracked entity from persisted state.
   */
  public static TrackedEntity restore(String identity,
                                      long firstSeenMs,
                                      long lastExceededMs,
                                      long lastAnomalyDetectedMs,
                                      Map<String, Double> currentValues,
                                      Map<String, Double> maxValues,
                                      Map<String, MetricHistory> metricHistory,
                                      Map<String, String> attributes) {
    return new TrackedEntity(identity, firstSeenMs, lastExceededMs, lastAnomalyDetectedMs, new HashMap<>(currentValues),
                             new HashMap<>(maxValues), new HashMap<>(metricHistory), attributes);
  }

  public String identity() {
    return _identity;
  }

  public long firstSeenMs() {
    return _firstSeenMs;
  }

  public long lastExceededMs() {
    return _lastExceededMs;
  }

  public long lastAnomalyDetectedMs() {
    return _lastAnomalyDetectedMs;
  }

  public Map<String, Double> currentValues() {
    return Collections.unmodifiableMap(_currentValues);
  }

  public Map<String, Double> maxValues() {
    return Collections.unmodifiableMap(_maxValues);
  }

  public Map<String, MetricHistory> metricHistory() {
    return Collections.unmodifiableMap(_metricHistory);
  }

  /**
   * @return Resource attributes at the time the entity was created.
   */
  public Map<String, String> attributes() {
    return _attributes;
  }

  /**
   * Record the latest values and raise the maximum values where exceeded.
   * @param values Values of the current batch by metric name.
   */
  public void updateValues(Map<String, Double> values) {
    values.forEach((metric, value) -> {
      _currentValues.put(metric, value);
      _maxValues.merge(metric, value, Math::max);
    });
  }

  /**
   * @param nowMs Time a threshold or composite stage included the resource. Older times are ignored.
   */
  public void markExceeded(long nowMs) {
    _lastExceededMs = Math.max(_lastExceededMs, nowMs);
  }

  /**
   * @param nowMs Time an anomaly was detected. Older times are ignored.
   */
  public void markAnomalyDetected(long nowMs) {
    _lastAnomalyDetectedMs = Math.max(_lastAnomalyDetectedMs, nowMs);
  }

  /**
   * @param metric Metric name.
   * @param capacity Capacity of the history if it has to be created.
   * @return The history of the given metric, created empty if the metric has none yet.
   */
  public MetricHistory historyOf(String metric, int capacity) {
    return _metricHistory.computeIfAbsent(metric, m -> new MetricHistory(capacity));
  }

  /**
   * @return A deep copy of this entity, safe to read without holding the tracker lock.
   */
  public TrackedEntity copy() {
    Map<String, MetricHistory> historyCopy = new HashMap<>();
    _metricHistory.forEach((metric, history) -> historyCopy.put(metric, MetricHistory.of(history.capacity(),
                                                                                        history.values())));
    return new TrackedEntity(_identity, _firstSeenMs, _lastExceededMs, _lastAnomalyDetectedMs,
                             new HashMap<>(_currentValues), new HashMap<>(_maxValues), historyCopy, _attributes);
  }

  @Override
  public String toString() {
    return String.format("{identity=%s, firstSeen=%d, lastExceeded=%d, lastAnomalyDetected=%d, currentValues=%s}",
                         _identity, _firstSeenMs, _lastExceededMs, _lastAnomalyDetectedMs, _currentValues);
  }
}
