/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.threshold;

import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.adaptive.telemetryfilter.extractor.MetricValueExtractor;
import com.linkedin.telemetryfilter.common.utils.AutoCloseableLock;
import com.linkedin.telemetryfilter.common.utils.Utils;
import com.linkedin.telemetryfilter.model.Metric;
import com.linkedin.telemetryfilter.model.MetricBatch;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import com.linkedin.telemetryfilter.model.ScopeMetrics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.adaptive.telemetryfilter.config.constants.ThresholdConfig.DYNAMIC_THRESHOLD_SCALING_FACTOR;


/**
 * Keeps a threshold per metric that follows the values observed across batches.
 *
 * For each metric with a positive static threshold, an update computes the average of the metric over all resources
 * of a batch and moves the threshold towards {@code static + average * scalingFactor} using exponential smoothing:
 * <pre>
 *   new = smoothing * target + (1 - smoothing) * previous
 * </pre>
 * The result is clamped to the configured lower and upper bound of the metric, where those are positive. A metric that
 * is absent from the batch keeps its previous threshold. Metrics with a static threshold of 0 are not tracked since
 * such a threshold includes a resource unconditionally.
 *
 * The threshold table is guarded by the read/write lock shared with the {@link
 * com.linkedin.adaptive.telemetryfilter.tracker.EntityTracker}. Averages are computed without holding the lock.
 */
public class DynamicThresholdEngine {
  private static final Logger LOG = LoggerFactory.getLogger(DynamicThresholdEngine.class);
  private final boolean _enabled;
  private final SortedMap<String, Double> _staticThresholds;
  private final Map<String, Double> _mins;
  private final Map<String, Double> _maxs;
  private final double _smoothingFactor;
  private final long _updateIntervalMs;
  private final Time _time;
  private final ReadWriteLock _lock;
  // Guarded by _lock.
  private final Map<String, Double> _thresholds;
  private volatile long _lastUpdateMs;

  public DynamicThresholdEngine(AdaptiveTelemetryFilterConfig config, Time time, ReadWriteLock lock) {
    this(config.dynamicThresholdsEnabled(), config.metricThresholds(), config.dynamicThresholdMins(),
         config.dynamicThresholdMaxs(), config.dynamicSmoothingFactor(), config.dynamicThresholdUpdateIntervalMs(), time,
         lock);
  }

  DynamicThresholdEngine(boolean enabled,
                         SortedMap<String, Double> staticThresholds,
                         Map<String, Double> mins,
                         Map<String, Double> maxs,
                         double smoothingFactor,
                         long updateIntervalMs,
                         Time time,
                         ReadWriteLock lock) {
    _enabled = enabled;
    _staticThresholds = new TreeMap<>(staticThresholds);
    _mins = new HashMap<>(mins);
    _maxs = new HashMap<>(maxs);
    _smoothingFactor = smoothingFactor;
    _updateIntervalMs = updateIntervalMs;
    _time = Utils.validateNotNull(time, "Time cannot be null");
    _lock = Utils.validateNotNull(lock, "Lock cannot be null");
    _thresholds = new HashMap<>();
    _staticThresholds.forEach((metric, threshold) -> {
      if (threshold > 0.0) {
        _thresholds.put(metric, threshold);
      }
    });
    _lastUpdateMs = _time.milliseconds();
  }

  public boolean isEnabled() {
    return _enabled;
  }

  /**
   * Update thresholds from the given batch if the update interval has elapsed since the last update.
   *
   * @param batch The current batch.
   * @return {@code true} if the thresholds were updated.
   */
  public boolean maybeUpdate(MetricBatch batch) {
    if (!_enabled || _time.milliseconds() - _lastUpdateMs < _updateIntervalMs) {
      return false;
    }
    return update(batch);
  }

  /**
   * Update thresholds from the given batch, unless the previous update happened less than half of the update interval
   * ago.
   *
   * @param batch The batch to compute averages from.
   * @return {@code true} if the thresholds were updated.
   */
  public boolean update(MetricBatch batch) {
    if (!_enabled) {
      return false;
    }
    long nowMs = _time.milliseconds();
    if (nowMs - _lastUpdateMs < _updateIntervalMs / 2) {
      LOG.debug("Skipping dynamic threshold update, last update was {} ms ago.", nowMs - _lastUpdateMs);
      return false;
    }
    _lastUpdateMs = nowMs;

    Map<String, Double> averages = batchAverages(batch);
    int updated = 0;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      for (Map.Entry<String, Double> entry : averages.entrySet()) {
        String metric = entry.getKey();
        double base = _staticThresholds.get(metric);
        double previous = _thresholds.getOrDefault(metric, 0.0);
        if (!Double.isFinite(previous) || previous <= 0.0) {
          previous = base;
        }
        double target = base + entry.getValue() * DYNAMIC_THRESHOLD_SCALING_FACTOR;
        double smoothed = clamp(metric, _smoothingFactor * target + (1 - _smoothingFactor) * previous);
        _thresholds.put(metric, smoothed);
        updated++;
        LOG.debug("Dynamic threshold of {} moved from {} to {} (base {}, batch average {}).", metric, previous, smoothed,
                  base, entry.getValue());
      }
    }
    LOG.info("Updated {} of {} dynamic thresholds.", updated, _staticThresholds.size());
    return true;
  }

  private double clamp(String metric, double value) {
    Double min = _mins.get(metric);
    if (min != null && min > 0.0 && value < min) {
      value = min;
    }
    Double max = _maxs.get(metric);
    if (max != null && max > 0.0 && value > max) {
      value = max;
    }
    return value;
  }

  /**
   * Each occurrence of a metric in a resource contributes the sum of its finite data points to the average.
   *
   * @param batch A batch.
   * @return Average value by metric name, for tracked metrics present in the batch.
   */
  Map<String, Double> batchAverages(MetricBatch batch) {
    Map<String, List<Double>> observations = new HashMap<>();
    for (ResourceMetrics resource : batch.resources()) {
      for (ScopeMetrics scope : resource.scopeMetrics()) {
        for (Metric metric : scope.metrics()) {
          Double base = _staticThresholds.get(metric.name());
          if (base == null || base <= 0.0 || !metric.type().isScalar() || metric.dataPoints().isEmpty()) {
            continue;
          }
          double value = MetricValueExtractor.valueOf(metric);
          if (Double.isFinite(value)) {
            observations.computeIfAbsent(metric.name(), m -> new ArrayList<>()).add(value);
          }
        }
      }
    }
    Map<String, Double> averages = new HashMap<>();
    observations.forEach((metric, values) -> averages.put(metric, Utils.average(values)));
    return averages;
  }

  /**
   * @param metric Metric name.
   * @return The current dynamic threshold of the metric, or {@code null} if the metric has none.
   */
  public Double thresholdOf(String metric) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _thresholds.get(metric);
    }
  }

  /**
   * @return A snapshot of the current dynamic thresholds by metric name.
   */
  public Map<String, Double> thresholds() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return Collections.unmodifiableMap(new TreeMap<>(_thresholds));
    }
  }

  public long lastUpdateMs() {
    return _lastUpdateMs;
  }
}
