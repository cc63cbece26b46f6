/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.detector;

import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.adaptive.telemetryfilter.tracker.MetricHistory;
import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Detects metric values that jump away from the recent history of the same resource.
 *
 * <p>For each metric with a static threshold, the detector compares the current value with the mean of the values
 * recorded for the resource in previous batches:
 * <pre>
 *   percentChange = (current - mean) / mean * 100
 * </pre>
 * The percent change is 0 if the mean is 0. An anomaly is reported when the percent change reaches the configured
 * change threshold. A metric is not evaluated until its history holds the minimum number of data points, so a new
 * resource never has an anomaly.</p>
 *
 * <p>The current value is appended to the history of every evaluated metric whether or not it is anomalous. The
 * history keeps the most recent values only.</p>
 *
 * The caller must hold the tracker write lock, as detection mutates the history of the given entity.
 */
public class AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);
  private final int _historySize;
  private final double _changeThresholdPercent;
  private final int _minDataPoints;
  private final Set<String> _evaluatedMetrics;

  public AnomalyDetector(AdaptiveTelemetryFilterConfig config) {
    this(config.anomalyHistorySize(), config.anomalyChangeThresholdPercent(), config.anomalyMinDataPoints(),
         config.metricThresholds().keySet());
  }

  public AnomalyDetector(int historySize, double changeThresholdPercent, int minDataPoints, Set<String> evaluatedMetrics) {
    _historySize = historySize;
    _changeThresholdPercent = changeThresholdPercent;
    _minDataPoints = minDataPoints;
    _evaluatedMetrics = Collections.unmodifiableSet(new HashSet<>(evaluatedMetrics));
  }

  /**
   * Record the given values in the history of the entity and check them for anomalies.
   *
   * @param entity The tracked entity of the resource.
   * @param values Current values by metric name. Iteration order decides which anomaly is reported if several fire.
   * @return A description of the first anomalous metric, or {@code null} if no metric is anomalous.
   */
  public String detect(TrackedEntity entity, Map<String, Double> values) {
    String anomaly = null;
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      String metric = entry.getKey();
      if (!_evaluatedMetrics.contains(metric)) {
        continue;
      }
      double current = entry.getValue();
      MetricHistory history = entity.historyOf(metric, _historySize);
      if (anomaly == null && history.size() >= _minDataPoints) {
        double mean = history.average();
        double percentChange = percentChange(current, mean);
        if (percentChange >= _changeThresholdPercent) {
          anomaly = String.format("%s anomaly: %.2f (%.1f%% change from avg %.2f)", metric, current, percentChange, mean);
          LOG.debug("Resource {}: {}", entity.identity(), anomaly);
        }
      }
      history.add(current);
    }
    return anomaly;
  }

  /**
   * @param current Current value.
   * @param mean Mean of the historical values.
   * @return Percent change of the current value relative to the mean, 0 if the mean is 0.
   */
  static double percentChange(double current, double mean) {
    if (mean == 0.0) {
      return 0.0;
    }
    return (current - mean) / mean * 100.0;
  }
}
