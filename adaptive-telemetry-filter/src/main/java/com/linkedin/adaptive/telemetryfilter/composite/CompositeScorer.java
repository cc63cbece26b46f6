/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.composite;

import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.adaptive.telemetryfilter.threshold.DynamicThresholdEngine;
import com.linkedin.telemetryfilter.common.utils.Utils;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

import static com.linkedin.adaptive.telemetryfilter.config.constants.MultiMetricConfig.FALLBACK_THRESHOLD_MULTIPLIER;


/**
 * Combines several metrics of a resource into one score, so that a resource under moderate pressure on several
 * metrics at once is included even if no single metric crosses its threshold:
 * <pre>
 *   score = sum over weighted metrics m of (value(m) / threshold(m)) * weight(m)
 * </pre>
 * The threshold of a metric is its dynamic threshold if dynamic thresholds are enabled and the metric has a positive
 * one, else its static threshold. A weighted metric without static threshold is compared against
 * {@code 1.5 * value}, so it contributes a constant {@code weight / 1.5}. Metrics whose threshold is not positive, and
 * weighted metrics missing from the resource, do not contribute.
 */
public class CompositeScorer {
  private final SortedMap<String, Double> _weights;
  private final Map<String, Double> _staticThresholds;
  private final DynamicThresholdEngine _dynamicThresholds;
  private final double _compositeThreshold;

  public CompositeScorer(AdaptiveTelemetryFilterConfig config, DynamicThresholdEngine dynamicThresholds) {
    this(config.compositeWeights(), config.metricThresholds(), dynamicThresholds, config.compositeThreshold());
  }

  public CompositeScorer(Map<String, Double> weights,
                         Map<String, Double> staticThresholds,
                         DynamicThresholdEngine dynamicThresholds,
                         double compositeThreshold) {
    _weights = new TreeMap<>(weights);
    _staticThresholds = new TreeMap<>(staticThresholds);
    _dynamicThresholds = Utils.validateNotNull(dynamicThresholds, "Dynamic threshold engine cannot be null");
    _compositeThreshold = compositeThreshold;
  }

  /**
   * @param values Current values of a resource by metric name.
   * @return The composite score of the resource. The score is 0 if no metric contributes.
   */
  public CompositeScore score(Map<String, Double> values) {
    double score = 0.0;
    int contributing = 0;
    StringJoiner terms = new StringJoiner(" + ");
    for (Map.Entry<String, Double> entry : _weights.entrySet()) {
      String metric = entry.getKey();
      Double value = values.get(metric);
      if (value == null) {
        continue;
      }
      double threshold = effectiveThreshold(metric, value);
      if (threshold <= 0.0) {
        continue;
      }
      double weight = entry.getValue();
      score += value / threshold * weight;
      contributing++;
      terms.add(String.format("(%s:%.2f/%.2f×%.2f)", metric, value, threshold, weight));
    }
    String trace = contributing == 0 ? String.format("Score %.2f", score) : String.format("Score %.2f = %s", score, terms);
    return new CompositeScore(score, _compositeThreshold, contributing, trace);
  }

  private double effectiveThreshold(String metric, double value) {
    Double staticThreshold = _staticThresholds.get(metric);
    if (staticThreshold == null) {
      return value * FALLBACK_THRESHOLD_MULTIPLIER;
    }
    if (_dynamicThresholds.isEnabled()) {
      Double dynamicThreshold = _dynamicThresholds.thresholdOf(metric);
      if (dynamicThreshold != null && dynamicThreshold > 0.0) {
        return dynamicThreshold;
      }
    }
    return staticThreshold;
  }
}
