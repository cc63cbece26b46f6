/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.extractor;

import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.telemetryfilter.model.DataPoint;
import com.linkedin.telemetryfilter.model.Metric;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import com.linkedin.telemetryfilter.model.ScopeMetrics;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Pulls the numeric value of each metric of interest out of a resource. A metric is of interest if it has a static
 * threshold, or a composite weight while multi-metric evaluation is enabled. The data points of gauges and sums are
 * summed into one value; distribution-shaped metrics are skipped.
 */
public class MetricValueExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(MetricValueExtractor.class);
  private final Set<String> _metricsOfInterest;

  public MetricValueExtractor(AdaptiveTelemetryFilterConfig config) {
    this(config.metricThresholds().keySet(),
         config.multiMetricEnabled() ? config.compositeWeights().keySet() : Collections.emptySet());
  }

  public MetricValueExtractor(Set<String> thresholdedMetrics, Set<String> weightedMetrics) {
    Set<String> metricsOfInterest = new HashSet<>(thresholdedMetrics);
    metricsOfInterest.addAll(weightedMetrics);
    _metricsOfInterest = Collections.unmodifiableSet(metricsOfInterest);
  }

  /**
   * @param metricName Metric name.
   * @return {@code true} if the value of the metric is used by any filter stage.
   */
  public boolean isOfInterest(String metricName) {
    return _metricsOfInterest.contains(metricName);
  }

  /**
   * @param resource A resource of the current batch.
   * @return Values of the metrics of interest by metric name. If a metric occurs more than once, the last one wins.
   */
  public SortedMap<String, Double> extract(ResourceMetrics resource) {
    SortedMap<String, Double> values = new TreeMap<>();
    boolean skippedDistribution = false;
    for (ScopeMetrics scope : resource.scopeMetrics()) {
      for (Metric metric : scope.metrics()) {
        if (!isOfInterest(metric.name())) {
          continue;
        }
        if (metric.type().isScalar()) {
          double value = valueOf(metric);
          if (Double.isFinite(value)) {
            values.put(metric.name(), value);
          } else {
            LOG.debug("Skipped metric {} of resource {} without finite data points.", metric.name(), resource.attributes());
          }
        } else {
          skippedDistribution = true;
        }
      }
    }
    if (skippedDistribution && LOG.isTraceEnabled()) {
      LOG.trace("Skipped distribution-shaped metrics of resource {}.", resource.attributes());
    }
    return values;
  }

  /**
   * @param metric A gauge or sum.
   * @return The sum of the finite data points of the metric, 0 if it has none, or {@link Double#NaN} if none of its
   * data points is finite.
   */
  public static double valueOf(Metric metric) {
    double sum = 0.0;
    boolean hasFinite = false;
    for (DataPoint dataPoint : metric.dataPoints()) {
      if (Double.isFinite(dataPoint.value())) {
        sum += dataPoint.value();
        hasFinite = true;
      }
    }
    return hasFinite || metric.dataPoints().isEmpty() ? sum : Double.NaN;
  }
}
