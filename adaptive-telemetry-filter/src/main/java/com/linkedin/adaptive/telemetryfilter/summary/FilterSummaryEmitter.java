/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.summary;

import com.linkedin.telemetryfilter.model.DataPoint;
import com.linkedin.telemetryfilter.model.Metric;
import com.linkedin.telemetryfilter.model.MetricType;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import com.linkedin.telemetryfilter.model.ScopeMetrics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Builds the synthetic resource appended to every non-empty filtered batch, which reports how many resources were
 * kept and which stages kept them.
 */
public class FilterSummaryEmitter {
  private static final Logger LOG = LoggerFactory.getLogger(FilterSummaryEmitter.class);
  public static final String SOURCE_ATTRIBUTE = "process.atp.source";
  public static final String SOURCE = "adaptive_telemetry_filter";
  public static final String METRIC_TYPE_ATTRIBUTE = "process.atp.metric_type";
  public static final String METRIC_TYPE = "filter_summary";
  public static final String SCOPE_NAME = "process.atp.filter";
  public static final String SCOPE_VERSION = "1.0.0";
  public static final String EFFICIENCY_RATIO_METRIC = "process.atp.filter.efficiency_ratio";
  public static final String RESOURCE_COUNT_METRIC = "process.atp.filter.resource_count";
  public static final String THRESHOLD_TRIGGERS_METRIC = "process.atp.filter.threshold_triggers";
  public static final String STATUS_ATTRIBUTE = "process.atp.status";
  public static final String STAGE_ATTRIBUTE = "process.atp.stage";
  public static final String STATUS_INCLUDED = "included";
  public static final String STATUS_FILTERED = "filtered";
  // Copied from the first output resource so that the summary is attributed to the same host.
  static final List<String> COPIED_ATTRIBUTES =
      Collections.unmodifiableList(Arrays.asList("host.id", "host.name", "newrelic.source", "container.id", "service.name"));

  /**
   * @param inputResourceCount Number of resources in the input batch.
   * @param output Resources forwarded downstream, without the summary.
   * @param stageHits Number of included resources by stage label.
   * @param nowMs Time of the summary data points.
   * @return The summary resource, or {@code null} if the input batch was empty.
   */
  public ResourceMetrics summarize(int inputResourceCount, List<ResourceMetrics> output, Map<String, Integer> stageHits, long nowMs) {
    if (inputResourceCount <= 0) {
      LOG.trace("Skipping filter summary of an empty batch.");
      return null;
    }
    int includedCount = output.size();
    int filteredCount = Math.max(0, inputResourceCount - includedCount);
    double efficiencyRatio = (double) filteredCount / inputResourceCount;

    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put(SOURCE_ATTRIBUTE, SOURCE);
    attributes.put(METRIC_TYPE_ATTRIBUTE, METRIC_TYPE);
    if (!output.isEmpty()) {
      Map<String, String> firstAttributes = output.get(0).attributes();
      for (String key : COPIED_ATTRIBUTES) {
        String value = firstAttributes.get(key);
        if (value != null) {
          attributes.put(key, value);
        }
      }
    }

    List<Metric> metrics = new ArrayList<>(3);
    metrics.add(new Metric(EFFICIENCY_RATIO_METRIC, "Fraction of resources filtered out of the batch", "1", MetricType.GAUGE,
                           Collections.singletonList(new DataPoint(efficiencyRatio, nowMs))));
    metrics.add(new Metric(RESOURCE_COUNT_METRIC, "Number of resources by filtering status", "{resource}", MetricType.GAUGE,
                           Arrays.asList(new DataPoint(includedCount, nowMs, Collections.singletonMap(STATUS_ATTRIBUTE, STATUS_INCLUDED)),
                                         new DataPoint(filteredCount, nowMs, Collections.singletonMap(STATUS_ATTRIBUTE, STATUS_FILTERED)))));
    List<DataPoint> triggers = new ArrayList<>();
    new TreeMap<>(stageHits).forEach((stage, hits) -> {
      if (hits != null && hits > 0) {
        triggers.add(new DataPoint(hits, nowMs, Collections.singletonMap(STAGE_ATTRIBUTE, stage)));
      }
    });
    if (!triggers.isEmpty()) {
      metrics.add(new Metric(THRESHOLD_TRIGGERS_METRIC, "Number of included resources by filter stage", "{resource}",
                             MetricType.GAUGE, triggers));
    }
    LOG.debug("Filter summary: {} of {} resources filtered (ratio {}), stage hits {}.", filteredCount, inputResourceCount,
              String.format("%.2f", efficiencyRatio), stageHits);
    return new ResourceMetrics(attributes, Collections.singletonList(new ScopeMetrics(SCOPE_NAME, SCOPE_VERSION, metrics)));
  }
}
