/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.summary;

import com.google.gson.Gson;
import com.linkedin.adaptive.telemetryfilter.composite.CompositeScore;
import com.linkedin.adaptive.telemetryfilter.threshold.DynamicThresholdEngine;
import com.linkedin.telemetryfilter.common.utils.Utils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;


/**
 * Adds the threshold evaluation details of an included resource to its attributes, for use by downstream consumers.
 * <ul>
 *   <li>{@code process.atp.threshold.<metric>}: {@code {"threshold", "observed_value", "threshold_type",
 *   "evaluation_timestamp"}} for each extracted metric with a positive effective threshold.</li>
 *   <li>{@code process.atp}: {@code {"multi_metric": {"composite_score", "threshold"}}} for resources included by
 *   their composite score.</li>
 * </ul>
 */
public class ThresholdDetailAnnotator {
  public static final String THRESHOLD_ATTRIBUTE_PREFIX = "process.atp.threshold.";
  public static final String ATP_ATTRIBUTE = "process.atp";
  public static final String STATIC_THRESHOLD_TYPE = "static";
  public static final String DYNAMIC_THRESHOLD_TYPE = "dynamic";
  private final Gson _gson;
  private final SortedMap<String, Double> _staticThresholds;
  private final DynamicThresholdEngine _dynamicThresholds;

  public ThresholdDetailAnnotator(Map<String, Double> staticThresholds, DynamicThresholdEngine dynamicThresholds) {
    _staticThresholds = Collections.unmodifiableSortedMap(new TreeMap<>(staticThresholds));
    _dynamicThresholds = Utils.validateNotNull(dynamicThresholds, "Dynamic threshold engine cannot be null");
    _gson = new Gson();
  }

  /**
   * @param attributes Attributes of the output resource, modified in place.
   * @param values Extracted metric values of the resource.
   * @param compositeScore The composite score if the resource was included by it, {@code null} otherwise.
   * @param nowMs Evaluation time.
   * @return Number of annotated metrics.
   */
  public int annotate(Map<String, String> attributes, Map<String, Double> values, CompositeScore compositeScore, long nowMs) {
    int annotated = 0;
    long evaluationTimestamp = TimeUnit.MILLISECONDS.toSeconds(nowMs);
    for (Map.Entry<String, Double> entry : new TreeMap<>(values).entrySet()) {
      String metric = entry.getKey();
      Double staticThreshold = _staticThresholds.get(metric);
      double value = entry.getValue();
      if (staticThreshold == null || Double.isNaN(value) || Double.isInfinite(value)) {
        continue;
      }
      String thresholdType = STATIC_THRESHOLD_TYPE;
      double threshold = staticThreshold;
      if (_dynamicThresholds.isEnabled()) {
        Double dynamicThreshold = _dynamicThresholds.thresholdOf(metric);
        if (dynamicThreshold != null && dynamicThreshold > 0.0) {
          thresholdType = DYNAMIC_THRESHOLD_TYPE;
          threshold = dynamicThreshold;
        }
      }
      if (threshold <= 0.0) {
        continue;
      }
      Map<String, Object> detail = new LinkedHashMap<>();
      detail.put("threshold", threshold);
      detail.put("observed_value", value);
      detail.put("threshold_type", thresholdType);
      detail.put("evaluation_timestamp", evaluationTimestamp);
      attributes.put(THRESHOLD_ATTRIBUTE_PREFIX + metric, _gson.toJson(detail));
      annotated++;
    }
    if (compositeScore != null) {
      Map<String, Object> multiMetric = new LinkedHashMap<>();
      multiMetric.put("composite_score", compositeScore.score());
      multiMetric.put("threshold", compositeScore.threshold());
      attributes.put(ATP_ATTRIBUTE, _gson.toJson(Collections.singletonMap("multi_metric", multiMetric)));
    }
    return annotated;
  }
}
