/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter;

import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.adaptive.telemetryfilter.config.constants.RetentionConfig;
import com.linkedin.telemetryfilter.model.DataPoint;
import com.linkedin.telemetryfilter.model.Metric;
import com.linkedin.telemetryfilter.model.MetricBatch;
import com.linkedin.telemetryfilter.model.MetricType;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import com.linkedin.telemetryfilter.model.ScopeMetrics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Utilities shared by the unit tests of the adaptive telemetry filter.
 */
public final class AdaptiveTelemetryFilterUnitTestUtils {
  public static final String HOST = "host-1";
  public static final String SCOPE = "hostmetrics";

  private AdaptiveTelemetryFilterUnitTestUtils() {

  }

  /**
   * @return Properties with storage disabled, so that tests never touch the platform storage directory.
   */
  public static Map<String, Object> filterProps() {
    Map<String, Object> props = new HashMap<>();
    props.put(RetentionConfig.ENABLE_STORAGE_CONFIG, "false");
    return props;
  }

  /**
   * @param keyValues Alternating config names and values, added to {@link #filterProps()}.
   * @return The config.
   */
  public static AdaptiveTelemetryFilterConfig filterConfig(Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("Config names and values must come in pairs.");
    }
    Map<String, Object> props = filterProps();
    for (int i = 0; i < keyValues.length; i += 2) {
      props.put((String) keyValues[i], keyValues[i + 1]);
    }
    return new AdaptiveTelemetryFilterConfig(props, false);
  }

  /**
   * @param name Metric name.
   * @param value Value of the single data point.
   * @return A gauge.
   */
  public static Metric gauge(String name, double value) {
    return new Metric(name, MetricType.GAUGE, Collections.singletonList(new DataPoint(value, 0L)));
  }

  /**
   * @param attributes Resource attributes.
   * @param metrics Metrics of the resource, in a single scope.
   * @return A resource.
   */
  public static ResourceMetrics resource(Map<String, String> attributes, Metric... metrics) {
    return new ResourceMetrics(attributes, Collections.singletonList(new ScopeMetrics(SCOPE, "1.0", Arrays.asList(metrics))));
  }

  /**
   * @param pid Process id.
   * @param values Gauge values by metric name.
   * @return A process resource of {@link #HOST}.
   */
  public static ResourceMetrics process(String pid, Map<String, Double> values) {
    return process(pid, values, Collections.emptyMap());
  }

  /**
   * @param pid Process id.
   * @param values Gauge values by metric name.
   * @param extraAttributes Attributes added to the process attributes.
   * @return A process resource of {@link #HOST}.
   */
  public static ResourceMetrics process(String pid, Map<String, Double> values, Map<String, String> extraAttributes) {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("host.name", HOST);
    attributes.put("process.pid", pid);
    attributes.putAll(extraAttributes);
    List<Metric> metrics = new ArrayList<>();
    values.forEach((name, value) -> metrics.add(gauge(name, value)));
    return resource(attributes, metrics.toArray(new Metric[0]));
  }

  public static MetricBatch batch(ResourceMetrics... resources) {
    return new MetricBatch(Arrays.asList(resources));
  }
}
