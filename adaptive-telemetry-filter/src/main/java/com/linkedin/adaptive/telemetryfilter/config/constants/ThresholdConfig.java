/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.config.constants;

import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep static and dynamic threshold configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class ThresholdConfig {

  /**
   * <code>metric.threshold.*</code>
   * <br/>
   * Static threshold per metric name, e.g. "metric.threshold.process.cpu.utilization=80". A resource exceeding the
   * threshold of any of its metrics is included. A threshold of 0 includes the resource whenever the metric is present.
   */
  public static final String METRIC_THRESHOLD_PREFIX = "metric.threshold.";

  /**
   * <code>enable.dynamic.thresholds</code>
   */
  public static final String ENABLE_DYNAMIC_THRESHOLDS_CONFIG = "enable.dynamic.thresholds";
  public static final boolean DEFAULT_ENABLE_DYNAMIC_THRESHOLDS = false;
  public static final String ENABLE_DYNAMIC_THRESHOLDS_DOC = "True to periodically recompute the threshold of each "
      + "metric that has a static threshold from the batch-wide average of its observed values.";

  /**
   * <code>dynamic.threshold.min.*</code>
   * <br/>
   * Lower bound of the dynamic threshold per metric name. Applied only when greater than 0.
   */
  public static final String DYNAMIC_THRESHOLD_MIN_PREFIX = "dynamic.threshold.min.";

  /**
   * <code>dynamic.threshold.max.*</code>
   * <br/>
   * Upper bound of the dynamic threshold per metric name. Applied only when greater than 0.
   */
  public static final String DYNAMIC_THRESHOLD_MAX_PREFIX = "dynamic.threshold.max.";

  /**
   * <code>dynamic.smoothing.factor</code>
   */
  public static final String DYNAMIC_SMOOTHING_FACTOR_CONFIG = "dynamic.smoothing.factor";
  public static final double DEFAULT_DYNAMIC_SMOOTHING_FACTOR = 0.2;
  public static final String DYNAMIC_SMOOTHING_FACTOR_DOC = "The weight of the newly computed target in the "
      + "exponential smoothing of dynamic thresholds. Values outside of (0, 1] are replaced with the default.";

  /**
   * <code>dynamic.threshold.update.interval.ms</code>
   */
  public static final String DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_CONFIG = "dynamic.threshold.update.interval.ms";
  public static final long DEFAULT_DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS = 60_000L;
  public static final String DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_DOC = "The interval in milliseconds between two "
      + "dynamic threshold updates. Explicit update requests are throttled to at most one per half of this interval.";

  /**
   * The fraction of the batch-wide average that is added on top of the static threshold to get the target of a
   * dynamic threshold.
   */
  public static final double DYNAMIC_THRESHOLD_SCALING_FACTOR = 0.2;

  private ThresholdConfig() {
  }

  /**
   * Define configs for static and dynamic thresholds.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for thresholds.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ENABLE_DYNAMIC_THRESHOLDS_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_DYNAMIC_THRESHOLDS,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_DYNAMIC_THRESHOLDS_DOC)
                    .define(DYNAMIC_SMOOTHING_FACTOR_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DYNAMIC_SMOOTHING_FACTOR,
                            ConfigDef.Importance.LOW,
                            DYNAMIC_SMOOTHING_FACTOR_DOC)
                    .define(DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_DOC);
  }
}
