/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.config.constants;

import org.apache.kafka.common.config.ConfigDef;


/**
 * A class to keep multi-metric composite score configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MultiMetricConfig {

  /**
   * <code>enable.multi.metric</code>
   */
  public static final String ENABLE_MULTI_METRIC_CONFIG = "enable.multi.metric";
  public static final boolean DEFAULT_ENABLE_MULTI_METRIC = false;
  public static final String ENABLE_MULTI_METRIC_DOC = "True to include resources whose weighted sum of "
      + "value-to-threshold ratios reaches the composite threshold.";

  /**
   * <code>composite.threshold</code>
   */
  public static final String COMPOSITE_THRESHOLD_CONFIG = "composite.threshold";
  public static final double DEFAULT_COMPOSITE_THRESHOLD = 1.5;
  public static final String COMPOSITE_THRESHOLD_DOC = "The composite score at or above which a resource is included. "
      + "Must be positive when multi-metric evaluation is enabled.";

  /**
   * <code>composite.weight.*</code>
   * <br/>
   * Weight of a metric in the composite score, e.g. "composite.weight.process.memory.utilization=0.4".
   */
  public static final String COMPOSITE_WEIGHT_PREFIX = "composite.weight.";

  /**
   * The multiplier applied to the current value of a weighted metric without any threshold to synthesize a threshold
   * for the composite score.
   */
  public static final double FALLBACK_THRESHOLD_MULTIPLIER = 1.5;

  private MultiMetricConfig() {
  }

  /**
   * Define configs for multi-metric evaluation.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for multi-metric evaluation.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ENABLE_MULTI_METRIC_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_MULTI_METRIC,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_MULTI_METRIC_DOC)
                    .define(COMPOSITE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_COMPOSITE_THRESHOLD,
                            ConfigDef.Importance.MEDIUM,
                            COMPOSITE_THRESHOLD_DOC);
  }
}
