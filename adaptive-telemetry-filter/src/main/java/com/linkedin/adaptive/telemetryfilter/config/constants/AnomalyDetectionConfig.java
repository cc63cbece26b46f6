/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.config.constants;

import org.apache.kafka.common.config.ConfigDef;


/**
 * A class to keep anomaly detection configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AnomalyDetectionConfig {

  /**
   * <code>enable.anomaly.detection</code>
   */
  public static final String ENABLE_ANOMALY_DETECTION_CONFIG = "enable.anomaly.detection";
  public static final boolean DEFAULT_ENABLE_ANOMALY_DETECTION = false;
  public static final String ENABLE_ANOMALY_DETECTION_DOC = "True to include resources whose metric value jumps "
      + "away from the rolling average of its recent values.";

  /**
   * <code>anomaly.history.size</code>
   */
  public static final String ANOMALY_HISTORY_SIZE_CONFIG = "anomaly.history.size";
  public static final int DEFAULT_ANOMALY_HISTORY_SIZE = 10;
  public static final int MAX_ANOMALY_HISTORY_SIZE = 100;
  public static final String ANOMALY_HISTORY_SIZE_DOC = "The number of recent values kept per resource and metric. "
      + "Capped at " + MAX_ANOMALY_HISTORY_SIZE + ".";

  /**
   * <code>anomaly.change.threshold.percent</code>
   */
  public static final String ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG = "anomaly.change.threshold.percent";
  public static final double DEFAULT_ANOMALY_CHANGE_THRESHOLD_PERCENT = 200.0;
  public static final String ANOMALY_CHANGE_THRESHOLD_PERCENT_DOC = "The percent change of a value relative to the "
      + "rolling average at or above which an anomaly is reported.";

  /**
   * <code>anomaly.min.data.points</code>
   */
  public static final String ANOMALY_MIN_DATA_POINTS_CONFIG = "anomaly.min.data.points";
  public static final int DEFAULT_ANOMALY_MIN_DATA_POINTS = 3;
  public static final String ANOMALY_MIN_DATA_POINTS_DOC = "The number of historical values required before a metric "
      + "is evaluated for anomalies. Values below " + DEFAULT_ANOMALY_MIN_DATA_POINTS + " are raised to "
      + DEFAULT_ANOMALY_MIN_DATA_POINTS + ".";

  private AnomalyDetectionConfig() {
  }

  /**
   * Define configs for anomaly detection.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for anomaly detection.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ENABLE_ANOMALY_DETECTION_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_ANOMALY_DETECTION,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_ANOMALY_DETECTION_DOC)
                    .define(ANOMALY_HISTORY_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_HISTORY_SIZE,
                            ConfigDef.Importance.LOW,
                            ANOMALY_HISTORY_SIZE_DOC)
                    .define(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_ANOMALY_CHANGE_THRESHOLD_PERCENT,
                            ConfigDef.Importance.MEDIUM,
                            ANOMALY_CHANGE_THRESHOLD_PERCENT_DOC)
                    .define(ANOMALY_MIN_DATA_POINTS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_MIN_DATA_POINTS,
                            ConfigDef.Importance.LOW,
                            ANOMALY_MIN_DATA_POINTS_DOC);
  }
}
