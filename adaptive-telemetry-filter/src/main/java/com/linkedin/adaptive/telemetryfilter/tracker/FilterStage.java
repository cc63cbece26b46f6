/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The filter stage that decided about a resource.
 */
public enum FilterStage {
  INCLUDE_LIST("include_list"),
  DEFUNCT_PROCESS("zombie_process"),
  ANOMALY_DETECTION("anomaly_detection"),
  STATIC_THRESHOLD("static_threshold"),
  DYNAMIC_THRESHOLD("dynamic_threshold"),
  MULTI_METRIC("multi_metric"),
  ANOMALY_RETENTION("anomaly_retention"),
  STANDARD_RETENTION("standard_retention"),
  DEBUG_NO_MATCH("debug_no_match"),
  // Resources without metrics of interest and excluded resources.
  NONE("none");

  private static final List<FilterStage> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final String _label;

  FilterStage(String label) {
    _label = label;
  }

  /**
   * @return The name of the stage as reported in output metadata.
   */
  public String label() {
    return _label;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<FilterStage> cachedValues() {
    return CACHED_VALUES;
  }
}
