/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.config.constants;

import java.util.Collections;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep configs and defaults of the filter stages that bypass evaluation and of batch processing.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class FilterConfig {

  /**
   * <code>include.process.list</code>
   */
  public static final String INCLUDE_PROCESS_LIST_CONFIG = "include.process.list";
  public static final String INCLUDE_PROCESS_LIST_DOC = "Full executable paths of processes that are always included, "
      + "e.g. /usr/sbin/nginx. Entries without a path separator never match and are ignored.";

  /**
   * <code>debug.show.all.filter.stages</code>
   */
  public static final String DEBUG_SHOW_ALL_FILTER_STAGES_CONFIG = "debug.show.all.filter.stages";
  public static final boolean DEFAULT_DEBUG_SHOW_ALL_FILTER_STAGES = false;
  public static final String DEBUG_SHOW_ALL_FILTER_STAGES_DOC = "True to include resources that match no filter stage, "
      + "tagged with their closest threshold ratios. Intended for threshold tuning only.";

  /**
   * <code>batch.processing.timeout.ms</code>
   */
  public static final String BATCH_PROCESSING_TIMEOUT_MS_CONFIG = "batch.processing.timeout.ms";
  public static final long DEFAULT_BATCH_PROCESSING_TIMEOUT_MS = 10_000L;
  public static final String BATCH_PROCESSING_TIMEOUT_MS_DOC = "The time in milliseconds a batch may spend in filter "
      + "evaluation when it is forwarded downstream. The unfiltered batch is forwarded once the time is exceeded.";

  private FilterConfig() {
  }

  /**
   * Define configs for bypass stages and batch processing.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(INCLUDE_PROCESS_LIST_CONFIG,
                            ConfigDef.Type.LIST,
                            Collections.emptyList(),
                            ConfigDef.Importance.MEDIUM,
                            INCLUDE_PROCESS_LIST_DOC)
                    .define(DEBUG_SHOW_ALL_FILTER_STAGES_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_DEBUG_SHOW_ALL_FILTER_STAGES,
                            ConfigDef.Importance.LOW,
                            DEBUG_SHOW_ALL_FILTER_STAGES_DOC)
                    .define(BATCH_PROCESSING_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_BATCH_PROCESSING_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            BATCH_PROCESSING_TIMEOUT_MS_DOC);
  }
}
