/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.config.constants;

import com.linkedin.adaptive.telemetryfilter.persistence.StoragePathValidator;
import org.apache.kafka.common.config.ConfigDef;


/**
 * A class to keep retention and tracked state storage configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class RetentionConfig {

  /**
   * <code>retention.minutes</code>
   */
  public static final String RETENTION_MINUTES_CONFIG = "retention.minutes";
  public static final long DEFAULT_RETENTION_MINUTES = 30L;
  public static final long MAX_RETENTION_MINUTES = 30L;
  public static final String RETENTION_MINUTES_DOC = "The number of minutes a resource stays included after the last "
      + "threshold, composite score or anomaly event that included it. Non-positive values are replaced with the "
      + "default and values above " + MAX_RETENTION_MINUTES + " are capped.";

  /**
   * <code>enable.storage</code>
   */
  public static final String ENABLE_STORAGE_CONFIG = "enable.storage";
  public static final boolean DEFAULT_ENABLE_STORAGE = true;
  public static final String ENABLE_STORAGE_DOC = "True to persist tracked resource state across restarts.";

  /**
   * <code>storage.path</code>
   */
  public static final String STORAGE_PATH_CONFIG = "storage.path";
  public static final String DEFAULT_STORAGE_PATH =
      StoragePathValidator.platformBaseDirectory().resolve("adaptive-telemetry-state.json").toString();
  public static final String STORAGE_PATH_DOC = "The absolute path of the file holding tracked resource state. It must "
      + "be located under " + StoragePathValidator.platformBaseDirectory() + " and no component below that directory "
      + "may be a symbolic link or junction.";

  private RetentionConfig() {
  }

  /**
   * Define configs for retention and storage.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for retention and storage.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(RETENTION_MINUTES_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_RETENTION_MINUTES,
                            ConfigDef.Importance.MEDIUM,
                            RETENTION_MINUTES_DOC)
                    .define(ENABLE_STORAGE_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_STORAGE,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_STORAGE_DOC)
                    .define(STORAGE_PATH_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_STORAGE_PATH,
                            ConfigDef.Importance.MEDIUM,
                            STORAGE_PATH_DOC);
  }
}
