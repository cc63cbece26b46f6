/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.config;

import com.linkedin.adaptive.telemetryfilter.config.constants.AnomalyDetectionConfig;
import com.linkedin.adaptive.telemetryfilter.config.constants.FilterConfig;
import com.linkedin.adaptive.telemetryfilter.config.constants.MultiMetricConfig;
import com.linkedin.adaptive.telemetryfilter.config.constants.RetentionConfig;
import com.linkedin.adaptive.telemetryfilter.config.constants.ThresholdConfig;
import com.linkedin.adaptive.telemetryfilter.exception.InvalidStoragePathException;
import com.linkedin.adaptive.telemetryfilter.persistence.StoragePathValidator;
import com.linkedin.adaptive.telemetryfilter.tracker.IncludeListMatcher;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.adaptive.telemetryfilter.config.constants.AnomalyDetectionConfig.ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.AnomalyDetectionConfig.ANOMALY_HISTORY_SIZE_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.AnomalyDetectionConfig.ANOMALY_MIN_DATA_POINTS_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.AnomalyDetectionConfig.ENABLE_ANOMALY_DETECTION_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.MultiMetricConfig.COMPOSITE_THRESHOLD_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.MultiMetricConfig.ENABLE_MULTI_METRIC_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.RetentionConfig.RETENTION_MINUTES_CONFIG;
import static com.linkedin.adaptive.telemetryfilter.config.constants.ThresholdConfig.DYNAMIC_SMOOTHING_FACTOR_CONFIG;


/**
 * The configuration class of the adaptive telemetry filter.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.adaptive.telemetryfilter.config.constants}.
 *
 * Per-metric values (static thresholds, dynamic threshold bounds and composite weights) are given as prefixed keys,
 * e.g. <code>metric.threshold.process.cpu.utilization=80</code>.
 *
 * Mildly invalid numeric values are normalized with a warning. Negative thresholds, bounds or weights, and
 * non-positive parameters of an enabled feature fail construction with a {@link ConfigException}.
 */
public class AdaptiveTelemetryFilterConfig extends AbstractConfig {
  private static final Logger LOG = LoggerFactory.getLogger(AdaptiveTelemetryFilterConfig.class);
  private static final ConfigDef CONFIG;

  static {
    CONFIG = FilterConfig.define(RetentionConfig.define(AnomalyDetectionConfig.define(
        MultiMetricConfig.define(ThresholdConfig.define(new ConfigDef())))));
  }

  private final SortedMap<String, Double> _metricThresholds;
  private final Map<String, Double> _dynamicThresholdMins;
  private final Map<String, Double> _dynamicThresholdMaxs;
  private final SortedMap<String, Double> _compositeWeights;

  public AdaptiveTelemetryFilterConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public AdaptiveTelemetryFilterConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    _metricThresholds = Collections.unmodifiableSortedMap(parsePerMetricValues(ThresholdConfig.METRIC_THRESHOLD_PREFIX));
    _dynamicThresholdMins = Collections.unmodifiableMap(parsePerMetricValues(ThresholdConfig.DYNAMIC_THRESHOLD_MIN_PREFIX));
    _dynamicThresholdMaxs = Collections.unmodifiableMap(parsePerMetricValues(ThresholdConfig.DYNAMIC_THRESHOLD_MAX_PREFIX));
    _compositeWeights = Collections.unmodifiableSortedMap(parsePerMetricValues(MultiMetricConfig.COMPOSITE_WEIGHT_PREFIX));
    sanityCheckDynamicThresholdBounds();
    sanityCheckAnomalyDetection();
    sanityCheckMultiMetric();
    sanityCheckIncludeList();
    sanityCheckStoragePath();
  }

  /**
   * @return The definition of all configs of the adaptive telemetry filter.
   */
  public static ConfigDef configDef() {
    return CONFIG;
  }

  /**
   * Replace out-of-range values that have a sensible default. Non-positive anomaly detection parameters and composite
   * threshold are left untouched while the corresponding feature is enabled, so that they fail the sanity checks.
   */
  @Override
  protected Map<String, Object> postProcessParsedConfig(Map<String, Object> parsedValues) {
    Map<String, Object> updates = new HashMap<>();

    double smoothing = (Double) parsedValues.get(DYNAMIC_SMOOTHING_FACTOR_CONFIG);
    if (smoothing <= 0.0 || smoothing > 1.0) {
      LOG.warn("{}={} is outside of (0, 1], using {}.", DYNAMIC_SMOOTHING_FACTOR_CONFIG, smoothing,
               ThresholdConfig.DEFAULT_DYNAMIC_SMOOTHING_FACTOR);
      updates.put(DYNAMIC_SMOOTHING_FACTOR_CONFIG, ThresholdConfig.DEFAULT_DYNAMIC_SMOOTHING_FACTOR);
    }

    long retentionMinutes = (Long) parsedValues.get(RETENTION_MINUTES_CONFIG);
    if (retentionMinutes <= 0) {
      LOG.warn("{}={} is not positive, using {}.", RETENTION_MINUTES_CONFIG, retentionMinutes,
               RetentionConfig.DEFAULT_RETENTION_MINUTES);
      updates.put(RETENTION_MINUTES_CONFIG, RetentionConfig.DEFAULT_RETENTION_MINUTES);
    } else if (retentionMinutes > RetentionConfig.MAX_RETENTION_MINUTES) {
      LOG.warn("{}={} exceeds the maximum, using {}.", RETENTION_MINUTES_CONFIG, retentionMinutes,
               RetentionConfig.MAX_RETENTION_MINUTES);
      updates.put(RETENTION_MINUTES_CONFIG, RetentionConfig.MAX_RETENTION_MINUTES);
    }

    boolean multiMetricEnabled = (Boolean) parsedValues.get(ENABLE_MULTI_METRIC_CONFIG);
    double compositeThreshold = (Double) parsedValues.get(COMPOSITE_THRESHOLD_CONFIG);
    if (!multiMetricEnabled && compositeThreshold <= 0.0) {
      updates.put(COMPOSITE_THRESHOLD_CONFIG, MultiMetricConfig.DEFAULT_COMPOSITE_THRESHOLD);
    }

    updates.putAll(normalizedAnomalyDetectionValues(parsedValues));
    return updates;
  }

  private static Map<String, Object> normalizedAnomalyDetectionValues(Map<String, Object> parsedValues) {
    Map<String, Object> updates = new HashMap<>();
    boolean enabled = (Boolean) parsedValues.get(ENABLE_ANOMALY_DETECTION_CONFIG);
    int historySize = (Integer) parsedValues.get(ANOMALY_HISTORY_SIZE_CONFIG);
    int minDataPoints = (Integer) parsedValues.get(ANOMALY_MIN_DATA_POINTS_CONFIG);
    double changeThreshold = (Double) parsedValues.get(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG);

    if (historySize <= 0 || minDataPoints <= 0 || changeThreshold <= 0.0) {
      if (enabled) {
        // Left for the sanity check to report.
        return updates;
      }
      historySize = historySize <= 0 ? AnomalyDetectionConfig.DEFAULT_ANOMALY_HISTORY_SIZE : historySize;
      minDataPoints = minDataPoints <= 0 ? AnomalyDetectionConfig.DEFAULT_ANOMALY_MIN_DATA_POINTS : minDataPoints;
      changeThreshold = changeThreshold <= 0.0 ? AnomalyDetectionConfig.DEFAULT_ANOMALY_CHANGE_THRESHOLD_PERCENT
                                               : changeThreshold;
    }
    if (historySize > AnomalyDetectionConfig.MAX_ANOMALY_HISTORY_SIZE) {
      LOG.warn("{}={} exceeds the maximum, using {}.", ANOMALY_HISTORY_SIZE_CONFIG, historySize,
               AnomalyDetectionConfig.MAX_ANOMALY_HISTORY_SIZE);
      historySize = AnomalyDetectionConfig.MAX_ANOMALY_HISTORY_SIZE;
    }
    if (minDataPoints < AnomalyDetectionConfig.DEFAULT_ANOMALY_MIN_DATA_POINTS) {
      LOG.warn("{}={} is too small for a meaningful average, using {}.", ANOMALY_MIN_DATA_POINTS_CONFIG, minDataPoints,
               AnomalyDetectionConfig.DEFAULT_ANOMALY_MIN_DATA_POINTS);
      minDataPoints = AnomalyDetectionConfig.DEFAULT_ANOMALY_MIN_DATA_POINTS;
    }
    if (minDataPoints > historySize) {
      // The history must be able to hold enough values for detection to ever fire.
      LOG.warn("{}={} is smaller than {}={}, using {}.", ANOMALY_HISTORY_SIZE_CONFIG, historySize,
               ANOMALY_MIN_DATA_POINTS_CONFIG, minDataPoints, minDataPoints);
      historySize = Math.min(minDataPoints, AnomalyDetectionConfig.MAX_ANOMALY_HISTORY_SIZE);
      minDataPoints = Math.min(minDataPoints, historySize);
    }
    updates.put(ANOMALY_HISTORY_SIZE_CONFIG, historySize);
    updates.put(ANOMALY_MIN_DATA_POINTS_CONFIG, minDataPoints);
    updates.put(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG, changeThreshold);
    return updates;
  }

  private TreeMap<String, Double> parsePerMetricValues(String prefix) {
    TreeMap<String, Double> values = new TreeMap<>();
    for (Map.Entry<String, Object> entry : originalsWithPrefix(prefix).entrySet()) {
      String name = prefix + entry.getKey();
      if (entry.getKey().isEmpty()) {
        throw new ConfigException(name, entry.getValue(), "Metric name cannot be empty.");
      }
      double value = (Double) ConfigDef.parseType(name, entry.getValue(), ConfigDef.Type.DOUBLE);
      if (value < 0.0 || Double.isNaN(value)) {
        throw new ConfigException(name, entry.getValue(), "Value cannot be negative.");
      }
      values.put(entry.getKey(), value);
    }
    return values;
  }

  /**
   * Sanity check to ensure that the dynamic threshold lower bound of a metric does not exceed its upper bound.
   */
  private void sanityCheckDynamicThresholdBounds() {
    for (Map.Entry<String, Double> entry : _dynamicThresholdMins.entrySet()) {
      Double max = _dynamicThresholdMaxs.get(entry.getKey());
      if (max != null && max > 0.0 && entry.getValue() > max) {
        throw new ConfigException(ThresholdConfig.DYNAMIC_THRESHOLD_MIN_PREFIX + entry.getKey(), entry.getValue(),
                                  String.format("Dynamic threshold lower bound exceeds the upper bound %f.", max));
      }
    }
  }

  /**
   * Sanity check to ensure that anomaly detection parameters are positive when anomaly detection is enabled.
   */
  private void sanityCheckAnomalyDetection() {
    if (!anomalyDetectionEnabled()) {
      return;
    }
    if (getInt(ANOMALY_HISTORY_SIZE_CONFIG) <= 0) {
      throw new ConfigException(ANOMALY_HISTORY_SIZE_CONFIG, getInt(ANOMALY_HISTORY_SIZE_CONFIG),
                                "Anomaly history size must be positive when anomaly detection is enabled.");
    }
    if (getDouble(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG) <= 0.0) {
      throw new ConfigException(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG, getDouble(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG),
                                "Anomaly change threshold must be positive when anomaly detection is enabled.");
    }
    if (getInt(ANOMALY_MIN_DATA_POINTS_CONFIG) <= 0) {
      throw new ConfigException(ANOMALY_MIN_DATA_POINTS_CONFIG, getInt(ANOMALY_MIN_DATA_POINTS_CONFIG),
                                "Anomaly minimum data points must be positive when anomaly detection is enabled.");
    }
  }

  /**
   * Sanity check to ensure that the composite threshold is positive when multi-metric evaluation is enabled.
   */
  private void sanityCheckMultiMetric() {
    if (multiMetricEnabled() && compositeThreshold() <= 0.0) {
      throw new ConfigException(COMPOSITE_THRESHOLD_CONFIG, compositeThreshold(),
                                "Composite threshold must be positive when multi-metric evaluation is enabled.");
    }
  }

  /**
   * Include list entries without a path separator can never match, see {@link IncludeListMatcher}.
   */
  private void sanityCheckIncludeList() {
    for (String entry : includeProcessList()) {
      if (!IncludeListMatcher.isFullPath(entry)) {
        LOG.warn("Ignoring {} entry {}: only full executable paths are matched.", FilterConfig.INCLUDE_PROCESS_LIST_CONFIG,
                 entry);
      }
    }
  }

  /**
   * Sanity check to ensure that the storage path is confined to the allowed base directory when storage is enabled.
   */
  private void sanityCheckStoragePath() {
    if (!storageEnabled()) {
      return;
    }
    try {
      new StoragePathValidator().validate(storagePath());
    } catch (InvalidStoragePathException e) {
      throw new ConfigException(RetentionConfig.STORAGE_PATH_CONFIG, storagePath(), e.getMessage());
    }
  }

  /**
   * @return Static thresholds by metric name, sorted by metric name.
   */
  public SortedMap<String, Double> metricThresholds() {
    return _metricThresholds;
  }

  public Map<String, Double> dynamicThresholdMins() {
    return _dynamicThresholdMins;
  }

  public Map<String, Double> dynamicThresholdMaxs() {
    return _dynamicThresholdMaxs;
  }

  /**
   * @return Composite weights by metric name, sorted by metric name.
   */
  public SortedMap<String, Double> compositeWeights() {
    return _compositeWeights;
  }

  public boolean dynamicThresholdsEnabled() {
    return getBoolean(ThresholdConfig.ENABLE_DYNAMIC_THRESHOLDS_CONFIG);
  }

  public double dynamicSmoothingFactor() {
    return getDouble(DYNAMIC_SMOOTHING_FACTOR_CONFIG);
  }

  public long dynamicThresholdUpdateIntervalMs() {
    return getLong(ThresholdConfig.DYNAMIC_THRESHOLD_UPDATE_INTERVAL_MS_CONFIG);
  }

  public boolean multiMetricEnabled() {
    return getBoolean(ENABLE_MULTI_METRIC_CONFIG);
  }

  public double compositeThreshold() {
    return getDouble(COMPOSITE_THRESHOLD_CONFIG);
  }

  public boolean anomalyDetectionEnabled() {
    return getBoolean(ENABLE_ANOMALY_DETECTION_CONFIG);
  }

  public int anomalyHistorySize() {
    return getInt(ANOMALY_HISTORY_SIZE_CONFIG);
  }

  public double anomalyChangeThresholdPercent() {
    return getDouble(ANOMALY_CHANGE_THRESHOLD_PERCENT_CONFIG);
  }

  public int anomalyMinDataPoints() {
    return getInt(ANOMALY_MIN_DATA_POINTS_CONFIG);
  }

  public List<String> includeProcessList() {
    return getList(FilterConfig.INCLUDE_PROCESS_LIST_CONFIG);
  }

  public long retentionMs() {
    return TimeUnit.MINUTES.toMillis(getLong(RETENTION_MINUTES_CONFIG));
  }

  public boolean storageEnabled() {
    return getBoolean(RetentionConfig.ENABLE_STORAGE_CONFIG);
  }

  public String storagePath() {
    return getString(RetentionConfig.STORAGE_PATH_CONFIG);
  }

  public boolean debugShowAllFilterStages() {
    return getBoolean(FilterConfig.DEBUG_SHOW_ALL_FILTER_STAGES_CONFIG);
  }

  public long batchProcessingTimeoutMs() {
    return getLong(FilterConfig.BATCH_PROCESSING_TIMEOUT_MS_CONFIG);
  }
}
