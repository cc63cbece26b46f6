/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import com.linkedin.adaptive.telemetryfilter.composite.CompositeScore;
import com.linkedin.adaptive.telemetryfilter.composite.CompositeScorer;
import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.adaptive.telemetryfilter.detector.AnomalyDetector;
import com.linkedin.adaptive.telemetryfilter.threshold.DynamicThresholdEngine;
import com.linkedin.telemetryfilter.common.utils.AutoCloseableLock;
import com.linkedin.telemetryfilter.common.utils.Utils;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The stateful core of the filter. It owns the {@link TrackedEntity} of every resource identity that was included
 * (or, in debug mode, seen) and walks the filter stages of each resource in order:
 * <ol>
 *   <li>A resource without metrics of interest is included without evaluation.</li>
 *   <li>A defunct (zombie) process is included.</li>
 *   <li>A process whose executable is on the include list is included.</li>
 *   <li>Anomaly detection, if enabled. Stamps the last anomaly time.</li>
 *   <li>Thresholds: dynamic if enabled, else static. A threshold of 0 includes the resource whenever the metric is
 *   present. Stamps the last exceeded time.</li>
 *   <li>Composite score, if multi-metric evaluation is enabled. Stamps the last exceeded time.</li>
 *   <li>For resources seen before: anomaly retention, then standard retention.</li>
 *   <li>In debug mode, the resource is included with a summary of its closest misses.</li>
 * </ol>
 * Otherwise the resource is excluded. The first stage that includes a resource decides.
 *
 * The entity table is guarded by a read/write lock, which is held for the evaluation of one resource at a time and
 * shared with the {@link DynamicThresholdEngine}.
 */
public class EntityTracker {
  private static final Logger LOG = LoggerFactory.getLogger(EntityTracker.class);
  public static final String PROCESS_STATE_ATTRIBUTE = "process.state";
  public static final String DEFUNCT_PROCESS_STATE = "Z";
  private final Time _time;
  private final ReadWriteLock _lock;
  // Guarded by _lock.
  private final Map<String, TrackedEntity> _entities;
  private final SortedMap<String, Double> _staticThresholds;
  private final DynamicThresholdEngine _dynamicThresholds;
  private final AnomalyDetector _anomalyDetector;
  private final CompositeScorer _compositeScorer;
  private final IncludeListMatcher _includeList;
  private final RetentionClock _retentionClock;
  private final boolean _anomalyDetectionEnabled;
  private final boolean _multiMetricEnabled;
  private final boolean _debugShowAllFilterStages;

  public EntityTracker(AdaptiveTelemetryFilterConfig config,
                       Time time,
                       ReadWriteLock lock,
                       DynamicThresholdEngine dynamicThresholds) {
    _time = Utils.validateNotNull(time, "Time cannot be null");
    _lock = Utils.validateNotNull(lock, "Lock cannot be null");
    _dynamicThresholds = Utils.validateNotNull(dynamicThresholds, "Dynamic threshold engine cannot be null");
    _entities = new HashMap<>();
    _staticThresholds = new TreeMap<>(config.metricThresholds());
    _anomalyDetectionEnabled = config.anomalyDetectionEnabled();
    _multiMetricEnabled = config.multiMetricEnabled();
    _debugShowAllFilterStages = config.debugShowAllFilterStages();
    _anomalyDetector = new AnomalyDetector(config);
    _compositeScorer = new CompositeScorer(config, dynamicThresholds);
    _includeList = new IncludeListMatcher(config.includeProcessList());
    _retentionClock = new RetentionClock(config.retentionMs(), _anomalyDetectionEnabled);
  }

  /**
   * Decide whether the given resource is forwarded, updating its tracked state.
   *
   * @param identity Identity of the resource.
   * @param resource The resource of the current batch.
   * @param values Values of the metrics of interest of the resource.
   * @return The filter decision.
   */
  public FilterDecision evaluate(String identity, ResourceMetrics resource, SortedMap<String, Double> values) {
    if (values.isEmpty()) {
      LOG.trace("Resource {} included: no metrics of interest.", identity);
      return FilterDecision.untargeted();
    }
    long nowMs = _time.milliseconds();
    if (DEFUNCT_PROCESS_STATE.equals(resource.attribute(PROCESS_STATE_ATTRIBUTE))) {
      upsertBypassed(identity, resource, values, nowMs);
      LOG.debug("Resource {} included: defunct process.", identity);
      return FilterDecision.included(FilterStage.DEFUNCT_PROCESS);
    }
    if (_includeList.matches(resource.attributes())) {
      upsertBypassed(identity, resource, values, nowMs);
      LOG.debug("Resource {} included: executable {} is on the include list.", identity,
                IncludeListMatcher.executableOf(resource.attributes()));
      return FilterDecision.included(FilterStage.INCLUDE_LIST);
    }

    FilterDecision decision;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      TrackedEntity entity = _entities.get(identity);
      decision = entity == null ? evaluateNewEntity(identity, resource, values, nowMs)
                                : evaluateExistingEntity(entity, values, nowMs);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resource {} {} by stage {}{}.", identity, decision.isIncluded() ? "included" : "excluded",
                decision.stageLabel(), decision.detail() == null ? "" : ": " + decision.detail());
    }
    return decision;
  }

  private void upsertBypassed(String identity, ResourceMetrics resource, Map<String, Double> values, long nowMs) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      TrackedEntity entity = _entities.computeIfAbsent(identity, id -> new TrackedEntity(id, nowMs, resource.attributes()));
      entity.updateValues(values);
      entity.markExceeded(nowMs);
    }
  }

  private FilterDecision evaluateExistingEntity(TrackedEntity entity, SortedMap<String, Double> values, long nowMs) {
    entity.updateValues(values);
    FilterDecision decision = evaluateStages(entity, values, nowMs);
    if (decision != null) {
      return decision;
    }
    FilterStage retainingStage = _retentionClock.retainingStage(entity, nowMs);
    if (retainingStage != null) {
      return FilterDecision.included(retainingStage);
    }
    return _debugShowAllFilterStages ? debugDecision(values) : FilterDecision.excluded();
  }

  private FilterDecision evaluateNewEntity(String identity,
                                           ResourceMetrics resource,
                                           SortedMap<String, Double> values,
                                           long nowMs) {
    TrackedEntity entity = new TrackedEntity(identity, nowMs, resource.attributes());
    entity.updateValues(values);
    FilterDecision decision = evaluateStages(entity, values, nowMs);
    if (decision == null && _debugShowAllFilterStages) {
      decision = debugDecision(values);
    }
    if (decision == null) {
      return FilterDecision.excluded();
    }
    _entities.put(identity, entity);
    return decision;
  }

  /**
   * @return The decision of the first evaluation stage that includes the resource, or {@code null} if none does.
   */
  private FilterDecision evaluateStages(TrackedEntity entity, SortedMap<String, Double> values, long nowMs) {
    if (_anomalyDetectionEnabled) {
      String anomaly = _anomalyDetector.detect(entity, values);
      if (anomaly != null) {
        entity.markAnomalyDetected(nowMs);
        return FilterDecision.included(FilterStage.ANOMALY_DETECTION, anomaly);
      }
    }
    FilterDecision thresholdDecision = thresholdStage(values);
    if (thresholdDecision != null) {
      entity.markExceeded(nowMs);
      return thresholdDecision;
    }
    if (_multiMetricEnabled) {
      CompositeScore compositeScore = _compositeScorer.score(values);
      if (compositeScore.exceedsThreshold()) {
        entity.markExceeded(nowMs);
        return FilterDecision.includedByCompositeScore(compositeScore);
      }
    }
    return null;
  }

  private FilterDecision thresholdStage(SortedMap<String, Double> values) {
    FilterStage stage = _dynamicThresholds.isEnabled() ? FilterStage.DYNAMIC_THRESHOLD : FilterStage.STATIC_THRESHOLD;
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      Double threshold = effectiveThreshold(entry.getKey());
      if (threshold == null) {
        continue;
      }
      if (threshold == 0.0 || entry.getValue() >= threshold) {
        return FilterDecision.included(stage, String.format("%s=%.2f >= %.2f", entry.getKey(), entry.getValue(), threshold));
      }
    }
    return null;
  }

  /**
   * @param metric Metric name.
   * @return The threshold the metric is currently compared against, or {@code null} if the metric has no threshold.
   */
  public Double effectiveThreshold(String metric) {
    Double staticThreshold = _staticThresholds.get(metric);
    if (staticThreshold == null || !_dynamicThresholds.isEnabled()) {
      return staticThreshold;
    }
    Double dynamicThreshold = _dynamicThresholds.thresholdOf(metric);
    return dynamicThreshold != null && dynamicThreshold > 0.0 ? dynamicThreshold : staticThreshold;
  }

  private FilterDecision debugDecision(SortedMap<String, Double> values) {
    double maxRatio = 0.0;
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      Double threshold = effectiveThreshold(entry.getKey());
      if (threshold != null && threshold > 0.0) {
        maxRatio = Math.max(maxRatio, entry.getValue() / threshold);
      }
    }
    List<String> parts = new ArrayList<>();
    parts.add(String.format("%s_max_ratio=%.2f", _dynamicThresholds.isEnabled() ? "dynamic" : "static", maxRatio));
    if (_multiMetricEnabled) {
      CompositeScore compositeScore = _compositeScorer.score(values);
      parts.add(String.format("multi_metric=%.2f/%.2f", compositeScore.score(), compositeScore.threshold()));
    }
    if (_anomalyDetectionEnabled) {
      parts.add("anomaly=none");
    }
    return FilterDecision.included(FilterStage.DEBUG_NO_MATCH,
                                   FilterStage.DEBUG_NO_MATCH.label() + ":[" + String.join(" ", parts) + "]");
  }

  /**
   * Forget entities whose retention windows have all lapsed. Gives up if the lock cannot be acquired within the given
   * time, so that batch evaluation is not held up.
   *
   * @param lockTimeoutMs Maximum time to wait for the lock.
   * @return Number of removed entities, or -1 if the lock could not be acquired.
   * @throws InterruptedException If interrupted while waiting for the lock.
   */
  public int removeExpired(long lockTimeoutMs) throws InterruptedException {
    long nowMs = _time.milliseconds();
    try (AutoCloseableLock held = AutoCloseableLock.tryAcquire(_lock.writeLock(), lockTimeoutMs)) {
      if (held == null) {
        return -1;
      }
      int removed = 0;
      for (Iterator<TrackedEntity> it = _entities.values().iterator(); it.hasNext(); ) {
        if (_retentionClock.isExpired(it.next(), nowMs)) {
          it.remove();
          removed++;
        }
      }
      return removed;
    }
  }

  /**
   * @return A deep copy of all tracked entities by identity.
   */
  public Map<String, TrackedEntity> snapshot() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      Map<String, TrackedEntity> snapshot = new HashMap<>(_entities.size());
      _entities.forEach((identity, entity) -> snapshot.put(identity, entity.copy()));
      return snapshot;
    }
  }

  /**
   * Add entities restored from persisted state. Entities already tracked are kept.
   *
   * @param entities Tracked entities by identity.
   * @return Number of restored entities.
   */
  public int restore(Map<String, TrackedEntity> entities) {
    int restored = 0;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.writeLock())) {
      for (Map.Entry<String, TrackedEntity> entry : entities.entrySet()) {
        if (_entities.putIfAbsent(entry.getKey(), entry.getValue()) == null) {
          restored++;
        }
      }
    }
    return restored;
  }

  /**
   * @param identity Resource identity.
   * @return A copy of the tracked entity, or {@code null} if the identity is not tracked.
   */
  public TrackedEntity entity(String identity) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      TrackedEntity entity = _entities.get(identity);
      return entity == null ? null : entity.copy();
    }
  }

  public int numTrackedEntities() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      return _entities.size();
    }
  }

  /**
   * @return Identities of all tracked entities, sorted.
   */
  public List<String> identities() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock.readLock())) {
      List<String> identities = new ArrayList<>(_entities.keySet());
      Collections.sort(identities);
      return identities;
    }
  }
}
