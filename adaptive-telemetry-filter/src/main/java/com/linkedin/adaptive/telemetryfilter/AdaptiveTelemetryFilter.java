/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.adaptive.telemetryfilter.common.TelemetryFilterThreadFactory;
import com.linkedin.adaptive.telemetryfilter.config.AdaptiveTelemetryFilterConfig;
import com.linkedin.adaptive.telemetryfilter.exception.BatchCancelledException;
import com.linkedin.adaptive.telemetryfilter.extractor.MetricValueExtractor;
import com.linkedin.adaptive.telemetryfilter.identity.ResourceIdentityBuilder;
import com.linkedin.adaptive.telemetryfilter.persistence.EntityStateSerde;
import com.linkedin.adaptive.telemetryfilter.persistence.EntityStateStore;
import com.linkedin.adaptive.telemetryfilter.persistence.FileEntityStateStore;
import com.linkedin.adaptive.telemetryfilter.persistence.NoopEntityStateStore;
import com.linkedin.adaptive.telemetryfilter.persistence.StoragePathValidator;
import com.linkedin.adaptive.telemetryfilter.summary.FilterSummaryEmitter;
import com.linkedin.adaptive.telemetryfilter.summary.ThresholdDetailAnnotator;
import com.linkedin.adaptive.telemetryfilter.threshold.DynamicThresholdEngine;
import com.linkedin.adaptive.telemetryfilter.tracker.EntityTracker;
import com.linkedin.adaptive.telemetryfilter.tracker.FilterDecision;
import com.linkedin.adaptive.telemetryfilter.tracker.FilterStage;
import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import com.linkedin.telemetryfilter.common.utils.Utils;
import com.linkedin.telemetryfilter.model.MetricBatch;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.DoubleSupplier;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The adaptive telemetry filter. Each batch handed to {@link #filter(MetricBatch, BatchDeadline)} is reduced to the
 * resources that are currently interesting, annotated with the thresholds they were evaluated against, and followed
 * by a summary resource. {@link #consume(MetricBatch, MetricBatchConsumer)} wraps filtering for use as a pipeline
 * stage, forwarding the original batch whenever filtering fails.
 *
 * Batches may be filtered concurrently. Expired entity cleanup and state persistence run on a single low priority
 * background thread.
 */
public class AdaptiveTelemetryFilter {
  private static final Logger LOG = LoggerFactory.getLogger(AdaptiveTelemetryFilter.class);
  public static final String FILTER_SENSOR = "AdaptiveTelemetryFilter";
  // Used internally to label included resources, never forwarded downstream.
  public static final String FILTER_STAGE_ATTRIBUTE = "process.atp.filter.stage";
  static final int CANCELLATION_CHECK_INTERVAL = 25;
  static final double CLEANUP_PROBABILITY = 0.01;
  static final long PERSIST_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  static final long CLEANUP_LOCK_TIMEOUT_MS = 100L;
  static final long EXECUTOR_SHUTDOWN_TIMEOUT_MS = 5000L;
  private final Time _time;
  private final long _batchProcessingTimeoutMs;
  private final DynamicThresholdEngine _dynamicThresholds;
  private final MetricValueExtractor _extractor;
  private final EntityTracker _tracker;
  private final ThresholdDetailAnnotator _annotator;
  private final FilterSummaryEmitter _summaryEmitter;
  private final EntityStateStore _store;
  private final ExecutorService _backgroundExecutor;
  private final DoubleSupplier _random;
  private final AtomicBoolean _persistInProgress;
  private final Object _shutdownLock;
  private volatile long _lastPersistMs;
  private volatile boolean _shutdown;
  private final Timer _batchFilterTimer;
  private final Meter _includedResourceRate;
  private final Meter _filteredResourceRate;
  private final Meter _failOpenRate;

  /**
   * Construct the filter. Storage is set up from the configuration, but nothing is loaded until {@link #start()}.
   *
   * @param config The filter configuration.
   * @param time The time.
   * @param dropwizardMetricRegistry The metric registry that holds all the metrics for monitoring the filter.
   */
  public AdaptiveTelemetryFilter(AdaptiveTelemetryFilterConfig config, Time time, MetricRegistry dropwizardMetricRegistry) {
    this(config, time, dropwizardMetricRegistry, createStore(config), () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Package private constructor for unit test.
   */
  AdaptiveTelemetryFilter(AdaptiveTelemetryFilterConfig config,
                          Time time,
                          MetricRegistry dropwizardMetricRegistry,
                          EntityStateStore store,
                          DoubleSupplier random) {
    _time = Utils.validateNotNull(time, "Time cannot be null");
    Utils.validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null");
    _batchProcessingTimeoutMs = config.batchProcessingTimeoutMs();
    ReadWriteLock lock = new ReentrantReadWriteLock();
    _dynamicThresholds = new DynamicThresholdEngine(config, time, lock);
    _extractor = new MetricValueExtractor(config);
    _tracker = new EntityTracker(config, time, lock, _dynamicThresholds);
    _annotator = new ThresholdDetailAnnotator(config.metricThresholds(), _dynamicThresholds);
    _summaryEmitter = new FilterSummaryEmitter();
    _store = Utils.validateNotNull(store, "Entity state store cannot be null");
    _random = Utils.validateNotNull(random, "Random cannot be null");
    _backgroundExecutor = Executors.newSingleThreadExecutor(
        new TelemetryFilterThreadFactory("AdaptiveTelemetryFilterBackground", true, Thread.MIN_PRIORITY, LOG));
    _persistInProgress = new AtomicBoolean(false);
    _shutdownLock = new Object();
    _lastPersistMs = time.milliseconds();
    _shutdown = false;

    _batchFilterTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(FILTER_SENSOR, "batch-filter-timer"));
    _includedResourceRate = dropwizardMetricRegistry.meter(MetricRegistry.name(FILTER_SENSOR, "included-resource-rate"));
    _filteredResourceRate = dropwizardMetricRegistry.meter(MetricRegistry.name(FILTER_SENSOR, "filtered-resource-rate"));
    _failOpenRate = dropwizardMetricRegistry.meter(MetricRegistry.name(FILTER_SENSOR, "fail-open-rate"));
    registerGaugeSensors(dropwizardMetricRegistry);
  }

  private static EntityStateStore createStore(AdaptiveTelemetryFilterConfig config) {
    if (!config.storageEnabled()) {
      return NoopEntityStateStore.INSTANCE;
    }
    return new FileEntityStateStore(config.storagePath(), new StoragePathValidator(),
                                    new EntityStateSerde(config.anomalyHistorySize()));
  }

  /**
   * Register gauge sensors.
   * @param dropwizardMetricRegistry The metric registry that holds all the metrics for monitoring the filter.
   */
  private void registerGaugeSensors(MetricRegistry dropwizardMetricRegistry) {
    dropwizardMetricRegistry.register(MetricRegistry.name(FILTER_SENSOR, "tracked-entities"),
                                      (Gauge<Integer>) _tracker::numTrackedEntities);
    dropwizardMetricRegistry.register(MetricRegistry.name(FILTER_SENSOR, "dynamic-thresholds"),
                                      (Gauge<Integer>) () -> _dynamicThresholds.thresholds().size());
  }

  /**
   * Restore the tracked entities persisted by a previous instance, if storage is enabled.
   */
  public void start() {
    Map<String, TrackedEntity> persisted = _store.load();
    int restored = _tracker.restore(persisted);
    LOG.info("Adaptive telemetry filter started with {} restored tracked entities (storage {}).", restored,
             _store.isEnabled() ? "enabled" : "disabled");
  }

  /**
   * Filter the given batch. The batch itself is not modified.
   *
   * @param batch The batch to filter.
   * @param deadline The deadline of the batch. Checked before evaluation starts and periodically during evaluation.
   * @return The filtered batch, or the original batch with the cancellation if the deadline expired first.
   */
  public FilterResult filter(MetricBatch batch, BatchDeadline deadline) {
    Utils.validateNotNull(batch, "Batch cannot be null");
    Utils.validateNotNull(deadline, "Deadline cannot be null");
    if (_shutdown) {
      throw new IllegalStateException("Adaptive telemetry filter has been shut down.");
    }
    if (batch.isEmpty()) {
      return FilterResult.filtered(batch, new HashMap<>(), 0);
    }
    try (Timer.Context ignored = _batchFilterTimer.time()) {
      return doFilter(batch, deadline);
    } catch (BatchCancelledException bce) {
      LOG.warn("Returning the unfiltered batch of {} resources: {}", batch.resourceCount(), bce.getMessage());
      return FilterResult.cancelled(batch, bce);
    }
  }

  private FilterResult doFilter(MetricBatch batch, BatchDeadline deadline) throws BatchCancelledException {
    deadline.ensureNotExpired("before evaluation");
    if (_dynamicThresholds.maybeUpdate(batch)) {
      LOG.debug("Dynamic thresholds updated to {}.", _dynamicThresholds.thresholds());
    }
    List<ResourceMetrics> resources = batch.resources();
    List<ResourceMetrics> output = new ArrayList<>(resources.size() + 1);
    Map<String, Integer> stageHits = new HashMap<>();
    for (int i = 0; i < resources.size(); i++) {
      if (i > 0 && i % CANCELLATION_CHECK_INTERVAL == 0) {
        deadline.ensureNotExpired(String.format("after %d of %d resources", i, resources.size()));
      }
      ResourceMetrics resource = resources.get(i);
      String identity = ResourceIdentityBuilder.identityOf(resource);
      SortedMap<String, Double> values = _extractor.extract(resource);
      FilterDecision decision = _tracker.evaluate(identity, resource, values);
      if (!decision.isIncluded()) {
        continue;
      }
      if (decision.stage() != FilterStage.NONE) {
        stageHits.merge(decision.stage().label(), 1, Integer::sum);
      }
      Map<String, String> attributes = new LinkedHashMap<>(resource.attributes());
      attributes.remove(FILTER_STAGE_ATTRIBUTE);
      if (!values.isEmpty()) {
        _annotator.annotate(attributes, values, decision.compositeScore(), _time.milliseconds());
      }
      output.add(resource.withAttributes(attributes));
    }
    int includedCount = output.size();
    _includedResourceRate.mark(includedCount);
    _filteredResourceRate.mark(resources.size() - includedCount);
    ResourceMetrics summary = _summaryEmitter.summarize(resources.size(), output, stageHits, _time.milliseconds());
    if (summary != null) {
      output.add(summary);
    }
    LOG.debug("Filtered batch: {} of {} resources included, stage hits {}.", includedCount, resources.size(), stageHits);
    maybeScheduleBackgroundWork();
    return FilterResult.filtered(new MetricBatch(output), stageHits, includedCount);
  }

  /**
   * Filter the given batch within the configured batch processing timeout and hand the result to the downstream
   * consumer. The original batch is forwarded instead if filtering fails, is cancelled, or drops every resource of a
   * non-empty batch.
   *
   * @param batch The batch to filter.
   * @param downstream The next stage of the pipeline.
   */
  public void consume(MetricBatch batch, MetricBatchConsumer downstream) {
    MetricBatch toForward = batch;
    try {
      FilterResult result = filter(batch, BatchDeadline.after(_time, _batchProcessingTimeoutMs));
      if (result.isCancelled()) {
        failOpen(batch, "filtering was cancelled");
      } else if (!batch.isEmpty() && result.includedResourceCount() == 0) {
        failOpen(batch, "no resource was included");
      } else {
        toForward = result.batch();
      }
    } catch (RuntimeException e) {
      LOG.error("Failed to filter a batch of {} resources, forwarding it unfiltered.", batch.resourceCount(), e);
      _failOpenRate.mark();
    }
    downstream.consume(toForward);
  }

  private void failOpen(MetricBatch batch, String reason) {
    LOG.warn("Forwarding the unfiltered batch of {} resources: {}.", batch.resourceCount(), reason);
    _failOpenRate.mark();
  }

  private void maybeScheduleBackgroundWork() {
    if (_shutdown) {
      return;
    }
    try {
      if (_random.getAsDouble() < CLEANUP_PROBABILITY) {
        _backgroundExecutor.submit(this::removeExpiredEntities);
      }
      long nowMs = _time.milliseconds();
      if (_store.isEnabled() && nowMs - _lastPersistMs >= PERSIST_INTERVAL_MS && _persistInProgress.compareAndSet(false, true)) {
        _lastPersistMs = nowMs;
        _backgroundExecutor.submit(() -> {
          try {
            persistState();
          } finally {
            _persistInProgress.set(false);
          }
        });
      }
    } catch (RejectedExecutionException ree) {
      LOG.debug("Skipping background work, the filter is shutting down.");
    }
  }

  /**
   * Remove expired tracked entities, giving up if the entity table stays locked for too long.
   *
   * @return Number of removed entities, or -1 if the entity table could not be locked.
   */
  int removeExpiredEntities() {
    try {
      int removed = _tracker.removeExpired(CLEANUP_LOCK_TIMEOUT_MS);
      if (removed < 0) {
        LOG.debug("Skipped expired entity cleanup, entity table is busy.");
      } else if (removed > 0) {
        LOG.info("Removed {} expired tracked entities, {} remain.", removed, _tracker.numTrackedEntities());
      }
      return removed;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while removing expired tracked entities.");
      return -1;
    }
  }

  /**
   * Persist a snapshot of the tracked entities.
   *
   * @return {@code true} if the snapshot was persisted.
   */
  boolean persistState() {
    if (!_store.isEnabled()) {
      return false;
    }
    return _store.save(_tracker.snapshot());
  }

  /**
   * Stop background work, persist the tracked entities and release the storage. Calling this method more than once
   * has no further effect.
   */
  public void shutdown() {
    synchronized (_shutdownLock) {
      if (_shutdown) {
        return;
      }
      _shutdown = true;
    }
    LOG.info("Shutting down adaptive telemetry filter.");
    _backgroundExecutor.shutdown();
    try {
      if (!_backgroundExecutor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        LOG.warn("Background tasks did not finish within {} ms, interrupting them.", EXECUTOR_SHUTDOWN_TIMEOUT_MS);
        _backgroundExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for background tasks to finish.");
      _backgroundExecutor.shutdownNow();
    }
    if (persistState()) {
      LOG.info("Persisted {} tracked entities on shutdown.", _tracker.numTrackedEntities());
    }
    _store.close();
    LOG.info("Adaptive telemetry filter shutdown completed.");
  }

  public boolean isShutdown() {
    return _shutdown;
  }

  /**
   * Visible for testing.
   */
  EntityTracker tracker() {
    return _tracker;
  }

  /**
   * Visible for testing.
   */
  DynamicThresholdEngine dynamicThresholds() {
    return _dynamicThresholds;
  }
}
