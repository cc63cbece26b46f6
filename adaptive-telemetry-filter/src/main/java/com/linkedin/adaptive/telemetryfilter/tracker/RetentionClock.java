/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

/**
 * Keeps a resource included for a grace window after the last event that included it. The window after the last
 * anomaly and the window after the last threshold or composite event run independently, with the same length.
 */
public class RetentionClock {
  private final long _retentionMs;
  private final boolean _anomalyRetentionEnabled;

  /**
   * @param retentionMs Length of the retention windows.
   * @param anomalyRetentionEnabled {@code true} if anomaly detection is enabled.
   */
  public RetentionClock(long retentionMs, boolean anomalyRetentionEnabled) {
    if (retentionMs <= 0) {
      throw new IllegalArgumentException("Retention must be positive, got " + retentionMs);
    }
    _retentionMs = retentionMs;
    _anomalyRetentionEnabled = anomalyRetentionEnabled;
  }

  public long retentionMs() {
    return _retentionMs;
  }

  /**
   * @param entity A tracked entity.
   * @param nowMs Current time.
   * @return The retention stage that keeps the entity included, or {@code null} if both windows have lapsed.
   */
  public FilterStage retainingStage(TrackedEntity entity, long nowMs) {
    if (_anomalyRetentionEnabled && withinWindow(entity.lastAnomalyDetectedMs(), nowMs)) {
      return FilterStage.ANOMALY_RETENTION;
    }
    if (withinWindow(entity.lastExceededMs(), nowMs)) {
      return FilterStage.STANDARD_RETENTION;
    }
    return null;
  }

  /**
   * An entity that never triggered anything is measured from the time it was first seen.
   *
   * @param entity A tracked entity.
   * @param nowMs Current time.
   * @return {@code true} if all retention windows of the entity have lapsed and it can be forgotten.
   */
  public boolean isExpired(TrackedEntity entity, long nowMs) {
    long lastEventMs = Math.max(entity.lastExceededMs(), entity.lastAnomalyDetectedMs());
    if (lastEventMs == 0L) {
      lastEventMs = entity.firstSeenMs();
    }
    return nowMs - lastEventMs >= _retentionMs;
  }

  private boolean withinWindow(long eventMs, long nowMs) {
    return eventMs > 0L && nowMs - eventMs < _retentionMs;
  }
}
