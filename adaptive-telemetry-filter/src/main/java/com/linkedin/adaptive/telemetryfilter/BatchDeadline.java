/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter;

import com.linkedin.adaptive.telemetryfilter.exception.BatchCancelledException;
import com.linkedin.telemetryfilter.common.utils.Utils;
import org.apache.kafka.common.utils.Time;


/**
 * The deadline of a batch, which the caller may also cancel explicitly.
 */
public final class BatchDeadline {
  private static final long NO_DEADLINE_MS = Long.MAX_VALUE;
  private final Time _time;
  private final long _deadlineMs;
  private volatile boolean _cancelled;

  private BatchDeadline(Time time, long deadlineMs) {
    _time = Utils.validateNotNull(time, "Time cannot be null");
    _deadlineMs = deadlineMs;
    _cancelled = false;
  }

  /**
   * @return A deadline that only expires when cancelled.
   */
  public static BatchDeadline none() {
    return new BatchDeadline(Time.SYSTEM, NO_DEADLINE_MS);
  }

  public static BatchDeadline at(Time time, long deadlineMs) {
    return new BatchDeadline(time, deadlineMs);
  }

  public static BatchDeadline after(Time time, long timeoutMs) {
    long nowMs = time.milliseconds();
    return new BatchDeadline(time, timeoutMs > NO_DEADLINE_MS - nowMs ? NO_DEADLINE_MS : nowMs + timeoutMs);
  }

  public void cancel() {
    _cancelled = true;
  }

  public boolean isCancelled() {
    return _cancelled;
  }

  public boolean isExpired() {
    return _cancelled || (_deadlineMs != NO_DEADLINE_MS && _time.milliseconds() >= _deadlineMs);
  }

  /**
   * @param progress Description of the progress made on the batch so far, used in the exception message.
   * @throws BatchCancelledException If the deadline expired or the batch was cancelled.
   */
  public void ensureNotExpired(String progress) throws BatchCancelledException {
    if (_cancelled) {
      throw new BatchCancelledException("Batch was cancelled " + progress + ".");
    }
    if (isExpired()) {
      throw new BatchCancelledException(String.format("Batch deadline %d expired %s.", _deadlineMs, progress));
    }
  }

  public long deadlineMs() {
    return _deadlineMs;
  }
}
