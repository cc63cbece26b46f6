/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.common.utils;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;


/**
 * A lock holder to be used with try-with-resources. The lock is held from construction until {@link #close()}.
 */
public class AutoCloseableLock implements AutoCloseable {

  private final Lock _lock;
  private final AtomicBoolean _closed;

  public AutoCloseableLock(Lock lock) {
    this(lock, true);
  }

  private AutoCloseableLock(Lock lock, boolean acquire) {
    _lock = Utils.validateNotNull(lock, "Lock cannot be null");
    _closed = new AtomicBoolean(false);
    if (acquire) {
      _lock.lock();
    }
  }

  /**
   * Wait at most the given time to acquire the lock. Used by background work that must not hold up the
   * threads evaluating batches.
   *
   * @param lock The lock to acquire.
   * @param timeoutMs Maximum time to wait for the lock in milliseconds.
   * @return The held lock, or {@code null} if the lock could not be acquired within the timeout.
   * @throws InterruptedException If the waiting thread is interrupted.
   */
  public static AutoCloseableLock tryAcquire(Lock lock, long timeoutMs) throws InterruptedException {
    Utils.validateNotNull(lock, "Lock cannot be null");
    if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
      return null;
    }
    return new AutoCloseableLock(lock, false);
  }

  @Override
  public void close() {
    if (_closed.compareAndSet(false, true)) {
      try {
        _lock.unlock();
      } catch (Exception e) {
        throw new IllegalStateException("while invoking close action", e);
      }
    }
  }

  // Visible for testing purpose
  boolean isClosed() {
    return _closed.get();
  }
}
