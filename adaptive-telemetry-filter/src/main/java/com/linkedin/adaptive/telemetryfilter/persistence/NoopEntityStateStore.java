/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import java.util.Collections;
import java.util.Map;


/**
 * The store used when storage is disabled.
 */
public final class NoopEntityStateStore implements EntityStateStore {
  public static final NoopEntityStateStore INSTANCE = new NoopEntityStateStore();

  private NoopEntityStateStore() {
  }

  @Override
  public Map<String, TrackedEntity> load() {
    return Collections.emptyMap();
  }

  @Override
  public boolean save(Map<String, TrackedEntity> entities) {
    return false;
  }

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void close() {

  }
}
