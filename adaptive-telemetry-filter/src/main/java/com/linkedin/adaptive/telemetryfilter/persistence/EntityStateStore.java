/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import java.util.Map;


/**
 * The storage of tracked entities across restarts.
 */
public interface EntityStateStore extends AutoCloseable {

  /**
   * Load the persisted tracked entities. Failures are not fatal, the filter starts from an empty state instead.
   *
   * @return Tracked entities by identity, empty if nothing could be loaded.
   */
  Map<String, TrackedEntity> load();

  /**
   * Persist a snapshot of the tracked entities, replacing any previous snapshot.
   *
   * @param entities Tracked entities by identity.
   * @return {@code true} if the snapshot was persisted, {@code false} otherwise.
   */
  boolean save(Map<String, TrackedEntity> entities);

  /**
   * @return {@code true} if snapshots are still being persisted.
   */
  boolean isEnabled();

  /**
   * Release the storage. Subsequent saves are ignored.
   */
  @Override
  void close();
}
