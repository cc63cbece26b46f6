/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter;

import com.linkedin.telemetryfilter.model.MetricBatch;


/**
 * The next stage of the host pipeline, which receives the batches forwarded by the filter.
 */
@FunctionalInterface
public interface MetricBatchConsumer {

  /**
   * @param batch The batch to consume.
   */
  void consume(MetricBatch batch);
}
