/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter;

import com.linkedin.adaptive.telemetryfilter.exception.BatchCancelledException;
import com.linkedin.telemetryfilter.model.MetricBatch;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;


/**
 * The outcome of filtering one batch. A cancelled result carries the original, unfiltered batch.
 */
public final class FilterResult {
  private final MetricBatch _batch;
  private final BatchCancelledException _cancellation;
  private final Map<String, Integer> _stageHits;
  private final int _includedResourceCount;

  private FilterResult(MetricBatch batch, BatchCancelledException cancellation, Map<String, Integer> stageHits,
                       int includedResourceCount) {
    _batch = batch;
    _cancellation = cancellation;
    _stageHits = Collections.unmodifiableMap(new TreeMap<>(stageHits));
    _includedResourceCount = includedResourceCount;
  }

  static FilterResult filtered(MetricBatch batch, Map<String, Integer> stageHits, int includedResourceCount) {
    return new FilterResult(batch, null, stageHits, includedResourceCount);
  }

  static FilterResult cancelled(MetricBatch original, BatchCancelledException cancellation) {
    return new FilterResult(original, cancellation, Collections.emptyMap(), original.resourceCount());
  }

  /**
   * @return The filtered batch including the summary resource, or the original batch if filtering was cancelled.
   */
  public MetricBatch batch() {
    return _batch;
  }

  public boolean isCancelled() {
    return _cancellation != null;
  }

  /**
   * @return The reason filtering was cancelled, or {@code null} if it completed.
   */
  public BatchCancelledException cancellation() {
    return _cancellation;
  }

  /**
   * @return Number of included resources by filter stage label.
   */
  public Map<String, Integer> stageHits() {
    return _stageHits;
  }

  /**
   * @return Number of included input resources, not counting the summary resource.
   */
  public int includedResourceCount() {
    return _includedResourceCount;
  }

  @Override
  public String toString() {
    return String.format("{resources=%d, included=%d, cancelled=%s, stageHits=%s}", _batch.resourceCount(),
                         _includedResourceCount, isCancelled(), _stageHits);
  }
}
