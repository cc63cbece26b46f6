/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.exception;

import com.linkedin.telemetryfilter.exception.TelemetryFilterException;


/**
 * Reports that the deadline of a batch expired or the batch was cancelled by its caller before filtering completed.
 */
public class BatchCancelledException extends TelemetryFilterException {

  public BatchCancelledException(String message) {
    super(message);
  }
}
