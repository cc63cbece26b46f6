/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.telemetryfilter.exception;

public class TelemetryFilterException extends Exception {

  public TelemetryFilterException(String message, Throwable cause) {
    super(message, cause);
  }

  public TelemetryFilterException(String message) {
    super(message);
  }

  public TelemetryFilterException(Throwable cause) {
    super(cause);
  }
}
