/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.exception;

import com.linkedin.telemetryfilter.exception.TelemetryFilterException;


/**
 * Thrown when a tracked state storage path escapes the allowed base directory or passes through a redirected
 * path component.
 */
public class InvalidStoragePathException extends TelemetryFilterException {

  public InvalidStoragePathException(String message, Throwable cause) {
    super(message, cause);
  }

  public InvalidStoragePathException(String message) {
    super(message);
  }
}
