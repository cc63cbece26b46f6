/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import java.nio.file.Files;
import java.nio.file.Path;


/**
 * Redirection check for POSIX file systems, where symbolic links are the only redirection.
 */
public class PosixPathRedirectionCheck implements PathRedirectionCheck {

  @Override
  public boolean isRedirected(Path component) {
    return Files.isSymbolicLink(component);
  }
}
