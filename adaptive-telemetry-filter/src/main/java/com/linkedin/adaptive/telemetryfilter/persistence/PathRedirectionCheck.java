/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import java.io.IOException;
import java.nio.file.Path;


/**
 * Decides whether an existing path component redirects somewhere else than where its name suggests, e.g. a symbolic
 * link, or a junction or other reparse point on Windows.
 */
public interface PathRedirectionCheck {

  /**
   * @param component An existing path component.
   * @return {@code true} if the component is redirected.
   * @throws IOException If the attributes of the component cannot be read.
   */
  boolean isRedirected(Path component) throws IOException;

  /**
   * @return The check for the operating system this JVM runs on.
   */
  static PathRedirectionCheck forCurrentPlatform() {
    return StoragePathValidator.isWindows() ? new WindowsPathRedirectionCheck() : new PosixPathRedirectionCheck();
  }
}
