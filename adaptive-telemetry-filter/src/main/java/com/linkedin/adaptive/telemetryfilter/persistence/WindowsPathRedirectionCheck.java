/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;


/**
 * Redirection check for Windows, where besides symbolic links, junctions and other reparse points redirect a path.
 */
public class WindowsPathRedirectionCheck implements PathRedirectionCheck {
  // FILE_ATTRIBUTE_REPARSE_POINT
  static final int REPARSE_POINT_ATTRIBUTE = 0x400;
  private static final String DOS_ATTRIBUTES = "dos:attributes";

  @Override
  public boolean isRedirected(Path component) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(component, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
    // Junctions are reported neither as symbolic links nor as directories.
    if (attributes.isSymbolicLink() || attributes.isOther()) {
      return true;
    }
    return hasReparsePointAttribute(component);
  }

  private static boolean hasReparsePointAttribute(Path component) throws IOException {
    Object dosAttributes;
    try {
      dosAttributes = Files.getAttribute(component, DOS_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
    } catch (UnsupportedOperationException | IllegalArgumentException e) {
      // The file system has no DOS view, so there are no reparse points either.
      return false;
    }
    return dosAttributes instanceof Integer && (((Integer) dosAttributes) & REPARSE_POINT_ATTRIBUTE) != 0;
  }
}
