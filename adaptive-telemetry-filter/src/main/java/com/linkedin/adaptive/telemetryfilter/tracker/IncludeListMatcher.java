/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;


/**
 * Matches processes against the include list by their full executable path.
 *
 * An entry is matched only if it contains a path separator, and only by the exact same path. Entries without a path
 * separator (bare executable names) never match: any user could otherwise get a process included by starting a binary
 * of the same name from an arbitrary directory.
 */
public class IncludeListMatcher {
  public static final String EXECUTABLE_PATH_ATTRIBUTE = "process.executable.path";
  public static final String COMMAND_ATTRIBUTE = "process.command";
  private final Set<String> _executablePaths;

  public IncludeListMatcher(Collection<String> entries) {
    Set<String> executablePaths = new HashSet<>();
    for (String entry : entries) {
      String trimmed = entry.trim();
      if (isFullPath(trimmed)) {
        executablePaths.add(trimmed);
      }
    }
    _executablePaths = Collections.unmodifiableSet(executablePaths);
  }

  /**
   * @param entry An include list entry or executable identity.
   * @return {@code true} if the given string contains a Unix or Windows path separator.
   */
  public static boolean isFullPath(String entry) {
    return entry != null && (entry.indexOf('/') >= 0 || entry.indexOf('\\') >= 0);
  }

  public boolean isEmpty() {
    return _executablePaths.isEmpty();
  }

  /**
   * @param attributes Resource attributes.
   * @return {@code true} if the executable of the process is on the include list.
   */
  public boolean matches(Map<String, String> attributes) {
    if (_executablePaths.isEmpty()) {
      return false;
    }
    String executable = executableOf(attributes);
    return executable != null && _executablePaths.contains(executable);
  }

  /**
   * @param attributes Resource attributes.
   * @return The executable path of the process, from {@code process.executable.path}, else from
   * the first token of {@code process.command} if that is a path. {@code null} if the resource has no executable path.
   */
  static String executableOf(Map<String, String> attributes) {
    String executablePath = attributes.get(EXECUTABLE_PATH_ATTRIBUTE);
    if (executablePath != null && !executablePath.isEmpty()) {
      return executablePath;
    }
    String command = attributes.get(COMMAND_ATTRIBUTE);
    if (command == null) {
      return null;
    }
    String[] tokens = command.trim().split("\\s+", 2);
    return isFullPath(tokens[0]) ? tokens[0] : null;
  }
}
