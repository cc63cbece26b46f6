/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import com.linkedin.adaptive.telemetryfilter.exception.InvalidStoragePathException;
import com.linkedin.telemetryfilter.common.utils.Utils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;


/**
 * Confines the tracked state file to one fixed base directory. A storage path is accepted only if it
 * <ul>
 *   <li>is absolute,</li>
 *   <li>after normalization, is located strictly inside the base directory, and</li>
 *   <li>has no existing component between the base directory and the file itself that is redirected, see
 *   {@link PathRedirectionCheck}.</li>
 * </ul>
 * Components that do not exist yet are accepted; they are created as plain directories before the first write.
 */
public class StoragePathValidator {
  static final String POSIX_BASE_DIRECTORY = "/var/lib/adaptive-telemetry-filter";
  static final String WINDOWS_BASE_DIRECTORY = "C:\\ProgramData\\adaptive-telemetry-filter";
  private final Path _baseDirectory;
  private final PathRedirectionCheck _redirectionCheck;

  /**
   * Validator for the base directory and redirection check of the current platform.
   */
  public StoragePathValidator() {
    this(platformBaseDirectory(), PathRedirectionCheck.forCurrentPlatform());
  }

  public StoragePathValidator(Path baseDirectory, PathRedirectionCheck redirectionCheck) {
    Utils.validateNotNull(baseDirectory, "Base directory cannot be null");
    if (!baseDirectory.isAbsolute()) {
      throw new IllegalArgumentException("Base directory " + baseDirectory + " must be absolute.");
    }
    _baseDirectory = baseDirectory.normalize();
    _redirectionCheck = Utils.validateNotNull(redirectionCheck, "Redirection check cannot be null");
  }

  /**
   * @return The directory the tracked state file must be located in on the current platform.
   */
  public static Path platformBaseDirectory() {
    return Paths.get(isWindows() ? WINDOWS_BASE_DIRECTORY : POSIX_BASE_DIRECTORY);
  }

  static boolean isWindows() {
    return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
  }

  public Path baseDirectory() {
    return _baseDirectory;
  }

  /**
   * @param storagePath The configured storage path.
   * @return The normalized storage path.
   * @throws InvalidStoragePathException If the path is empty, relative, outside of the base directory, or passes
   * through a redirected component.
   */
  public Path validate(String storagePath) throws InvalidStoragePathException {
    if (storagePath == null || storagePath.trim().isEmpty()) {
      throw new InvalidStoragePathException("Storage path cannot be empty.");
    }
    Path path;
    try {
      path = Paths.get(storagePath);
    } catch (InvalidPathException e) {
      throw new InvalidStoragePathException(String.format("Storage path %s is not a valid path.", storagePath), e);
    }
    if (!path.isAbsolute()) {
      throw new InvalidStoragePathException(String.format("Storage path %s must be an absolute path.", storagePath));
    }
    Path normalized = path.normalize();
    if (!normalized.startsWith(_baseDirectory) || normalized.equals(_baseDirectory)) {
      throw new InvalidStoragePathException(String.format("Storage path %s must be under %s.", storagePath, _baseDirectory));
    }
    checkRedirections(normalized);
    return normalized;
  }

  private void checkRedirections(Path normalized) throws InvalidStoragePathException {
    Path relative = _baseDirectory.relativize(normalized);
    Path current = _baseDirectory;
    for (Path name : relative) {
      current = current.resolve(name);
      if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
        // Nothing below a missing component can exist either.
        return;
      }
      try {
        if (_redirectionCheck.isRedirected(current)) {
          throw new InvalidStoragePathException(String.format("Storage path component %s is a symlink or junction.",
                                                              current));
        }
      } catch (IOException e) {
        throw new InvalidStoragePathException(String.format("Failed to inspect storage path component %s.", current), e);
      }
    }
  }
}
