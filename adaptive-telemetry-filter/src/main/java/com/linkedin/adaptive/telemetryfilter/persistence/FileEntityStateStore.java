/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import com.google.gson.JsonParseException;
import com.linkedin.adaptive.telemetryfilter.exception.InvalidStoragePathException;
import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import com.linkedin.telemetryfilter.common.utils.Utils;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.apache.commons.io.FileUtils.readFileToString;
import static org.apache.commons.io.FileUtils.writeStringToFile;


/**
 * Persists tracked entities to a single JSON file. The storage path is validated by a {@link StoragePathValidator}
 * before every read and write. A path that fails validation permanently disables the store for this instance.
 *
 * On POSIX file systems, created directories are only accessible by the owner (0700) and the file is only readable
 * and writable by the owner (0600). Each snapshot is written to a temporary file next to the target and then moved
 * over it.
 */
public class FileEntityStateStore implements EntityStateStore {
  private static final Logger LOG = LoggerFactory.getLogger(FileEntityStateStore.class);
  static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
  static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
  static final String TEMP_FILE_SUFFIX = ".tmp";
  private final String _storagePath;
  private final StoragePathValidator _validator;
  private final EntityStateSerde _serde;
  private volatile boolean _enabled;

  public FileEntityStateStore(String storagePath, StoragePathValidator validator, EntityStateSerde serde) {
    _storagePath = Utils.validateNotNull(storagePath, "Storage path cannot be null");
    _validator = Utils.validateNotNull(validator, "Validator cannot be null");
    _serde = Utils.validateNotNull(serde, "Serde cannot be null");
    _enabled = true;
  }

  @Override
  public synchronized Map<String, TrackedEntity> load() {
    Path path = validatedPath();
    if (path == null) {
      return Collections.emptyMap();
    }
    try {
      Map<String, TrackedEntity> entities = _serde.deserialize(readFileToString(path.toFile(), StandardCharsets.UTF_8));
      LOG.info("Loaded {} tracked entities from {}.", entities.size(), path);
      return entities;
    } catch (FileNotFoundException | NoSuchFileException fnfe) {
      LOG.info("No tracked entity state found at {}, starting from an empty state.", path);
    } catch (IOException | JsonParseException e) {
      LOG.error("Failed to load tracked entities from {}, starting from an empty state.", path, e);
    }
    return Collections.emptyMap();
  }

  @Override
  public synchronized boolean save(Map<String, TrackedEntity> entities) {
    Path path = validatedPath();
    if (path == null) {
      return false;
    }
    Path tempPath = path.resolveSibling(path.getFileName() + TEMP_FILE_SUFFIX);
    try {
      createDirectories(path.getParent());
      Files.deleteIfExists(tempPath);
      createFile(tempPath);
      writeStringToFile(tempPath.toFile(), _serde.serialize(entities), StandardCharsets.UTF_8);
      moveReplacing(tempPath, path);
      LOG.debug("Persisted {} tracked entities to {}.", entities.size(), path);
      return true;
    } catch (IOException e) {
      LOG.error("Failed to persist tracked entities to {}.", path, e);
      try {
        Files.deleteIfExists(tempPath);
      } catch (IOException ioe) {
        LOG.warn("Failed to delete temporary file {}.", tempPath, ioe);
      }
      return false;
    }
  }

  /**
   * @return The validated storage path, or {@code null} if the store is disabled.
   */
  private Path validatedPath() {
    if (!_enabled) {
      return null;
    }
    try {
      return _validator.validate(_storagePath);
    } catch (InvalidStoragePathException e) {
      _enabled = false;
      LOG.error("Disabling tracked entity persistence: {}", e.getMessage(), e);
      return null;
    }
  }

  private static boolean isPosix(Path path) {
    return path.getFileSystem().supportedFileAttributeViews().contains("posix");
  }

  private static void createDirectories(Path directory) throws IOException {
    if (directory == null || Files.isDirectory(directory)) {
      return;
    }
    if (isPosix(directory)) {
      FileAttribute<Set<PosixFilePermission>> attribute = PosixFilePermissions.asFileAttribute(DIRECTORY_PERMISSIONS);
      Files.createDirectories(directory, attribute);
    } else {
      Files.createDirectories(directory);
    }
  }

  private static void createFile(Path file) throws IOException {
    if (isPosix(file)) {
      Files.createFile(file, PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS));
      // The umask may have narrowed the requested permissions but never widened them.
      Files.setPosixFilePermissions(file, FILE_PERMISSIONS);
    } else {
      try {
        Files.createFile(file);
      } catch (FileAlreadyExistsException e) {
        LOG.debug("Temporary file {} already exists.", file);
      }
    }
  }

  private static void moveReplacing(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  @Override
  public boolean isEnabled() {
    return _enabled;
  }

  @Override
  public synchronized void close() {
    _enabled = false;
  }
}
