/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import com.linkedin.adaptive.telemetryfilter.tracker.MetricHistory;
import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;


/**
 * Unit test class for {@link FileEntityStateStore} and {@link EntityStateSerde}.
 */
public class FileEntityStateStoreTest {
  private static final double EPSILON = 1E-9;
  private static final long FIRST_SEEN_MS = 1_700_000_000_123L;
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();
  private Path _base;
  private Path _statePath;
  private FileEntityStateStore _store;

  @Before
  public void setUp() throws IOException {
    _base = _folder.newFolder("base").toPath();
    _statePath = _base.resolve("state").resolve("adaptive-telemetry-state.json");
    _store = newStore();
  }

  private FileEntityStateStore newStore() {
    return new FileEntityStateStore(_statePath.toString(), new StoragePathValidator(_base, new PosixPathRedirectionCheck()),
                                    new EntityStateSerde(10));
  }

  private static TrackedEntity entity() {
    return TrackedEntity.restore("process.42@host-1", FIRST_SEEN_MS, FIRST_SEEN_MS + 1000L, 0L,
                                 Map.of("cpu", 12.5, "memory", 300.0),
                                 Map.of("cpu", 40.0, "memory", 300.0),
                                 Map.of("cpu", MetricHistory.of(10, Arrays.asList(1.0, 2.5, 12.5))),
                                 Map.of("host.name", "host-1", "process.pid", "42"));
  }

  @Test
  public void testRoundTrip() {
    assertTrue(_store.save(Collections.singletonMap("process.42@host-1", entity())));

    Map<String, TrackedEntity> loaded = newStore().load();
    assertEquals(1, loaded.size());
    TrackedEntity restored = loaded.get("process.42@host-1");
    assertEquals("process.42@host-1", restored.identity());
    assertEquals(FIRST_SEEN_MS, restored.firstSeenMs());
    assertEquals(FIRST_SEEN_MS + 1000L, restored.lastExceededMs());
    assertEquals(0L, restored.lastAnomalyDetectedMs());
    assertEquals(12.5, restored.currentValues().get("cpu"), EPSILON);
    assertEquals(40.0, restored.maxValues().get("cpu"), EPSILON);
    assertEquals(Arrays.asList(1.0, 2.5, 12.5), restored.metricHistory().get("cpu").values());
    assertEquals(10, restored.metricHistory().get("cpu").capacity());
    assertEquals("42", restored.attributes().get("process.pid"));
  }

  @Test
  public void testPersistedFormat() throws IOException {
    _store.save(Collections.singletonMap("process.42@host-1", entity()));
    String json = new String(Files.readAllBytes(_statePath), StandardCharsets.UTF_8);
    assertTrue(json, json.contains("\"first_seen\": \"2023-11-14T22:13:20.123Z\""));
    assertTrue(json, json.contains("\"last_anomaly_detected\": null"));
    assertTrue(json, json.contains("\"metric_history\""));
    assertTrue(json, json.contains("\"max_values\""));
    assertFalse(Files.exists(_statePath.resolveSibling(_statePath.getFileName() + FileEntityStateStore.TEMP_FILE_SUFFIX)));
  }

  @Test
  public void testRestrictivePermissions() throws IOException {
    assumeTrue(Files.getFileStore(_base).supportsFileAttributeView("posix"));
    _store.save(Collections.singletonMap("process.42@host-1", entity()));
    assertEquals(FileEntityStateStore.FILE_PERMISSIONS, Files.getPosixFilePermissions(_statePath));
    assertEquals(FileEntityStateStore.DIRECTORY_PERMISSIONS, Files.getPosixFilePermissions(_statePath.getParent()));
  }

  @Test
  public void testMissingOrCorruptStateLoadsEmpty() throws IOException {
    assertTrue(_store.load().isEmpty());
    assertTrue(_store.isEnabled());

    Files.createDirectories(_statePath.getParent());
    Files.write(_statePath, "{not json".getBytes(StandardCharsets.UTF_8));
    assertTrue(_store.load().isEmpty());
    assertTrue(_store.isEnabled());
  }

  @Test
  public void testRedirectedPathDisablesStore() throws IOException {
    Path outside = _folder.newFolder("outside").toPath();
    Files.createSymbolicLink(_statePath.getParent(), outside);

    assertFalse(_store.save(Collections.singletonMap("process.42@host-1", entity())));
    assertFalse(_store.isEnabled());
    assertFalse(Files.exists(outside.resolve(_statePath.getFileName())));

    // Stays disabled once the path is safe again.
    Files.delete(_statePath.getParent());
    assertFalse(_store.save(Collections.singletonMap("process.42@host-1", entity())));
    assertTrue(_store.load().isEmpty());
  }

  @Test
  public void testClosedStoreIgnoresSaves() {
    _store.close();
    assertFalse(_store.isEnabled());
    assertFalse(_store.save(Collections.singletonMap("process.42@host-1", entity())));
    assertFalse(Files.exists(_statePath));
  }

  @Test
  public void testSerdeKeepsNewestHistoryValues() {
    EntityStateSerde serde = new EntityStateSerde(2);
    Map<String, TrackedEntity> entities = serde.deserialize(serde.serialize(Collections.singletonMap("e", entity())));
    assertEquals(Arrays.asList(2.5, 12.5), entities.get("e").metricHistory().get("cpu").values());
    assertTrue(serde.deserialize("null").isEmpty());
  }
}
