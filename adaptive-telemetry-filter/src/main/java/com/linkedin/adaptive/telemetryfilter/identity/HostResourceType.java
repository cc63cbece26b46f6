/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.identity;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Kinds of host metric resources, recognized by the attributes host metric scrapers attach to them.
 */
public enum HostResourceType {
  CPU("cpu"),
  DISK("disk"),
  FILESYSTEM("filesystem"),
  MEMORY("memory"),
  NETWORK("network"),
  PAGING("paging"),
  PROCESS("process"),
  PROCESSES("processes"),
  SYSTEM("system");

  private static final List<HostResourceType> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private static final Set<String> FILESYSTEM_STATES = Set.of("free", "reserved", "used");
  private static final Set<String> MEMORY_STATES = Set.of("buffered", "cached", "inactive", "free", "slab_reclaimable",
                                                          "slab_unreclaimable", "used");
  private static final Set<String> PAGING_STATES = Set.of("cached", "free", "used");
  private static final Set<String> PROCESS_STATUSES = Set.of("blocked", "daemon", "detached", "idle", "locked", "orphan",
                                                             "paging", "running", "sleeping", "stopped", "system",
                                                             "unknown", "zombies");
  private final String _prefix;

  HostResourceType(String prefix) {
    _prefix = prefix;
  }

  /**
   * @return The prefix of identities of this kind of resource.
   */
  public String prefix() {
    return _prefix;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<HostResourceType> cachedValues() {
    return CACHED_VALUES;
  }

  /**
   * The order of checks matters: several kinds share attribute names (e.g. device, state, direction), so the more
   * specific combinations are checked first.
   *
   * @param attributes Resource attributes.
   * @return The kind of host metric resource, or {@code null} if the attributes do not describe a host metric resource.
   */
  public static HostResourceType classify(Map<String, String> attributes) {
    String state = attributes.get("state");
    String direction = attributes.get("direction");
    String type = attributes.get("type");
    boolean hasDevice = attributes.containsKey("device");
    boolean hasProtocol = attributes.containsKey("protocol");

    if (attributes.containsKey("cpu")) {
      return CPU;
    }
    if (hasDevice && ("read".equals(direction) || "write".equals(direction))) {
      return DISK;
    }
    if (attributes.containsKey("mountpoint") || (type != null && oneOf(FILESYSTEM_STATES, state))) {
      return FILESYSTEM;
    }
    if (oneOf(MEMORY_STATES, state) && !hasDevice) {
      return MEMORY;
    }
    if (hasDevice && ("receive".equals(direction) || "transmit".equals(direction) || hasProtocol)) {
      return NETWORK;
    }
    if (hasProtocol && state != null) {
      return NETWORK;
    }
    if ("page_in".equals(direction) || "page_out".equals(direction)
        || (hasDevice && oneOf(PAGING_STATES, state))
        || "major".equals(type) || "minor".equals(type)) {
      return PAGING;
    }
    if (hasDevice && state != null) {
      return NETWORK;
    }
    if (attributes.containsKey("process.pid")) {
      return PROCESS;
    }
    if (oneOf(PROCESS_STATUSES, attributes.get("status"))) {
      return PROCESSES;
    }
    if (hasDevice && direction == null && state == null && type == null && !hasProtocol) {
      return DISK;
    }
    if (attributes.containsKey("host.name")) {
      return SYSTEM;
    }
    return null;
  }

  // Immutable sets reject null lookups.
  private static boolean oneOf(Set<String> values, String value) {
    return value != null && values.contains(value);
  }
}
