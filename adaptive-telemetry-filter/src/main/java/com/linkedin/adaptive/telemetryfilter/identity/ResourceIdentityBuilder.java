/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.identity;

import com.linkedin.telemetryfilter.common.utils.Utils;
import com.linkedin.telemetryfilter.model.ResourceMetrics;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;


/**
 * Derives a stable identity for a resource from its attributes, so that the same resource is recognized across
 * batches without an externally supplied key. In order of preference:
 * <ol>
 *   <li>Host metric resources: {@code <kind>[.<discriminator>][@<host.name>]}, e.g. {@code process.4242@web-1},
 *   {@code cpu.0@web-1}, {@code filesystem./home@web-1} or {@code memory@web-1}.</li>
 *   <li>Services: {@code service.instance.id:<id>}, else {@code service:<namespace>/<name>} or
 *   {@code service:<name>}.</li>
 *   <li>Anything else: all attributes as sorted {@code key=value} pairs joined by commas, cut at
 *   {@link #MAX_FALLBACK_IDENTITY_LENGTH} characters, or {@link #EMPTY_RESOURCE_IDENTITY} without attributes.</li>
 * </ol>
 */
public final class ResourceIdentityBuilder {
  public static final int MAX_FALLBACK_IDENTITY_LENGTH = 512;
  public static final String EMPTY_RESOURCE_IDENTITY = "resource:empty";
  static final String UNKNOWN = "unknown";

  private ResourceIdentityBuilder() {

  }

  /**
   * @param resource The resource to identify.
   * @return The identity of the given resource.
   */
  public static String identityOf(ResourceMetrics resource) {
    return identityOf(resource.attributes());
  }

  /**
   * @param attributes Resource attributes.
   * @return The identity of a resource with the given attributes.
   */
  public static String identityOf(Map<String, String> attributes) {
    HostResourceType hostResourceType = HostResourceType.classify(attributes);
    if (hostResourceType != null) {
      return hostIdentity(hostResourceType, attributes);
    }
    String serviceIdentity = serviceIdentity(attributes);
    if (serviceIdentity != null) {
      return serviceIdentity;
    }
    return fallbackIdentity(attributes);
  }

  private static String hostIdentity(HostResourceType type, Map<String, String> attributes) {
    String discriminator;
    switch (type) {
      case CPU:
        discriminator = attributes.get("cpu");
        break;
      case PROCESS:
        discriminator = firstNonEmpty(attributes.get("process.pid"), attributes.get("process.command"), UNKNOWN);
        break;
      case DISK:
      case NETWORK:
      case PAGING:
        discriminator = attributes.get("device");
        break;
      case FILESYSTEM:
        discriminator = firstNonEmpty(attributes.get("mountpoint"), attributes.get("device"), UNKNOWN);
        break;
      default:
        discriminator = null;
        break;
    }
    StringBuilder sb = new StringBuilder(type.prefix());
    if (discriminator != null) {
      sb.append('.').append(discriminator);
    }
    String host = attributes.get("host.name");
    if (host != null && !host.isEmpty()) {
      sb.append('@').append(host);
    }
    return sb.toString();
  }

  private static String serviceIdentity(Map<String, String> attributes) {
    String instanceId = attributes.get("service.instance.id");
    if (instanceId != null) {
      return "service.instance.id:" + instanceId;
    }
    String serviceName = attributes.get("service.name");
    if (serviceName == null) {
      return null;
    }
    String namespace = attributes.get("service.namespace");
    return namespace == null || namespace.isEmpty() ? "service:" + serviceName : "service:" + namespace + "/" + serviceName;
  }

  private static String fallbackIdentity(Map<String, String> attributes) {
    if (attributes.isEmpty()) {
      return EMPTY_RESOURCE_IDENTITY;
    }
    StringJoiner joiner = new StringJoiner(",");
    new TreeMap<>(attributes).forEach((key, value) -> joiner.add(key + "=" + value));
    return Utils.truncate(joiner.toString(), MAX_FALLBACK_IDENTITY_LENGTH);
  }

  private static String firstNonEmpty(String first, String second, String otherwise) {
    if (first != null && !first.isEmpty()) {
      return first;
    }
    if (second != null && !second.isEmpty()) {
      return second;
    }
    return otherwise;
  }
}
