/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.google.gson.reflect.TypeToken;
import com.linkedin.adaptive.telemetryfilter.tracker.MetricHistory;
import com.linkedin.adaptive.telemetryfilter.tracker.TrackedEntity;
import java.lang.reflect.Type;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;


/**
 * Maps tracked entities to and from the persisted JSON document, a map from resource identity to entity state.
 * Timestamps are persisted as ISO-8601 instants with millisecond precision, or {@code null} for "never".
 */
public class EntityStateSerde {
  private static final Type STATE_TYPE = new TypeToken<Map<String, EntityState>>() { }.getType();
  private final Gson _gson;
  private final int _historyCapacity;

  /**
   * @param historyCapacity Capacity of the restored metric histories. Only the newest values are restored.
   */
  public EntityStateSerde(int historyCapacity) {
    if (historyCapacity <= 0) {
      throw new IllegalArgumentException("History capacity must be positive, got " + historyCapacity);
    }
    _historyCapacity = historyCapacity;
    _gson = new GsonBuilder().setPrettyPrinting().serializeNulls().serializeSpecialFloatingPointValues().create();
  }

  /**
   * @param entities Tracked entities by identity.
   * @return The JSON document, sorted by identity.
   */
  public String serialize(Map<String, TrackedEntity> entities) {
    Map<String, EntityState> states = new TreeMap<>();
    entities.forEach((identity, entity) -> states.put(identity, EntityState.of(entity)));
    return _gson.toJson(states, STATE_TYPE);
  }

  /**
   * @param json The JSON document.
   * @return Tracked entities by identity.
   * @throws JsonParseException If the document is malformed.
   */
  public Map<String, TrackedEntity> deserialize(String json) {
    Map<String, EntityState> states;
    try {
      states = _gson.fromJson(json, STATE_TYPE);
    } catch (DateTimeParseException e) {
      throw new JsonParseException("Malformed timestamp in tracked entity state.", e);
    }
    if (states == null) {
      return Collections.emptyMap();
    }
    Map<String, TrackedEntity> entities = new HashMap<>(states.size());
    for (Map.Entry<String, EntityState> entry : states.entrySet()) {
      EntityState state = entry.getValue();
      if (state == null) {
        continue;
      }
      String identity = state._identity == null ? entry.getKey() : state._identity;
      entities.put(entry.getKey(), state.toTrackedEntity(identity, _historyCapacity));
    }
    return entities;
  }

  static String toTimestamp(long timeMs) {
    return timeMs <= 0L ? null : Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.MILLIS).toString();
  }

  static long fromTimestamp(String timestamp) {
    return timestamp == null ? 0L : Instant.parse(timestamp).toEpochMilli();
  }

  /**
   * The persisted shape of a {@link TrackedEntity}.
   */
  private static final class EntityState {
    @SerializedName("identity")
    private String _identity;
    @SerializedName("first_seen")
    private String _firstSeen;
    @SerializedName("last_exceeded")
    private String _lastExceeded;
    @SerializedName("last_anomaly_detected")
    private String _lastAnomalyDetected;
    @SerializedName("current_values")
    private Map<String, Double> _currentValues;
    @SerializedName("max_values")
    private Map<String, Double> _maxValues;
    @SerializedName("metric_history")
    private Map<String, List<Double>> _metricHistory;
    @SerializedName("attributes")
    private Map<String, String> _attributes;

    static EntityState of(TrackedEntity entity) {
      EntityState state = new EntityState();
      state._identity = entity.identity();
      state._firstSeen = toTimestamp(entity.firstSeenMs());
      state._lastExceeded = toTimestamp(entity.lastExceededMs());
      state._lastAnomalyDetected = toTimestamp(entity.lastAnomalyDetectedMs());
      state._currentValues = new TreeMap<>(entity.currentValues());
      state._maxValues = new TreeMap<>(entity.maxValues());
      state._metricHistory = new TreeMap<>();
      entity.metricHistory().forEach((metric, history) -> state._metricHistory.put(metric, history.values()));
      state._attributes = new TreeMap<>(entity.attributes());
      return state;
    }

    TrackedEntity toTrackedEntity(String identity, int historyCapacity) {
      Map<String, MetricHistory> histories = new HashMap<>();
      if (_metricHistory != null) {
        _metricHistory.forEach((metric, values) -> {
          List<Double> nonNullValues = new ArrayList<>();
          if (values != null) {
            values.stream().filter(v -> v != null).forEach(nonNullValues::add);
          }
          histories.put(metric, MetricHistory.of(historyCapacity, nonNullValues));
        });
      }
      return TrackedEntity.restore(identity,
                                   fromTimestamp(_firstSeen),
                                   fromTimestamp(_lastExceeded),
                                   fromTimestamp(_lastAnomalyDetected),
                                   _currentValues == null ? Collections.emptyMap() : _currentValues,
                                   _maxValues == null ? Collections.emptyMap() : _maxValues,
                                   histories,
                                   _attributes == null ? Collections.emptyMap() : _attributes);
    }
  }
}
