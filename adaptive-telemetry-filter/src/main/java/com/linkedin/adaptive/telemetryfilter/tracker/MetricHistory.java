/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import java.util.ArrayList;
import java.util.List;


/**
 * A sliding window over the most recent values of one metric of one resource. Once the window is full, adding a
 * value drops the oldest one. Not thread safe.
 */
public class MetricHistory {
  // Circular buffer, _values[_head] is the oldest value.
  private final double[] _values;
  private int _head;
  private int _size;

  /**
   * @param capacity the maximum number of values kept.
   */
  public MetricHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Metric history capacity must be positive, got " + capacity);
    }
    _values = new double[capacity];
    _head = 0;
    _size = 0;
  }

  /**
   * @param capacity the maximum number of values kept.
   * @param values values from the oldest to the newest. Only the newest {@code capacity} values are kept.
   * @return A history holding the given values.
   */
  public static MetricHistory of(int capacity, List<Double> values) {
    MetricHistory history = new MetricHistory(capacity);
    for (double value : values) {
      history.add(value);
    }
    return history;
  }

  /**
   * Append a value, dropping the oldest value if the history is full.
   * @param value the value to append.
   */
  public void add(double value) {
    if (_size == _values.length) {
      _values[_head] = value;
      _head = (_head + 1) % _values.length;
    } else {
      _values[(_head + _size) % _values.length] = value;
      _size++;
    }
  }

  public int size() {
    return _size;
  }

  public int capacity() {
    return _values.length;
  }

  /**
   * @return The mean of the values in the history, 0 if the history is empty.
   */
  public double average() {
    if (_size == 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (int i = 0; i < _size; i++) {
      sum += _values[(_head + i) % _values.length];
    }
    return sum / _size;
  }

  /**
   * @return Values from the oldest to the newest.
   */
  public List<Double> values() {
    List<Double> values = new ArrayList<>(_size);
    for (int i = 0; i < _size; i++) {
      values.add(_values[(_head + i) % _values.length]);
    }
    return values;
  }

  @Override
  public String toString() {
    return values().toString();
  }
}
