/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.composite;

/**
 * A composite score together with the threshold it is compared against and the terms that make it up.
 */
public final class CompositeScore {
  private final double _score;
  private final double _threshold;
  private final int _contributingMetrics;
  private final String _trace;

  public CompositeScore(double score, double threshold, int contributingMetrics, String trace) {
    _score = score;
    _threshold = threshold;
    _contributingMetrics = contributingMetrics;
    _trace = trace;
  }

  public double score() {
    return _score;
  }

  public double threshold() {
    return _threshold;
  }

  public int contributingMetrics() {
    return _contributingMetrics;
  }

  /**
   * @return {@code true} if the score reaches the composite threshold.
   */
  public boolean exceedsThreshold() {
    return _contributingMetrics > 0 && _score >= _threshold;
  }

  /**
   * @return The terms of the score, e.g. {@code Score 2.00 = (cpu:20.00/10.00×0.60) + (mem:4.00/2.00×0.40)}.
   */
  public String trace() {
    return _trace;
  }

  @Override
  public String toString() {
    return _trace;
  }
}
