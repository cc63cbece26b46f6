/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import com.linkedin.adaptive.telemetryfilter.composite.CompositeScore;


/**
 * The outcome of evaluating one resource in one batch.
 */
public final class FilterDecision {
  private static final FilterDecision EXCLUDED = new FilterDecision(false, FilterStage.NONE, null, null);
  private static final FilterDecision UNTARGETED = new FilterDecision(true, FilterStage.NONE, null, null);
  private final boolean _included;
  private final FilterStage _stage;
  private final String _detail;
  private final CompositeScore _compositeScore;

  private FilterDecision(boolean included, FilterStage stage, String detail, CompositeScore compositeScore) {
    _included = included;
    _stage = stage;
    _detail = detail;
    _compositeScore = compositeScore;
  }

  public static FilterDecision excluded() {
    return EXCLUDED;
  }

  /**
   * @return Decision for a resource without any metric of interest, which is included without evaluation.
   */
  public static FilterDecision untargeted() {
    return UNTARGETED;
  }

  public static FilterDecision included(FilterStage stage) {
    return new FilterDecision(true, stage, null, null);
  }

  public static FilterDecision included(FilterStage stage, String detail) {
    return new FilterDecision(true, stage, detail, null);
  }

  /**
   * @param compositeScore The composite score that reached the composite threshold.
   * @return Decision of the multi-metric stage.
   */
  public static FilterDecision includedByCompositeScore(CompositeScore compositeScore) {
    return new FilterDecision(true, FilterStage.MULTI_METRIC, compositeScore.trace(), compositeScore);
  }

  public boolean isIncluded() {
    return _included;
  }

  public FilterStage stage() {
    return _stage;
  }

  /**
   * @return Human readable reason of the decision, or {@code null} if there is none.
   */
  public String detail() {
    return _detail;
  }

  /**
   * @return The composite score if the multi-metric stage included the resource, {@code null} otherwise.
   */
  public CompositeScore compositeScore() {
    return _compositeScore;
  }

  /**
   * @return The stage label, followed by the near-miss summary for debug passthrough decisions.
   */
  public String stageLabel() {
    return _stage == FilterStage.DEBUG_NO_MATCH && _detail != null ? _detail : _stage.label();
  }

  @Override
  public String toString() {
    return String.format("{included=%s, stage=%s%s}", _included, stageLabel(),
                         _detail == null || _stage == FilterStage.DEBUG_NO_MATCH ? "" : ", detail=" + _detail);
  }
}
