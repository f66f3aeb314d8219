/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.anomaly;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * The numbers behind a detection decision.
 */
public final class AnomalyDetails {
  private final double _expectedValue;
  private final double _threshold;
  private final double _deviationScore;
  private final Map<String, Double> _additional;

  /**
   * @param expectedValue The value the detector expected, e.g. the baseline mean or median.
   * @param threshold The bound the observed value crossed.
   * @param deviationScore Detector specific deviation score, e.g. |z| or |modified z|.
   * @param additional Additional named numbers used by the detector.
   */
  public AnomalyDetails(double expectedValue, double threshold, double deviationScore, Map<String, Double> additional) {
    _expectedValue = expectedValue;
    _threshold = threshold;
    _deviationScore = deviationScore;
    _additional = additional == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(additional));
  }

  public AnomalyDetails(double expectedValue, double threshold, double deviationScore) {
    this(expectedValue, threshold, deviationScore, null);
  }

  public double expectedValue() {
    return _expectedValue;
  }

  public double threshold() {
    return _threshold;
  }

  public double deviationScore() {
    return _deviationScore;
  }

  public Map<String, Double> additional() {
    return _additional;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("expectedValue", _expectedValue);
    structure.put("threshold", _threshold);
    structure.put("deviationScore", _deviationScore);
    structure.put("additional", _additional);
    return structure;
  }

  @Override
  public String toString() {
    return String.format("{expected:%.3f, threshold:%.3f, deviation:%.3f, additional:%s}", _expectedValue, _threshold,
                         _deviationScore, _additional);
  }
}
