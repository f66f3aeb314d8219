/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.engine;

import com.linkedin.sentinel.detection.baseline.BaselineManagerStats;
import com.linkedin.sentinel.detection.detector.DetectorStats;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * A snapshot of the statistics of a {@link DetectionEngine}.
 */
public class EngineStats {
  private final long _numEventsProcessed;
  private final long _numAnomaliesDetected;
  private final List<DetectorStats> _detectorStats;
  private final BaselineManagerStats _baselineManagerStats;

  /**
   * @param numEventsProcessed Number of valid events run through detection.
   * @param numAnomaliesDetected Number of reported anomalies.
   * @param detectorStats Statistics of the enabled detectors, in the order they run.
   * @param baselineManagerStats Statistics of the baseline manager.
   */
  public EngineStats(long numEventsProcessed,
                     long numAnomaliesDetected,
                     List<DetectorStats> detectorStats,
                     BaselineManagerStats baselineManagerStats) {
    _numEventsProcessed = numEventsProcessed;
    _numAnomaliesDetected = numAnomaliesDetected;
    _detectorStats = List.copyOf(detectorStats);
    _baselineManagerStats = baselineManagerStats;
  }

  public long numEventsProcessed() {
    return _numEventsProcessed;
  }

  public long numAnomaliesDetected() {
    return _numAnomaliesDetected;
  }

  /**
   * @return Anomalies detected per event processed, 0 if no event was processed.
   */
  public double detectionRate() {
    return _numEventsProcessed == 0 ? 0.0 : (double) _numAnomaliesDetected / _numEventsProcessed;
  }

  public List<DetectorStats> detectorStats() {
    return _detectorStats;
  }

  public BaselineManagerStats baselineManagerStats() {
    return _baselineManagerStats;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    List<Map<String, Object>> detectorStats = new ArrayList<>(_detectorStats.size());
    for (DetectorStats stats : _detectorStats) {
      detectorStats.add(stats.getJsonStructure());
    }
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("numEventsProcessed", _numEventsProcessed);
    structure.put("numAnomaliesDetected", _numAnomaliesDetected);
    structure.put("detectionRate", detectionRate());
    structure.put("detectors", detectorStats);
    structure.put("baselines", _baselineManagerStats.getJsonStructure());
    return structure;
  }

  @Override
  public String toString() {
    return String.format("{eventsProcessed:%d, anomaliesDetected:%d, detectionRate:%.4f, detectors:%s, baselines:%s}",
                         _numEventsProcessed, _numAnomaliesDetected, detectionRate(), _detectorStats,
                         _baselineManagerStats);
  }
}
