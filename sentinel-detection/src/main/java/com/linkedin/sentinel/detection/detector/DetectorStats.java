/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * A snapshot of the statistics of a {@link Detector}.
 */
public class DetectorStats {
  private final String _detectorName;
  private final long _numInvocations;
  private final long _numAnomalies;
  private final long _numErrors;
  private final double _avgConfidence;

  /**
   * @param detectorName Name of the detector.
   * @param numInvocations Number of events the detector evaluated.
   * @param numAnomalies Number of anomalies the detector reported.
   * @param numErrors Number of failed evaluations.
   * @param avgConfidence Average confidence of the reported anomalies, 0 if there is none.
   */
  public DetectorStats(String detectorName, long numInvocations, long numAnomalies, long numErrors, double avgConfidence) {
    _detectorName = detectorName;
    _numInvocations = numInvocations;
    _numAnomalies = numAnomalies;
    _numErrors = numErrors;
    _avgConfidence = avgConfidence;
  }

  public String detectorName() {
    return _detectorName;
  }

  public long numInvocations() {
    return _numInvocations;
  }

  public long numAnomalies() {
    return _numAnomalies;
  }

  public long numErrors() {
    return _numErrors;
  }

  public double avgConfidence() {
    return _avgConfidence;
  }

  /**
   * @return Anomalies per evaluated event, 0 if no event was evaluated.
   */
  public double detectionRate() {
    return _numInvocations == 0 ? 0.0 : (double) _numAnomalies / _numInvocations;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("detector", _detectorName);
    structure.put("numInvocations", _numInvocations);
    structure.put("numAnomalies", _numAnomalies);
    structure.put("numErrors", _numErrors);
    structure.put("detectionRate", detectionRate());
    structure.put("avgConfidence", _avgConfidence);
    return structure;
  }

  @Override
  public String toString() {
    return String.format("{%s: invocations:%d, anomalies:%d, errors:%d, detectionRate:%.4f, avgConfidence:%.3f}",
                         _detectorName, _numInvocations, _numAnomalies, _numErrors, detectionRate(), _avgConfidence);
  }
}
