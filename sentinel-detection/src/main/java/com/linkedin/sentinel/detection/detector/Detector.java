/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.exception.DetectorFailureException;
import com.linkedin.sentinel.detection.telemetry.InvalidTelemetryException;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;


/**
 * An algorithm that classifies a telemetry event as anomalous or not against the history of its series.
 * Implementations must be thread-safe, the engine calls them concurrently for different and for the same series.
 */
public interface Detector {

  /**
   * Classify the given event. Detection does not modify any state other than the statistics of the detector.
   *
   * @param event The event to classify.
   * @return The anomaly found on the event, or {@code null} if the event is not anomalous or the series has no valid
   * baseline yet.
   * @throws InvalidTelemetryException if the event is malformed.
   * @throws DetectorFailureException if the detector failed to evaluate the event.
   */
  AnomalyEvent detect(TelemetryEvent event) throws DetectorFailureException;

  /**
   * Learn from the given event. This covers state owned by the detector only, the baseline of the series is updated
   * by its owner.
   *
   * @param event The event to learn from.
   * @throws InvalidTelemetryException if the event is malformed.
   */
  void update(TelemetryEvent event);

  /**
   * Clear the internal state and the statistics of the detector.
   */
  void reset();

  /**
   * Count a failure of this detector observed by its caller, e.g. a detection that ran past its deadline.
   */
  void recordFailure();

  /**
   * Withdraw an anomaly previously returned by {@link #detect(TelemetryEvent)} from the statistics, because the caller
   * did not use it, e.g. it arrived after the detection deadline. The invocation itself stays counted.
   *
   * @param anomaly The anomaly returned by this detector.
   */
  void discardResult(AnomalyEvent anomaly);

  /**
   * @return Name of the detector.
   */
  String name();

  /**
   * @return Algorithm of the detector.
   */
  DetectorKind kind();

  /**
   * @return A snapshot of the statistics of the detector.
   */
  DetectorStats stats();
}
