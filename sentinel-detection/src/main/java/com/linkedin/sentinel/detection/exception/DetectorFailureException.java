/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.exception;

import com.linkedin.sentinel.exception.SentinelException;


/**
 * Thrown when a detector fails to evaluate an event because of an internal fault. The failure is scoped to the
 * detector and the event, the engine contains it and continues with the other detectors.
 */
public class DetectorFailureException extends SentinelException {
  private final String _detectorName;

  public DetectorFailureException(String detectorName, String message, Throwable cause) {
    super(String.format("Detector %s failed: %s", detectorName, message), cause);
    _detectorName = detectorName;
  }

  public DetectorFailureException(String detectorName, String message) {
    this(detectorName, message, null);
  }

  /**
   * @return Name of the failed detector.
   */
  public String detectorName() {
    return _detectorName;
  }
}
