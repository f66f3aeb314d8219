/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.telemetry;

/**
 * Thrown when a telemetry event is malformed. The failure is scoped to the call that received the event, no stored
 * state is modified.
 */
public class InvalidTelemetryException extends IllegalArgumentException {
  private final String _field;

  public InvalidTelemetryException(String field, String message) {
    super(String.format("Invalid telemetry field '%s': %s", field, message));
    _field = field;
  }

  /**
   * @return Name of the offending field.
   */
  public String field() {
    return _field;
  }
}
