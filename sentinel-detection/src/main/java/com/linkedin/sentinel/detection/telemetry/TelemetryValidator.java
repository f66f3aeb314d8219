/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.telemetry;

/**
 * Checks the input contract of the detection engine: identifiers present, a finite value, a non-negative timestamp and,
 * for well-known metrics, a value within the sane range of the metric.
 */
public final class TelemetryValidator {
  public static final String EVENT_FIELD = "event";
  public static final String SERVICE_FIELD = "service";
  public static final String MODEL_FIELD = "model";
  public static final String METRIC_FIELD = "metric";
  public static final String VALUE_FIELD = "value";
  public static final String TIMESTAMP_FIELD = "timestampMs";

  private TelemetryValidator() {
  }

  /**
   * @param event Event to validate.
   * @throws InvalidTelemetryException naming the first offending field.
   */
  public static void validate(TelemetryEvent event) {
    if (event == null) {
      throw new InvalidTelemetryException(EVENT_FIELD, "event is missing");
    }
    ensureValidString(SERVICE_FIELD, event.service());
    ensureValidString(MODEL_FIELD, event.model());
    ensureValidString(METRIC_FIELD, event.metric());
    if (event.timestampMs() < 0) {
      throw new InvalidTelemetryException(TIMESTAMP_FIELD, "timestamp " + event.timestampMs() + " is negative");
    }
    double value = event.value();
    if (!Double.isFinite(value)) {
      throw new InvalidTelemetryException(VALUE_FIELD, "value " + value + " is not finite");
    }
    MetricKind kind = event.metricKind();
    if (kind != null && !kind.isWithinBounds(value)) {
      throw new InvalidTelemetryException(VALUE_FIELD, String.format("%s value %s is outside [%s, %s]", kind, value,
                                                                     kind.minValue(), kind.maxValue()));
    }
  }

  private static void ensureValidString(String field, String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new InvalidTelemetryException(field, field + " is missing or empty");
    }
  }
}
