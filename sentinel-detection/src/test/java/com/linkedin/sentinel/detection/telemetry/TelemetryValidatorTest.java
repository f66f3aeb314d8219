/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.telemetry;

import org.junit.Test;

import static com.linkedin.sentinel.detection.DetectionTestUtils.LATENCY;
import static com.linkedin.sentinel.detection.DetectionTestUtils.MODEL;
import static com.linkedin.sentinel.detection.DetectionTestUtils.QUEUE_DEPTH;
import static com.linkedin.sentinel.detection.DetectionTestUtils.SERVICE;
import static com.linkedin.sentinel.detection.DetectionTestUtils.TIMESTAMP_MS;
import static com.linkedin.sentinel.detection.DetectionTestUtils.event;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

public class TelemetryValidatorTest {

  @Test
  public void testValidEvents() {
    TelemetryValidator.validate(event(LATENCY, 250.0));
    TelemetryValidator.validate(event(MetricKind.ERROR_RATE.metricName(), 1.0));
    // Custom metrics are not bounded.
    TelemetryValidator.validate(event(QUEUE_DEPTH, -1E9));
  }

  @Test
  public void testInvalidFields() {
    assertInvalidField(TelemetryValidator.EVENT_FIELD, null);
    assertInvalidField(TelemetryValidator.SERVICE_FIELD, new TelemetryEvent(TIMESTAMP_MS, null, MODEL, LATENCY, 1.0));
    assertInvalidField(TelemetryValidator.SERVICE_FIELD, new TelemetryEvent(TIMESTAMP_MS, " ", MODEL, LATENCY, 1.0));
    assertInvalidField(TelemetryValidator.MODEL_FIELD, new TelemetryEvent(TIMESTAMP_MS, SERVICE, "", LATENCY, 1.0));
    assertInvalidField(TelemetryValidator.METRIC_FIELD, new TelemetryEvent(TIMESTAMP_MS, SERVICE, MODEL, null, 1.0));
    assertInvalidField(TelemetryValidator.TIMESTAMP_FIELD, new TelemetryEvent(-1L, SERVICE, MODEL, LATENCY, 1.0));
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(LATENCY, Double.NaN));
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(QUEUE_DEPTH, Double.POSITIVE_INFINITY));
  }

  @Test
  public void testWellKnownMetricBounds() {
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(LATENCY, -1.0));
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(LATENCY, 600_001.0));
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(MetricKind.TOTAL_TOKENS.metricName(), 128_001.0));
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(MetricKind.COST_USD.metricName(), 100.5));
    assertInvalidField(TelemetryValidator.VALUE_FIELD, event(MetricKind.ERROR_RATE.metricName(), 1.5));
  }

  @Test
  public void testMetricKindLookup() {
    assertEquals(MetricKind.COST_USD, MetricKind.forMetricName("cost_usd"));
    assertNull(MetricKind.forMetricName(QUEUE_DEPTH));
  }

  private static void assertInvalidField(String expectedField, TelemetryEvent event) {
    InvalidTelemetryException e = assertThrows(InvalidTelemetryException.class, () -> TelemetryValidator.validate(event));
    assertEquals(expectedField, e.field());
  }
}
