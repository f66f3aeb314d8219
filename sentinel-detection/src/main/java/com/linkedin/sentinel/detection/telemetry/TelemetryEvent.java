/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;


/**
 * A single numeric observation of one metric of one (service, model) pair. Instances are immutable. Events are not
 * validated on construction, see {@link TelemetryValidator}.
 */
public final class TelemetryEvent {
  public static final String TRACE_ID_TAG = "trace_id";
  public static final String USER_ID_TAG = "user_id";
  public static final String REGION_TAG = "region";

  private final String _eventId;
  private final long _timestampMs;
  private final String _service;
  private final String _model;
  private final String _metric;
  private final double _value;
  private final Map<String, String> _tags;

  /**
   * Create an event with a random event id and no tags.
   */
  public TelemetryEvent(long timestampMs, String service, String model, String metric, double value) {
    this(UUID.randomUUID().toString(), timestampMs, service, model, metric, value, Collections.emptyMap());
  }

  /**
   * Create an event with a random event id.
   */
  public TelemetryEvent(long timestampMs, String service, String model, String metric, double value, Map<String, String> tags) {
    this(UUID.randomUUID().toString(), timestampMs, service, model, metric, value, tags);
  }

  /**
   * @param eventId Unique id of the event.
   * @param timestampMs Time the observation was made, in epoch milliseconds.
   * @param service Service identifier.
   * @param model Model identifier.
   * @param metric Metric name, see {@link MetricKind} for the well-known ones.
   * @param value Observed value.
   * @param tags Free-form tags, {@code null} means no tags.
   */
  public TelemetryEvent(String eventId,
                        long timestampMs,
                        String service,
                        String model,
                        String metric,
                        double value,
                        Map<String, String> tags) {
    _eventId = eventId;
    _timestampMs = timestampMs;
    _service = service;
    _model = model;
    _metric = metric;
    _value = value;
    _tags = tags == null || tags.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(tags));
  }

  public String eventId() {
    return _eventId;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public String service() {
    return _service;
  }

  public String model() {
    return _model;
  }

  public String metric() {
    return _metric;
  }

  public double value() {
    return _value;
  }

  /**
   * @return Unmodifiable tags of the event.
   */
  public Map<String, String> tags() {
    return _tags;
  }

  /**
   * @param name Tag name.
   * @return The value of the tag, or {@code null} if the event does not carry it.
   */
  public String tag(String name) {
    return _tags.get(name);
  }

  /**
   * @return The well-known kind of the metric, or {@code null} for a custom metric.
   */
  public MetricKind metricKind() {
    return MetricKind.forMetricName(_metric);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TelemetryEvent that = (TelemetryEvent) o;
    return _timestampMs == that._timestampMs && Double.compare(that._value, _value) == 0
           && Objects.equals(_eventId, that._eventId) && Objects.equals(_service, that._service)
           && Objects.equals(_model, that._model) && Objects.equals(_metric, that._metric) && _tags.equals(that._tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_eventId, _timestampMs, _service, _model, _metric, _value, _tags);
  }

  @Override
  public String toString() {
    return String.format("TelemetryEvent{id=%s, timestampMs=%d, service=%s, model=%s, metric=%s, value=%f}",
                         _eventId, _timestampMs, _service, _model, _metric, _value);
  }
}
