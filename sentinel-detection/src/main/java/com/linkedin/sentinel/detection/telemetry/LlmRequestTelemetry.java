/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.telemetry;

import com.linkedin.sentinel.common.utils.Utils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;


/**
 * Telemetry of a single LLM request. A request is not itself a detection input, it decomposes into one
 * {@link TelemetryEvent} per well-known {@link MetricKind}, sharing the timestamp and tags of the request.
 */
public final class LlmRequestTelemetry {
  private final String _requestId;
  private final long _timestampMs;
  private final String _service;
  private final String _model;
  private final String _traceId;
  private final double _latencyMs;
  private final int _promptTokens;
  private final int _completionTokens;
  private final double _costUsd;
  private final List<String> _errors;
  private final Map<String, String> _metadata;

  private LlmRequestTelemetry(Builder builder) {
    _requestId = builder._requestId == null ? UUID.randomUUID().toString() : builder._requestId;
    _timestampMs = builder._timestampMs;
    _service = Utils.validateNotNull(builder._service, "Service cannot be null.");
    _model = Utils.validateNotNull(builder._model, "Model cannot be null.");
    _traceId = builder._traceId;
    _latencyMs = builder._latencyMs;
    _promptTokens = builder._promptTokens;
    _completionTokens = builder._completionTokens;
    _costUsd = builder._costUsd;
    _errors = List.copyOf(builder._errors);
    _metadata = Collections.unmodifiableMap(new HashMap<>(builder._metadata));
  }

  public static Builder builder(String service, String model) {
    return new Builder(service, model);
  }

  public String requestId() {
    return _requestId;
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

  public String traceId() {
    return _traceId;
  }

  public double latencyMs() {
    return _latencyMs;
  }

  public int promptTokens() {
    return _promptTokens;
  }

  public int completionTokens() {
    return _completionTokens;
  }

  public int totalTokens() {
    return _promptTokens + _completionTokens;
  }

  public double costUsd() {
    return _costUsd;
  }

  public List<String> errors() {
    return _errors;
  }

  public boolean hasErrors() {
    return !_errors.isEmpty();
  }

  public Map<String, String> metadata() {
    return _metadata;
  }

  /**
   * The error rate of a single request is 1 if it reported any error, 0 otherwise.
   *
   * @return One event per well-known metric, in {@link MetricKind} order.
   */
  public List<TelemetryEvent> toTelemetryEvents() {
    Map<String, String> tags = new HashMap<>(_metadata);
    if (_traceId != null) {
      tags.put(TelemetryEvent.TRACE_ID_TAG, _traceId);
    }
    return List.of(event(MetricKind.LATENCY_MS, _latencyMs, tags),
                   event(MetricKind.TOTAL_TOKENS, totalTokens(), tags),
                   event(MetricKind.COST_USD, _costUsd, tags),
                   event(MetricKind.ERROR_RATE, hasErrors() ? 1.0 : 0.0, tags));
  }

  private TelemetryEvent event(MetricKind kind, double value, Map<String, String> tags) {
    return new TelemetryEvent(_requestId + "-" + kind.metricName(), _timestampMs, _service, _model, kind.metricName(),
                              value, tags);
  }

  /**
   * Builder of {@link LlmRequestTelemetry}.
   */
  public static final class Builder {
    private final String _service;
    private final String _model;
    private String _requestId;
    private long _timestampMs = System.currentTimeMillis();
    private String _traceId;
    private double _latencyMs;
    private int _promptTokens;
    private int _completionTokens;
    private double _costUsd;
    private final List<String> _errors = new ArrayList<>();
    private final Map<String, String> _metadata = new HashMap<>();

    private Builder(String service, String model) {
      _service = service;
      _model = model;
    }

    public Builder requestId(String requestId) {
      _requestId = requestId;
      return this;
    }

    public Builder timestampMs(long timestampMs) {
      _timestampMs = timestampMs;
      return this;
    }

    public Builder traceId(String traceId) {
      _traceId = traceId;
      return this;
    }

    public Builder latencyMs(double latencyMs) {
      _latencyMs = latencyMs;
      return this;
    }

    public Builder tokens(int promptTokens, int completionTokens) {
      _promptTokens = promptTokens;
      _completionTokens = completionTokens;
      return this;
    }

    public Builder costUsd(double costUsd) {
      _costUsd = costUsd;
      return this;
    }

    public Builder error(String error) {
      _errors.add(Utils.validateNotNull(error, "Error cannot be null."));
      return this;
    }

    public Builder metadata(String key, String value) {
      _metadata.put(key, value);
      return this;
    }

    public LlmRequestTelemetry build() {
      return new LlmRequestTelemetry(this);
    }
  }
}
