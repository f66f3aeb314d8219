/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.baseline;

import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.detection.telemetry.MetricKind;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import java.util.Objects;


/**
 * Identity of a metric series: (service, model, metric). All per-metric state is partitioned by this key.
 */
public final class BaselineKey {
  private final String _service;
  private final String _model;
  private final String _metric;

  public BaselineKey(String service, String model, String metric) {
    _service = Utils.validateNotNull(service, "Service cannot be null.");
    _model = Utils.validateNotNull(model, "Model cannot be null.");
    _metric = Utils.validateNotNull(metric, "Metric cannot be null.");
  }

  /**
   * @param event Telemetry event.
   * @return The key of the series the event belongs to.
   */
  public static BaselineKey of(TelemetryEvent event) {
    return new BaselineKey(event.service(), event.model(), event.metric());
  }

  public static BaselineKey latency(String service, String model) {
    return new BaselineKey(service, model, MetricKind.LATENCY_MS.metricName());
  }

  public static BaselineKey tokens(String service, String model) {
    return new BaselineKey(service, model, MetricKind.TOTAL_TOKENS.metricName());
  }

  public static BaselineKey cost(String service, String model) {
    return new BaselineKey(service, model, MetricKind.COST_USD.metricName());
  }

  public static BaselineKey errorRate(String service, String model) {
    return new BaselineKey(service, model, MetricKind.ERROR_RATE.metricName());
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

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BaselineKey that = (BaselineKey) o;
    return _service.equals(that._service) && _model.equals(that._model) && _metric.equals(that._metric);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_service, _model, _metric);
  }

  @Override
  public String toString() {
    return _service + "/" + _model + "/" + _metric;
  }
}
