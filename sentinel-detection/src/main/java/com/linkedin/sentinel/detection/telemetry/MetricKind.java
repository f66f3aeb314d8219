/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.telemetry;

import com.linkedin.sentinel.detection.anomaly.AnomalyType;
import java.util.Collections;
import java.util.List;


/**
 * Well-known LLM request metrics. Each kind carries the range of values considered sane and the anomaly type reported
 * when it misbehaves. Metric names outside this set are accepted as custom metrics.
 */
public enum MetricKind {
  LATENCY_MS("latency_ms", 0.0, 600_000.0, AnomalyType.LATENCY_SPIKE),
  TOTAL_TOKENS("total_tokens", 0.0, 128_000.0, AnomalyType.TOKEN_USAGE_SPIKE),
  COST_USD("cost_usd", 0.0, 100.0, AnomalyType.COST_ANOMALY),
  ERROR_RATE("error_rate", 0.0, 1.0, AnomalyType.ERROR_RATE_INCREASE);

  private static final List<MetricKind> CACHED_VALUES = List.of(values());

  private final String _metricName;
  private final double _minValue;
  private final double _maxValue;
  private final AnomalyType _anomalyType;

  MetricKind(String metricName, double minValue, double maxValue, AnomalyType anomalyType) {
    _metricName = metricName;
    _minValue = minValue;
    _maxValue = maxValue;
    _anomalyType = anomalyType;
  }

  public String metricName() {
    return _metricName;
  }

  public double minValue() {
    return _minValue;
  }

  public double maxValue() {
    return _maxValue;
  }

  public AnomalyType anomalyType() {
    return _anomalyType;
  }

  /**
   * @param value Value to check.
   * @return {@code true} if the value is within [{@link #minValue()}, {@link #maxValue()}].
   */
  public boolean isWithinBounds(double value) {
    return value >= _minValue && value <= _maxValue;
  }

  /**
   * @param metricName Name of a metric.
   * @return The well-known kind with the given name, or {@code null} for a custom metric.
   */
  public static MetricKind forMetricName(String metricName) {
    for (MetricKind kind : CACHED_VALUES) {
      if (kind._metricName.equals(metricName)) {
        return kind;
      }
    }
    return null;
  }

  /**
   * @param metricName Name of a metric.
   * @return The anomaly type reported for the metric, {@link AnomalyType#METRIC_OUTLIER} for a custom metric.
   */
  public static AnomalyType anomalyTypeFor(String metricName) {
    MetricKind kind = forMetricName(metricName);
    return kind == null ? AnomalyType.METRIC_OUTLIER : kind.anomalyType();
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<MetricKind> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return _metricName;
  }
}
