/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.anomaly;

import java.util.List;


/**
 * The kind of anomaly reported for a metric.
 *
 * <ul>
 *   <li>{@link #LATENCY_SPIKE}: Request latency is unusually high (or low).</li>
 *   <li>{@link #TOKEN_USAGE_SPIKE}: Token consumption per request deviates from its baseline.</li>
 *   <li>{@link #COST_ANOMALY}: Per-request cost deviates from its baseline.</li>
 *   <li>{@link #ERROR_RATE_INCREASE}: Error rate deviates from its baseline.</li>
 *   <li>{@link #DRIFT}: A sustained shift of a metric away from its reference level.</li>
 *   <li>{@link #METRIC_OUTLIER}: An outlier on a custom metric.</li>
 * </ul>
 */
public enum AnomalyType {
  LATENCY_SPIKE("Check service health and resource utilization",
                "Review recent deployments or configuration changes",
                "Check for resource contention or external dependencies"),
  TOKEN_USAGE_SPIKE("Review prompt templates for excessive verbosity",
                    "Check for potential token abuse or prompt injection"),
  COST_ANOMALY("Review API usage patterns for cost optimization",
               "Consider rate limiting or budget alerts"),
  ERROR_RATE_INCREASE("Check the model provider status and error logs",
                      "Review retry and fallback settings of the service"),
  DRIFT("Review recent API usage patterns",
        "Check for model version changes or pricing updates"),
  METRIC_OUTLIER("Review recent changes affecting the metric");

  private final List<String> _remediation;

  AnomalyType(String... remediation) {
    _remediation = List.of(remediation);
  }

  /**
   * @return Suggested remediation steps for an anomaly of this type.
   */
  public List<String> remediation() {
    return _remediation;
  }
}
