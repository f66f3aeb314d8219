/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.detection.anomaly.AnomalyDetails;
import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.anomaly.Severity;
import com.linkedin.sentinel.detection.baseline.Baseline;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Reports values outside {@code [Q1 - m * IQR, Q3 + m * IQR]} (Tukey fences). The quartiles ignore the magnitude of
 * the tails, so a few extreme samples in the window do not widen the fences.
 *
 * <ul>
 *   <li>Severity: beyond the extreme fence ({@code Q3 + 3 * IQR} or {@code Q1 - 3 * IQR}) is
 *   {@link Severity#CRITICAL}, beyond 1.5 times the upper fence (or the lower fence minus half its magnitude) is
 *   {@link Severity#HIGH}, anything else {@link Severity#MEDIUM}.</li>
 *   <li>Confidence: {@code 0.7 + 0.1 * distance / IQR}, bounded to [0.7, 0.99]. A window without spread (IQR = 0)
 *   still reports values outside [Q1, Q3], with confidence 0.99.</li>
 * </ul>
 */
public class IqrDetector extends AbstractDetector {
  static final double EXTREME_MULTIPLIER = 3.0;
  private final double _multiplier;

  public IqrDetector(IqrDetectorConfig config, BaselineManager baselineManager) {
    super(DetectorKind.IQR, baselineManager);
    _multiplier = config.multiplier();
  }

  @Override
  protected AnomalyEvent detectAnomaly(TelemetryEvent event, Baseline baseline) {
    double value = event.value();
    double iqr = baseline.iqr();
    double lowerBound = baseline.q1() - _multiplier * iqr;
    double upperBound = baseline.q3() + _multiplier * iqr;
    boolean above = value > upperBound;
    if (!above && value >= lowerBound) {
      return null;
    }

    double distance = above ? value - upperBound : lowerBound - value;
    double deviation = iqr == 0.0 ? distance : distance / iqr;
    Map<String, Double> additional = new LinkedHashMap<>();
    additional.put("q1", baseline.q1());
    additional.put("q3", baseline.q3());
    additional.put("iqr", iqr);
    additional.put("lower_bound", lowerBound);
    additional.put("upper_bound", upperBound);
    AnomalyDetails details = new AnomalyDetails(baseline.median(), above ? upperBound : lowerBound, deviation, additional);
    return anomalyBuilder(event, baseline)
        .severity(severityFor(value, baseline, lowerBound, upperBound))
        .confidence(confidenceFor(distance, iqr))
        .details(details)
        .rootCause(String.format("%s %.2f is %s the IQR bounds [%.2f, %.2f] (median: %.2f, IQR: %.2f)", event.metric(),
                                 value, above ? "above" : "below", lowerBound, upperBound, baseline.median(), iqr))
        .build();
  }

  static Severity severityFor(double value, Baseline baseline, double lowerBound, double upperBound) {
    double extremeUpper = baseline.q3() + EXTREME_MULTIPLIER * baseline.iqr();
    double extremeLower = baseline.q1() - EXTREME_MULTIPLIER * baseline.iqr();
    if (value > extremeUpper || value < extremeLower) {
      return Severity.CRITICAL;
    }
    if (value > upperBound * 1.5 || value < lowerBound - 0.5 * Math.abs(lowerBound)) {
      return Severity.HIGH;
    }
    return Severity.MEDIUM;
  }

  static double confidenceFor(double distance, double iqr) {
    if (iqr == 0.0) {
      return AnomalyEvent.MAX_CONFIDENCE;
    }
    return Utils.clamp(0.7 + 0.1 * distance / iqr, 0.7, AnomalyEvent.MAX_CONFIDENCE);
  }

  public double multiplier() {
    return _multiplier;
  }
}
