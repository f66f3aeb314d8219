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
import com.linkedin.sentinel.stats.StatisticsUtils;
import java.util.Map;


/**
 * Reports values whose z-score {@code (x - mean) / stdDev} against the baseline exceeds the configured threshold.
 *
 * <ul>
 *   <li>Severity: |z| &ge; 6 is {@link Severity#CRITICAL}, &ge; 4 is {@link Severity#HIGH}, &ge; 3 is
 *   {@link Severity#MEDIUM}, anything else {@link Severity#LOW} (only reachable with a threshold below 3).</li>
 *   <li>Confidence: {@code 1 - 0.5 * exp(-|z| / 2)}, bounded to [0.5, 0.99].</li>
 * </ul>
 * A baseline with no spread (stdDev = 0) yields z = 0, hence no anomaly.
 */
public class ZScoreDetector extends AbstractDetector {
  static final double CRITICAL_ZSCORE = 6.0;
  static final double HIGH_ZSCORE = 4.0;
  static final double MEDIUM_ZSCORE = 3.0;
  private final double _threshold;

  public ZScoreDetector(ZScoreDetectorConfig config, BaselineManager baselineManager) {
    super(DetectorKind.ZSCORE, baselineManager);
    _threshold = config.threshold();
  }

  @Override
  protected AnomalyEvent detectAnomaly(TelemetryEvent event, Baseline baseline) {
    double value = event.value();
    double z = StatisticsUtils.zScore(value, baseline.mean(), baseline.stdDev());
    double absZ = Math.abs(z);
    if (absZ <= _threshold) {
      return null;
    }
    double bound = baseline.mean() + Math.signum(z) * _threshold * baseline.stdDev();
    AnomalyDetails details = new AnomalyDetails(baseline.mean(), bound, absZ, Map.of("z_score", z, "std_dev", baseline.stdDev()));
    return anomalyBuilder(event, baseline)
        .severity(severityFor(absZ))
        .confidence(confidenceFor(absZ))
        .details(details)
        .rootCause(String.format("%s %.2f is %.2f standard deviations %s baseline %.2f", event.metric(), value, absZ,
                                 z > 0 ? "above" : "below", baseline.mean()))
        .build();
  }

  static Severity severityFor(double absZ) {
    if (absZ >= CRITICAL_ZSCORE) {
      return Severity.CRITICAL;
    } else if (absZ >= HIGH_ZSCORE) {
      return Severity.HIGH;
    } else if (absZ >= MEDIUM_ZSCORE) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  static double confidenceFor(double absZ) {
    return Utils.clamp(1.0 - 0.5 * Math.exp(-absZ / 2.0), 0.5, AnomalyEvent.MAX_CONFIDENCE);
  }

  public double threshold() {
    return _threshold;
  }
}
