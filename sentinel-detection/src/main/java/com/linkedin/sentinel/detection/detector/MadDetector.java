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
 * Reports values whose modified z-score {@code 0.6745 * (x - median) / MAD} exceeds the configured threshold. Median and
 * MAD are insensitive to heavy tails, which makes this detector the one of choice for noisy, non-normal metrics.
 * A window whose MAD is 0 yields no anomaly.
 */
public class MadDetector extends AbstractDetector {
  private final double _threshold;

  public MadDetector(MadDetectorConfig config, BaselineManager baselineManager) {
    super(DetectorKind.MAD, baselineManager);
    _threshold = config.threshold();
  }

  @Override
  protected AnomalyEvent detectAnomaly(TelemetryEvent event, Baseline baseline) {
    double value = event.value();
    double modifiedZ = StatisticsUtils.modifiedZScore(value, baseline.median(), baseline.mad());
    double absModifiedZ = Math.abs(modifiedZ);
    if (absModifiedZ <= _threshold) {
      return null;
    }
    double bound = baseline.median() + Math.signum(modifiedZ) * _threshold * baseline.mad() / StatisticsUtils.MODIFIED_ZSCORE_FACTOR;
    AnomalyDetails details = new AnomalyDetails(baseline.median(), bound, absModifiedZ,
                                                Map.of("modified_z_score", modifiedZ, "mad", baseline.mad()));
    return anomalyBuilder(event, baseline)
        .severity(severityFor(value, absModifiedZ, baseline))
        .confidence(confidenceFor(absModifiedZ))
        .details(details)
        .rootCause(String.format("%s %.2f deviates significantly from median %.2f (MAD: %.2f, modified z-score: %.2f)",
                                 event.metric(), value, baseline.median(), baseline.mad(), modifiedZ))
        .build();
  }

  Severity severityFor(double value, double absModifiedZ, Baseline baseline) {
    if (absModifiedZ >= 2 * _threshold) {
      return Severity.CRITICAL;
    }
    if (value > baseline.p99() || value < baseline.min()) {
      return Severity.HIGH;
    }
    return Severity.MEDIUM;
  }

  double confidenceFor(double absModifiedZ) {
    return Utils.clamp(1.0 - 0.5 * _threshold / absModifiedZ, 0.5, AnomalyEvent.MAX_CONFIDENCE);
  }

  public double threshold() {
    return _threshold;
  }
}
