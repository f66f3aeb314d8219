/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.config.AbstractConfig;
import com.linkedin.sentinel.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.sentinel.common.config.ConfigDef.Range.greaterThan;


public class ZScoreDetectorConfig extends AbstractConfig {
  /**
   * <code>zscore.detector.threshold</code>
   */
  public static final String ZSCORE_DETECTOR_THRESHOLD_CONFIG = "zscore.detector.threshold";
  public static final double DEFAULT_ZSCORE_DETECTOR_THRESHOLD = 3.0;
  public static final String ZSCORE_DETECTOR_THRESHOLD_DOC = "The number of standard deviations an observed value "
      + "must be away from the baseline mean to be reported as an anomaly. 3.0 covers 99.7% of normally distributed "
      + "values.";

  private static final ConfigDef CONFIG = new ConfigDef().define(ZSCORE_DETECTOR_THRESHOLD_CONFIG,
                                                                 ConfigDef.Type.DOUBLE,
                                                                 DEFAULT_ZSCORE_DETECTOR_THRESHOLD,
                                                                 greaterThan(0.0),
                                                                 ConfigDef.Importance.MEDIUM,
                                                                 ZSCORE_DETECTOR_THRESHOLD_DOC);

  public ZScoreDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }

  public double threshold() {
    return getDouble(ZSCORE_DETECTOR_THRESHOLD_CONFIG);
  }
}
