/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.config.AbstractConfig;
import com.linkedin.sentinel.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.sentinel.common.config.ConfigDef.Range.greaterThan;


public class MadDetectorConfig extends AbstractConfig {
  /**
   * <code>mad.detector.threshold</code>
   */
  public static final String MAD_DETECTOR_THRESHOLD_CONFIG = "mad.detector.threshold";
  public static final double DEFAULT_MAD_DETECTOR_THRESHOLD = 3.5;
  public static final String MAD_DETECTOR_THRESHOLD_DOC = "The modified z-score above which an observed value is "
      + "reported as an anomaly. The modified z-score uses the median and the median absolute deviation, hence it is "
      + "not skewed by heavy tails.";

  private static final ConfigDef CONFIG = new ConfigDef().define(MAD_DETECTOR_THRESHOLD_CONFIG,
                                                                 ConfigDef.Type.DOUBLE,
                                                                 DEFAULT_MAD_DETECTOR_THRESHOLD,
                                                                 greaterThan(0.0),
                                                                 ConfigDef.Importance.MEDIUM,
                                                                 MAD_DETECTOR_THRESHOLD_DOC);

  public MadDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }

  public double threshold() {
    return getDouble(MAD_DETECTOR_THRESHOLD_CONFIG);
  }
}
