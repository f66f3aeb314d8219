/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.config.AbstractConfig;
import com.linkedin.sentinel.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.sentinel.common.config.ConfigDef.Range.greaterThan;


public class IqrDetectorConfig extends AbstractConfig {
  /**
   * <code>iqr.detector.multiplier</code>
   */
  public static final String IQR_DETECTOR_MULTIPLIER_CONFIG = "iqr.detector.multiplier";
  public static final double DEFAULT_IQR_DETECTOR_MULTIPLIER = 1.5;
  public static final String IQR_DETECTOR_MULTIPLIER_DOC = "The multiple of the interquartile range added above the "
      + "third quartile and subtracted below the first quartile to get the bounds of normal values. 1.5 is Tukey's "
      + "rule.";

  private static final ConfigDef CONFIG = new ConfigDef().define(IQR_DETECTOR_MULTIPLIER_CONFIG,
                                                                 ConfigDef.Type.DOUBLE,
                                                                 DEFAULT_IQR_DETECTOR_MULTIPLIER,
                                                                 greaterThan(0.0),
                                                                 ConfigDef.Importance.MEDIUM,
                                                                 IQR_DETECTOR_MULTIPLIER_DOC);

  public IqrDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }

  public double multiplier() {
    return getDouble(IQR_DETECTOR_MULTIPLIER_CONFIG);
  }
}
