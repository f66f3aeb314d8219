/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.config.AbstractConfig;
import com.linkedin.sentinel.common.config.ConfigDef;
import com.linkedin.sentinel.common.config.ConfigException;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.linkedin.sentinel.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.sentinel.common.config.ConfigDef.Range.greaterThan;


public class CusumDetectorConfig extends AbstractConfig {
  /**
   * <code>cusum.detector.threshold</code>
   */
  public static final String CUSUM_DETECTOR_THRESHOLD_CONFIG = "cusum.detector.threshold";
  public static final double DEFAULT_CUSUM_DETECTOR_THRESHOLD = 5.0;
  public static final String CUSUM_DETECTOR_THRESHOLD_DOC = "The decision interval of the cumulative sum: a drift is "
      + "reported once either the upper or the lower accumulated deviation exceeds this value.";

  /**
   * <code>cusum.detector.slack</code>
   */
  public static final String CUSUM_DETECTOR_SLACK_CONFIG = "cusum.detector.slack";
  public static final double DEFAULT_CUSUM_DETECTOR_SLACK = 0.5;
  public static final String CUSUM_DETECTOR_SLACK_DOC = "The deviation from the baseline mean tolerated per sample "
      + "before it accumulates. Larger values make the detector less sensitive to small shifts.";

  /**
   * <code>cusum.detector.metrics</code>
   */
  public static final String CUSUM_DETECTOR_METRICS_CONFIG = "cusum.detector.metrics";
  public static final String DEFAULT_CUSUM_DETECTOR_METRICS = "cost_usd";
  public static final String CUSUM_DETECTOR_METRICS_DOC = "The metrics whose series the drift detector tracks. Slack and "
      + "threshold are in the units of the metric, so a metric should only be listed if both suit its scale.";

  private static final ConfigDef CONFIG = new ConfigDef().define(CUSUM_DETECTOR_THRESHOLD_CONFIG,
                                                                 ConfigDef.Type.DOUBLE,
                                                                 DEFAULT_CUSUM_DETECTOR_THRESHOLD,
                                                                 greaterThan(0.0),
                                                                 ConfigDef.Importance.MEDIUM,
                                                                 CUSUM_DETECTOR_THRESHOLD_DOC)
                                                         .define(CUSUM_DETECTOR_SLACK_CONFIG,
                                                                 ConfigDef.Type.DOUBLE,
                                                                 DEFAULT_CUSUM_DETECTOR_SLACK,
                                                                 atLeast(0.0),
                                                                 ConfigDef.Importance.MEDIUM,
                                                                 CUSUM_DETECTOR_SLACK_DOC)
                                                         .define(CUSUM_DETECTOR_METRICS_CONFIG,
                                                                 ConfigDef.Type.LIST,
                                                                 DEFAULT_CUSUM_DETECTOR_METRICS,
                                                                 ConfigDef.Importance.MEDIUM,
                                                                 CUSUM_DETECTOR_METRICS_DOC);

  public CusumDetectorConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }

  @Override
  protected Map<String, Object> postProcessParsedConfig(Map<String, Object> parsedValues) {
    List<?> metrics = (List<?>) parsedValues.get(CUSUM_DETECTOR_METRICS_CONFIG);
    if (metrics.isEmpty() || metrics.contains("")) {
      throw new ConfigException(CUSUM_DETECTOR_METRICS_CONFIG, metrics, "Expected a non-empty list of metric names.");
    }
    return Collections.emptyMap();
  }

  public double threshold() {
    return getDouble(CUSUM_DETECTOR_THRESHOLD_CONFIG);
  }

  public double slack() {
    return getDouble(CUSUM_DETECTOR_SLACK_CONFIG);
  }

  /**
   * @return Names of the metrics the drift detector tracks.
   */
  public Set<String> metrics() {
    return Collections.unmodifiableSet(new HashSet<>(getList(CUSUM_DETECTOR_METRICS_CONFIG)));
  }
}
