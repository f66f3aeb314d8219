/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.engine;

import com.linkedin.sentinel.common.config.AbstractConfig;
import com.linkedin.sentinel.common.config.ConfigDef;
import com.linkedin.sentinel.common.config.ConfigException;
import com.linkedin.sentinel.detection.baseline.Baseline;
import com.linkedin.sentinel.detection.detector.DetectorKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.sentinel.common.config.ConfigDef.Range.atLeast;


/**
 * The configuration of the {@link DetectionEngine}. The options of the individual detectors are read from the same
 * properties by the config class of each detector.
 */
public class DetectionEngineConfig extends AbstractConfig {

  /**
   * <code>zscore.detector.enabled</code>
   */
  public static final String ZSCORE_DETECTOR_ENABLED_CONFIG = "zscore.detector.enabled";
  public static final boolean DEFAULT_ZSCORE_DETECTOR_ENABLED = true;
  public static final String ZSCORE_DETECTOR_ENABLED_DOC = "True if the z-score detector takes part in detection.";

  /**
   * <code>iqr.detector.enabled</code>
   */
  public static final String IQR_DETECTOR_ENABLED_CONFIG = "iqr.detector.enabled";
  public static final boolean DEFAULT_IQR_DETECTOR_ENABLED = true;
  public static final String IQR_DETECTOR_ENABLED_DOC = "True if the interquartile range detector takes part in detection.";

  /**
   * <code>mad.detector.enabled</code>
   */
  public static final String MAD_DETECTOR_ENABLED_CONFIG = "mad.detector.enabled";
  public static final boolean DEFAULT_MAD_DETECTOR_ENABLED = false;
  public static final String MAD_DETECTOR_ENABLED_DOC = "True if the median absolute deviation detector takes part in "
      + "detection.";

  /**
   * <code>cusum.detector.enabled</code>
   */
  public static final String CUSUM_DETECTOR_ENABLED_CONFIG = "cusum.detector.enabled";
  public static final boolean DEFAULT_CUSUM_DETECTOR_ENABLED = true;
  public static final String CUSUM_DETECTOR_ENABLED_DOC = "True if the cumulative sum drift detector takes part in "
      + "detection.";

  /**
   * <code>detector.order</code>
   */
  public static final String DETECTOR_ORDER_CONFIG = "detector.order";
  public static final String DEFAULT_DETECTOR_ORDER = "zscore,iqr,mad,cusum";
  public static final String DETECTOR_ORDER_DOC = "The order in which the enabled detectors run on an event. Enabled "
      + "detectors missing from this list run after the listed ones, in the default order.";

  /**
   * <code>baseline.window.size</code>
   */
  public static final String BASELINE_WINDOW_SIZE_CONFIG = "baseline.window.size";
  public static final int DEFAULT_BASELINE_WINDOW_SIZE = 1000;
  public static final String BASELINE_WINDOW_SIZE_DOC = "The number of most recent samples of each series the "
      + "baseline of the series is computed from. It cannot be smaller than the number of samples a baseline needs "
      + "to be valid.";

  /**
   * <code>continuous.learning.enabled</code>
   */
  public static final String CONTINUOUS_LEARNING_ENABLED_CONFIG = "continuous.learning.enabled";
  public static final boolean DEFAULT_CONTINUOUS_LEARNING_ENABLED = true;
  public static final String CONTINUOUS_LEARNING_ENABLED_DOC = "True if processed events keep updating the baselines "
      + "and the detector state. If false, the baselines only change through explicit training.";

  /**
   * <code>anomaly.selection.policy</code>
   */
  public static final String ANOMALY_SELECTION_POLICY_CONFIG = "anomaly.selection.policy";
  public static final String DEFAULT_ANOMALY_SELECTION_POLICY = AnomalySelectionPolicy.FIRST_MATCH.policyName();
  public static final String ANOMALY_SELECTION_POLICY_DOC = "The anomaly reported when several detectors fire on "
      + "the same event: first_match reports the first detector to fire in detector order, highest_severity runs all "
      + "detectors and reports the most severe anomaly.";

  /**
   * <code>detection.timeout.ms</code>
   */
  public static final String DETECTION_TIMEOUT_MS_CONFIG = "detection.timeout.ms";
  public static final long DEFAULT_DETECTION_TIMEOUT_MS = 0L;
  public static final String DETECTION_TIMEOUT_MS_DOC = "The time budget of a detection call in milliseconds. A "
      + "detector still running when the budget is spent is skipped and counted as failed. 0 disables the deadline.";

  /**
   * <code>num.detection.threads</code>
   */
  public static final String NUM_DETECTION_THREADS_CONFIG = "num.detection.threads";
  public static final int DEFAULT_NUM_DETECTION_THREADS = 4;
  public static final String NUM_DETECTION_THREADS_DOC = "The number of threads running detectors under a deadline, "
      + "and the number of threads processing event batches.";

  private static final ConfigDef CONFIG = new ConfigDef()
      .define(ZSCORE_DETECTOR_ENABLED_CONFIG,
              ConfigDef.Type.BOOLEAN,
              DEFAULT_ZSCORE_DETECTOR_ENABLED,
              ConfigDef.Importance.HIGH,
              ZSCORE_DETECTOR_ENABLED_DOC)
      .define(IQR_DETECTOR_ENABLED_CONFIG,
              ConfigDef.Type.BOOLEAN,
              DEFAULT_IQR_DETECTOR_ENABLED,
              ConfigDef.Importance.HIGH,
              IQR_DETECTOR_ENABLED_DOC)
      .define(MAD_DETECTOR_ENABLED_CONFIG,
              ConfigDef.Type.BOOLEAN,
              DEFAULT_MAD_DETECTOR_ENABLED,
              ConfigDef.Importance.HIGH,
              MAD_DETECTOR_ENABLED_DOC)
      .define(CUSUM_DETECTOR_ENABLED_CONFIG,
              ConfigDef.Type.BOOLEAN,
              DEFAULT_CUSUM_DETECTOR_ENABLED,
              ConfigDef.Importance.HIGH,
              CUSUM_DETECTOR_ENABLED_DOC)
      .define(DETECTOR_ORDER_CONFIG,
              ConfigDef.Type.LIST,
              DEFAULT_DETECTOR_ORDER,
              ConfigDef.ValidList.in("zscore", "iqr", "mad", "cusum"),
              ConfigDef.Importance.MEDIUM,
              DETECTOR_ORDER_DOC)
      .define(BASELINE_WINDOW_SIZE_CONFIG,
              ConfigDef.Type.INT,
              DEFAULT_BASELINE_WINDOW_SIZE,
              atLeast(Baseline.MIN_SAMPLES),
              ConfigDef.Importance.HIGH,
              BASELINE_WINDOW_SIZE_DOC)
      .define(CONTINUOUS_LEARNING_ENABLED_CONFIG,
              ConfigDef.Type.BOOLEAN,
              DEFAULT_CONTINUOUS_LEARNING_ENABLED,
              ConfigDef.Importance.MEDIUM,
              CONTINUOUS_LEARNING_ENABLED_DOC)
      .define(ANOMALY_SELECTION_POLICY_CONFIG,
              ConfigDef.Type.STRING,
              DEFAULT_ANOMALY_SELECTION_POLICY,
              ConfigDef.ValidString.in("first_match", "highest_severity"),
              ConfigDef.Importance.MEDIUM,
              ANOMALY_SELECTION_POLICY_DOC)
      .define(DETECTION_TIMEOUT_MS_CONFIG,
              ConfigDef.Type.LONG,
              DEFAULT_DETECTION_TIMEOUT_MS,
              atLeast(0),
              ConfigDef.Importance.LOW,
              DETECTION_TIMEOUT_MS_DOC)
      .define(NUM_DETECTION_THREADS_CONFIG,
              ConfigDef.Type.INT,
              DEFAULT_NUM_DETECTION_THREADS,
              atLeast(1),
              ConfigDef.Importance.LOW,
              NUM_DETECTION_THREADS_DOC);

  public DetectionEngineConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public DetectionEngineConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckEnabledDetectors();
  }

  /**
   * Sanity check to ensure that at least one detector is enabled.
   */
  private void sanityCheckEnabledDetectors() {
    if (enabledDetectors().isEmpty()) {
      throw new ConfigException(String.format("At least one detector must be enabled, see %s, %s, %s and %s.",
                                              ZSCORE_DETECTOR_ENABLED_CONFIG, IQR_DETECTOR_ENABLED_CONFIG,
                                              MAD_DETECTOR_ENABLED_CONFIG, CUSUM_DETECTOR_ENABLED_CONFIG));
    }
  }

  /**
   * @return The enabled detectors in the order they run.
   */
  public List<DetectorKind> enabledDetectors() {
    Map<DetectorKind, Boolean> enabled = new EnumMap<>(DetectorKind.class);
    enabled.put(DetectorKind.ZSCORE, getBoolean(ZSCORE_DETECTOR_ENABLED_CONFIG));
    enabled.put(DetectorKind.IQR, getBoolean(IQR_DETECTOR_ENABLED_CONFIG));
    enabled.put(DetectorKind.MAD, getBoolean(MAD_DETECTOR_ENABLED_CONFIG));
    enabled.put(DetectorKind.CUSUM, getBoolean(CUSUM_DETECTOR_ENABLED_CONFIG));

    List<DetectorKind> ordered = new ArrayList<>();
    for (String detectorName : getList(DETECTOR_ORDER_CONFIG)) {
      ordered.add(DetectorKind.forDetectorName(detectorName));
    }
    for (DetectorKind kind : DetectorKind.cachedValues()) {
      if (!ordered.contains(kind)) {
        ordered.add(kind);
      }
    }
    ordered.removeIf(kind -> !enabled.get(kind));
    return Collections.unmodifiableList(ordered);
  }

  public int baselineWindowSize() {
    return getInt(BASELINE_WINDOW_SIZE_CONFIG);
  }

  public boolean continuousLearningEnabled() {
    return getBoolean(CONTINUOUS_LEARNING_ENABLED_CONFIG);
  }

  public AnomalySelectionPolicy anomalySelectionPolicy() {
    return AnomalySelectionPolicy.forPolicyName(getString(ANOMALY_SELECTION_POLICY_CONFIG));
  }

  public long detectionTimeoutMs() {
    return getLong(DETECTION_TIMEOUT_MS_CONFIG);
  }

  public int numDetectionThreads() {
    return getInt(NUM_DETECTION_THREADS_CONFIG);
  }
}
