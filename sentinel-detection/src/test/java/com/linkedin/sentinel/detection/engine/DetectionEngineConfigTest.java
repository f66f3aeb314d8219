/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.engine;

import com.linkedin.sentinel.common.config.ConfigException;
import com.linkedin.sentinel.detection.detector.DetectorKind;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.sentinel.detection.DetectionTestUtils.zScoreOnlyConfigs;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class DetectionEngineConfigTest {

  @Test
  public void testDefaults() {
    DetectionEngineConfig config = new DetectionEngineConfig(Collections.emptyMap(), false);
    assertEquals(List.of(DetectorKind.ZSCORE, DetectorKind.IQR, DetectorKind.CUSUM), config.enabledDetectors());
    assertEquals(1000, config.baselineWindowSize());
    assertTrue(config.continuousLearningEnabled());
    assertEquals(AnomalySelectionPolicy.FIRST_MATCH, config.anomalySelectionPolicy());
    assertEquals(0L, config.detectionTimeoutMs());
    assertEquals(4, config.numDetectionThreads());
  }

  @Test
  public void testDetectorOrder() {
    Map<String, Object> configs = new HashMap<>();
    configs.put(DetectionEngineConfig.DETECTOR_ORDER_CONFIG, "cusum, zscore");
    configs.put(DetectionEngineConfig.MAD_DETECTOR_ENABLED_CONFIG, "true");
    DetectionEngineConfig config = new DetectionEngineConfig(configs, false);
    // Enabled detectors missing from the order run last, in the default order.
    assertEquals(List.of(DetectorKind.CUSUM, DetectorKind.ZSCORE, DetectorKind.IQR, DetectorKind.MAD),
                 config.enabledDetectors());
  }

  @Test
  public void testParsedValues() {
    Map<String, Object> configs = zScoreOnlyConfigs();
    configs.put(DetectionEngineConfig.BASELINE_WINDOW_SIZE_CONFIG, "50");
    configs.put(DetectionEngineConfig.CONTINUOUS_LEARNING_ENABLED_CONFIG, false);
    configs.put(DetectionEngineConfig.ANOMALY_SELECTION_POLICY_CONFIG, "highest_severity");
    configs.put(DetectionEngineConfig.DETECTION_TIMEOUT_MS_CONFIG, 250);
    DetectionEngineConfig config = new DetectionEngineConfig(configs, false);
    assertEquals(List.of(DetectorKind.ZSCORE), config.enabledDetectors());
    assertEquals(50, config.baselineWindowSize());
    assertFalse(config.continuousLearningEnabled());
    assertEquals(AnomalySelectionPolicy.HIGHEST_SEVERITY, config.anomalySelectionPolicy());
    assertEquals(250L, config.detectionTimeoutMs());
  }

  @Test
  public void testInvalidConfigs() {
    assertInvalid(DetectionEngineConfig.BASELINE_WINDOW_SIZE_CONFIG, 5);
    assertInvalid(DetectionEngineConfig.DETECTOR_ORDER_CONFIG, "zscore,lstm");
    assertInvalid(DetectionEngineConfig.ANOMALY_SELECTION_POLICY_CONFIG, "random");
    assertInvalid(DetectionEngineConfig.DETECTION_TIMEOUT_MS_CONFIG, -1);
    assertInvalid(DetectionEngineConfig.NUM_DETECTION_THREADS_CONFIG, 0);
    assertInvalid(DetectionEngineConfig.CONTINUOUS_LEARNING_ENABLED_CONFIG, "maybe");
  }

  @Test
  public void testAllDetectorsDisabled() {
    Map<String, Object> configs = zScoreOnlyConfigs();
    configs.put(DetectionEngineConfig.ZSCORE_DETECTOR_ENABLED_CONFIG, false);
    assertThrows(ConfigException.class, () -> new DetectionEngineConfig(configs, false));
  }

  private static void assertInvalid(String key, Object value) {
    Map<String, Object> configs = new HashMap<>();
    configs.put(key, value);
    assertThrows(key + "=" + value, ConfigException.class, () -> new DetectionEngineConfig(configs, false));
  }
}
