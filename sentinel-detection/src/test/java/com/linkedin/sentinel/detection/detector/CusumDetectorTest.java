/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.config.ConfigException;
import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.anomaly.AnomalyType;
import com.linkedin.sentinel.detection.anomaly.Severity;
import com.linkedin.sentinel.detection.baseline.BaselineKey;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.exception.DetectorFailureException;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.sentinel.detection.DetectionTestUtils.LATENCY;
import static com.linkedin.sentinel.detection.DetectionTestUtils.LATENCY_KEY;
import static com.linkedin.sentinel.detection.DetectionTestUtils.MODEL;
import static com.linkedin.sentinel.detection.DetectionTestUtils.SERVICE;
import static com.linkedin.sentinel.detection.DetectionTestUtils.event;
import static com.linkedin.sentinel.detection.DetectionTestUtils.latencyEvent;
import static com.linkedin.sentinel.detection.DetectionTestUtils.seed;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

/**
 * Unless stated otherwise, tests track the latency series against a baseline of ten samples of 100 with the default
 * slack 0.5 and decision interval 5.
 */
public class CusumDetectorTest {
  private static final double EPSILON = 1E-6;
  private BaselineManager _baselineManager;
  private CusumDetector _detector;

  @Before
  public void setUp() {
    _baselineManager = new BaselineManager(100);
    _detector = new CusumDetector(latencyConfig(), _baselineManager);
    seed(_baselineManager, LATENCY_KEY, 100, 100, 100, 100, 100, 100, 100, 100, 100, 100);
  }

  private static CusumDetectorConfig latencyConfig() {
    return new CusumDetectorConfig(Collections.singletonMap(CusumDetectorConfig.CUSUM_DETECTOR_METRICS_CONFIG, LATENCY));
  }

  /**
   * Feed the value until the detector reports a drift, learning from each event that is not anomalous.
   *
   * @return The 1-based position of the event the drift was reported on.
   */
  private int feedUntilDrift(double value, AnomalyEvent[] drift) throws DetectorFailureException {
    for (int i = 1; i <= 100; i++) {
      TelemetryEvent event = latencyEvent(value);
      AnomalyEvent anomaly = _detector.detect(event);
      _detector.update(event);
      if (anomaly != null) {
        drift[0] = anomaly;
        return i;
      }
    }
    return -1;
  }

  @Test
  public void testSustainedSmallIncrease() throws DetectorFailureException {
    AnomalyEvent[] drift = new AnomalyEvent[1];
    // Each sample adds 0.8 - 0.5 = 0.3 to the upper sum, which exceeds 5 on the 17th sample.
    assertEquals(17, feedUntilDrift(100.8, drift));
    AnomalyEvent anomaly = drift[0];
    assertEquals(AnomalyType.DRIFT, anomaly.anomalyType());
    assertEquals(DetectorKind.CUSUM, anomaly.detectionMethod());
    assertEquals(Severity.MEDIUM, anomaly.severity());
    assertEquals(0.51, anomaly.confidence(), EPSILON);
    assertEquals(5.1, anomaly.details().deviationScore(), EPSILON);
    assertTrue(anomaly.rootCause(), anomaly.rootCause().contains("increase"));
    // The accumulators restart after a drift.
    assertEquals(CusumDetector.CusumState.ZERO, _detector.state(LATENCY_KEY));
  }

  @Test
  public void testSustainedSmallDecrease() throws DetectorFailureException {
    AnomalyEvent[] drift = new AnomalyEvent[1];
    assertEquals(17, feedUntilDrift(99.2, drift));
    assertEquals(-5.1, drift[0].details().additional().get("cusum_low"), EPSILON);
    assertTrue(drift[0].rootCause(), drift[0].rootCause().contains("decrease"));
  }

  @Test
  public void testDeviationWithinSlackDoesNotAccumulate() throws DetectorFailureException {
    for (int i = 0; i < 50; i++) {
      TelemetryEvent event = latencyEvent(i % 2 == 0 ? 100.4 : 99.6);
      assertNull(_detector.detect(event));
      _detector.update(event);
    }
    assertEquals(0.0, _detector.state(LATENCY_KEY).upper(), EPSILON);
    assertEquals(0.0, _detector.state(LATENCY_KEY).lower(), EPSILON);
    assertEquals(50, _detector.state(LATENCY_KEY).count());
  }

  @Test
  public void testSingleModerateSpike() throws DetectorFailureException {
    TelemetryEvent event = latencyEvent(103);
    assertNull(_detector.detect(event));
    _detector.update(event);
    assertEquals(2.5, _detector.state(LATENCY_KEY).upper(), EPSILON);
    assertEquals(0.0, _detector.state(LATENCY_KEY).lower(), EPSILON);
  }

  @Test
  public void testLargeSpike() throws DetectorFailureException {
    AnomalyEvent anomaly = _detector.detect(latencyEvent(120));
    assertNotNull(anomaly);
    assertEquals(Severity.HIGH, anomaly.severity());
    assertEquals(CusumDetector.MAX_CONFIDENCE, anomaly.confidence(), EPSILON);
  }

  @Test
  public void testDetectDoesNotChangeState() throws DetectorFailureException {
    _detector.update(latencyEvent(103));
    CusumDetector.CusumState before = _detector.state(LATENCY_KEY);
    _detector.detect(latencyEvent(103));
    _detector.detect(latencyEvent(103));
    assertEquals(before, _detector.state(LATENCY_KEY));
  }

  @Test
  public void testNoStateWithoutValidBaseline() {
    TelemetryEvent event = new TelemetryEvent(0L, "other-service", "gpt-4", "latency_ms", 500);
    _detector.update(event);
    assertEquals(CusumDetector.CusumState.ZERO, _detector.state(BaselineKey.of(event)));
  }

  @Test
  public void testDeterministicReplay() {
    CusumDetector replica = new CusumDetector(latencyConfig(), _baselineManager);
    for (int i = 0; i < 40; i++) {
      TelemetryEvent event = latencyEvent(100 + Math.cos(i) * 3);
      _detector.update(event);
      replica.update(event);
    }
    assertEquals(_detector.state(LATENCY_KEY), replica.state(LATENCY_KEY));
  }

  @Test
  public void testReset() {
    _detector.update(latencyEvent(103));
    _detector.reset();
    assertEquals(CusumDetector.CusumState.ZERO, _detector.state(LATENCY_KEY));
  }

  @Test
  public void testDefaultTracksOnlyCost() throws DetectorFailureException {
    CusumDetector detector = new CusumDetector(new CusumDetectorConfig(Collections.emptyMap()), _baselineManager);
    assertEquals(Collections.singleton("cost_usd"), detector.metrics());

    // A latency jump far beyond the absolute decision interval is left to the other detectors.
    assertNull(detector.detect(latencyEvent(120)));
    detector.update(latencyEvent(120));
    assertEquals(CusumDetector.CusumState.ZERO, detector.state(LATENCY_KEY));

    BaselineKey costKey = BaselineKey.cost(SERVICE, MODEL);
    seed(_baselineManager, costKey, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1);
    TelemetryEvent cost = event(costKey, 7.0);
    AnomalyEvent anomaly = detector.detect(cost);
    assertNotNull(anomaly);
    assertEquals(AnomalyType.DRIFT, anomaly.anomalyType());
    assertEquals(5.5, anomaly.details().deviationScore(), EPSILON);
  }

  @Test
  public void testInvalidMetrics() {
    assertThrows(ConfigException.class,
                 () -> new CusumDetectorConfig(Collections.singletonMap(CusumDetectorConfig.CUSUM_DETECTOR_METRICS_CONFIG, "")));
    assertThrows(ConfigException.class,
                 () -> new CusumDetectorConfig(Collections.singletonMap(CusumDetectorConfig.CUSUM_DETECTOR_METRICS_CONFIG, "cost_usd,")));
    assertThrows(ConfigException.class,
                 () -> new CusumDetectorConfig(Collections.singletonMap(CusumDetectorConfig.CUSUM_DETECTOR_THRESHOLD_CONFIG, "NaN")));
  }
}
