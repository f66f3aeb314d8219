/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.anomaly.AnomalyType;
import com.linkedin.sentinel.detection.anomaly.Severity;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.exception.DetectorFailureException;
import java.util.Collections;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.sentinel.detection.DetectionTestUtils.QUEUE_DEPTH_KEY;
import static com.linkedin.sentinel.detection.DetectionTestUtils.event;
import static com.linkedin.sentinel.detection.DetectionTestUtils.seed;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

/**
 * The window 10, 11, ..., 19 has Q1 = 12.25, Q3 = 16.75 and IQR = 4.5, hence the fences [5.5, 23.5] and the extreme
 * fences [-1.25, 30.25].
 */
public class IqrDetectorTest {
  private static final double EPSILON = 1E-6;
  private BaselineManager _baselineManager;
  private IqrDetector _detector;

  @Before
  public void setUp() {
    _baselineManager = new BaselineManager(100);
    _detector = new IqrDetector(new IqrDetectorConfig(Collections.emptyMap()), _baselineManager);
  }

  private void seedRamp() {
    seed(_baselineManager, QUEUE_DEPTH_KEY, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19);
  }

  @Test
  public void testWithinFences() throws DetectorFailureException {
    seedRamp();
    assertNull(_detector.detect(event(QUEUE_DEPTH_KEY, 23.5)));
    assertNull(_detector.detect(event(QUEUE_DEPTH_KEY, 5.5)));
    assertNull(_detector.detect(event(QUEUE_DEPTH_KEY, 14)));
  }

  @Test
  public void testJustAboveUpperFence() throws DetectorFailureException {
    seedRamp();
    AnomalyEvent anomaly = _detector.detect(event(QUEUE_DEPTH_KEY, 24));
    assertEquals(AnomalyType.METRIC_OUTLIER, anomaly.anomalyType());
    assertEquals(DetectorKind.IQR, anomaly.detectionMethod());
    assertEquals(Severity.MEDIUM, anomaly.severity());
    assertEquals(0.7 + 0.1 * 0.5 / 4.5, anomaly.confidence(), EPSILON);
    assertEquals(14.5, anomaly.details().expectedValue(), EPSILON);
    assertEquals(23.5, anomaly.details().threshold(), EPSILON);
    assertEquals(0.5 / 4.5, anomaly.details().deviationScore(), EPSILON);
    Map<String, Double> additional = anomaly.details().additional();
    assertEquals(12.25, additional.get("q1"), EPSILON);
    assertEquals(16.75, additional.get("q3"), EPSILON);
    assertEquals(4.5, additional.get("iqr"), EPSILON);
    assertEquals(5.5, additional.get("lower_bound"), EPSILON);
    assertEquals(23.5, additional.get("upper_bound"), EPSILON);
  }

  @Test
  public void testSeverity() throws DetectorFailureException {
    seedRamp();
    assertEquals(Severity.CRITICAL, _detector.detect(event(QUEUE_DEPTH_KEY, 31)).severity());
    assertEquals(Severity.HIGH, _detector.detect(event(QUEUE_DEPTH_KEY, 2)).severity());
    assertEquals(Severity.MEDIUM, _detector.detect(event(QUEUE_DEPTH_KEY, 5)).severity());
    AnomalyEvent extremeLow = _detector.detect(event(QUEUE_DEPTH_KEY, -2));
    assertEquals(Severity.CRITICAL, extremeLow.severity());
    assertEquals(5.5, extremeLow.details().threshold(), EPSILON);
  }

  @Test
  public void testConfidenceIsBounded() {
    assertEquals(0.7, IqrDetector.confidenceFor(0.0, 4.5), EPSILON);
    assertEquals(AnomalyEvent.MAX_CONFIDENCE, IqrDetector.confidenceFor(100.0, 4.5), EPSILON);
  }

  @Test
  public void testWindowWithoutSpread() throws DetectorFailureException {
    seed(_baselineManager, QUEUE_DEPTH_KEY, 7, 7, 7, 7, 7, 7, 7, 7, 7, 7);
    assertNull(_detector.detect(event(QUEUE_DEPTH_KEY, 7)));
    AnomalyEvent anomaly = _detector.detect(event(QUEUE_DEPTH_KEY, 8));
    assertEquals(Severity.CRITICAL, anomaly.severity());
    assertEquals(AnomalyEvent.MAX_CONFIDENCE, anomaly.confidence(), EPSILON);
    assertEquals(1.0, anomaly.details().deviationScore(), EPSILON);
  }

  @Test
  public void testCustomMultiplier() throws DetectorFailureException {
    IqrDetector wide = new IqrDetector(new IqrDetectorConfig(Map.of(IqrDetectorConfig.IQR_DETECTOR_MULTIPLIER_CONFIG, 3.0)),
                                       _baselineManager);
    seedRamp();
    assertEquals(3.0, wide.multiplier(), EPSILON);
    assertNull(wide.detect(event(QUEUE_DEPTH_KEY, 30)));
    assertEquals(Severity.CRITICAL, wide.detect(event(QUEUE_DEPTH_KEY, 31)).severity());
  }
}
