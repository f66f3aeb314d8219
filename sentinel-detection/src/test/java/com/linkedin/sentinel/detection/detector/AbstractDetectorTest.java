/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.baseline.Baseline;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.exception.DetectorFailureException;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import java.util.Collections;
import org.junit.Test;

import static com.linkedin.sentinel.detection.DetectionTestUtils.LATENCY_KEY;
import static com.linkedin.sentinel.detection.DetectionTestUtils.MEAN_100_STD_10;
import static com.linkedin.sentinel.detection.DetectionTestUtils.latencyEvent;
import static com.linkedin.sentinel.detection.DetectionTestUtils.seed;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class AbstractDetectorTest {

  @Test
  public void testUnexpectedFaultIsContained() {
    BaselineManager baselineManager = new BaselineManager(100);
    seed(baselineManager, LATENCY_KEY, MEAN_100_STD_10);
    Detector detector = new AbstractDetector(DetectorKind.MAD, baselineManager) {
      @Override
      protected AnomalyEvent detectAnomaly(TelemetryEvent event, Baseline baseline) {
        throw new IllegalStateException("Corrupted state");
      }
    };
    DetectorFailureException e = assertThrows(DetectorFailureException.class, () -> detector.detect(latencyEvent(100)));
    assertEquals("mad", e.detectorName());
    assertTrue(e.getCause() instanceof IllegalStateException);
    assertEquals(1, detector.stats().numErrors());
    assertEquals(1, detector.stats().numInvocations());

    detector.recordFailure();
    assertEquals(2, detector.stats().numErrors());
    detector.reset();
    assertEquals(0, detector.stats().numErrors());
  }

  @Test
  public void testDiscardResult() throws DetectorFailureException {
    BaselineManager baselineManager = new BaselineManager(100);
    seed(baselineManager, LATENCY_KEY, MEAN_100_STD_10);
    Detector detector = new ZScoreDetector(new ZScoreDetectorConfig(Collections.emptyMap()), baselineManager);
    AnomalyEvent first = detector.detect(latencyEvent(1000));
    AnomalyEvent second = detector.detect(latencyEvent(140));
    assertEquals(2, detector.stats().numAnomalies());

    detector.discardResult(first);
    DetectorStats stats = detector.stats();
    assertEquals(2, stats.numInvocations());
    assertEquals(1, stats.numAnomalies());
    assertEquals(second.confidence(), stats.avgConfidence(), 1E-9);
  }
}
