/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.baseline.Baseline;
import com.linkedin.sentinel.detection.baseline.BaselineKey;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.exception.DetectorFailureException;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import com.linkedin.sentinel.detection.telemetry.TelemetryValidator;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The common part of the detectors reading the baselines of a {@link BaselineManager}: input validation, statistics
 * and containment of unexpected faults. Subclasses implement {@link #detectAnomaly(TelemetryEvent, Baseline)}, which
 * is only called once the series has a valid baseline.
 */
public abstract class AbstractDetector implements Detector {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractDetector.class);
  protected final BaselineManager _baselineManager;
  private final DetectorKind _kind;
  private final AtomicLong _numInvocations;
  private final AtomicLong _numAnomalies;
  private final AtomicLong _numErrors;
  private final DoubleAdder _confidenceSum;

  protected AbstractDetector(DetectorKind kind, BaselineManager baselineManager) {
    _kind = Utils.validateNotNull(kind, "Detector kind cannot be null.");
    _baselineManager = Utils.validateNotNull(baselineManager, "Baseline manager cannot be null.");
    _numInvocations = new AtomicLong(0L);
    _numAnomalies = new AtomicLong(0L);
    _numErrors = new AtomicLong(0L);
    _confidenceSum = new DoubleAdder();
  }

  @Override
  public final AnomalyEvent detect(TelemetryEvent event) throws DetectorFailureException {
    TelemetryValidator.validate(event);
    _numInvocations.incrementAndGet();
    BaselineKey key = BaselineKey.of(event);
    Baseline baseline = _baselineManager.getValid(key);
    if (baseline == null) {
      LOG.debug("Detector {} skipped {}: no valid baseline.", name(), key);
      return null;
    }
    AnomalyEvent anomaly;
    try {
      anomaly = detectAnomaly(event, baseline);
    } catch (RuntimeException e) {
      _numErrors.incrementAndGet();
      throw new DetectorFailureException(name(), "failed to evaluate event " + event.eventId() + " of " + key, e);
    }
    if (anomaly != null) {
      _numAnomalies.incrementAndGet();
      _confidenceSum.add(anomaly.confidence());
      LOG.debug("Detector {} found anomaly {}.", name(), anomaly);
    }
    return anomaly;
  }

  /**
   * Classify a valid event against the valid baseline of its series.
   *
   * @param event The event to classify.
   * @param baseline The valid baseline of the series of the event.
   * @return The anomaly found on the event, or {@code null}.
   */
  protected abstract AnomalyEvent detectAnomaly(TelemetryEvent event, Baseline baseline);

  @Override
  public void update(TelemetryEvent event) {
    TelemetryValidator.validate(event);
  }

  @Override
  public void reset() {
    resetState();
    _numInvocations.set(0L);
    _numAnomalies.set(0L);
    _numErrors.set(0L);
    _confidenceSum.reset();
  }

  /**
   * Clear the internal state of the detector. Stateless detectors have nothing to clear.
   */
  protected void resetState() {
  }

  @Override
  public void recordFailure() {
    _numErrors.incrementAndGet();
  }

  @Override
  public void discardResult(AnomalyEvent anomaly) {
    _numAnomalies.decrementAndGet();
    _confidenceSum.add(-anomaly.confidence());
  }

  @Override
  public String name() {
    return _kind.detectorName();
  }

  @Override
  public DetectorKind kind() {
    return _kind;
  }

  @Override
  public DetectorStats stats() {
    long numAnomalies = _numAnomalies.get();
    double avgConfidence = numAnomalies == 0 ? 0.0 : _confidenceSum.sum() / numAnomalies;
    return new DetectorStats(name(), _numInvocations.get(), numAnomalies, _numErrors.get(), avgConfidence);
  }

  /**
   * @param event The anomalous event.
   * @param baseline The baseline the decision was made against.
   * @return A builder of an anomaly reported by this detector.
   */
  protected AnomalyEvent.Builder anomalyBuilder(TelemetryEvent event, Baseline baseline) {
    return new AnomalyEvent.Builder(event, _kind, baseline);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + stats();
  }
}
