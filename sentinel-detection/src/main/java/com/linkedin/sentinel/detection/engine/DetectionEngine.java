/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.engine;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.sentinel.common.utils.SentinelThreadFactory;
import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.baseline.BaselineKey;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.detector.CusumDetector;
import com.linkedin.sentinel.detection.detector.CusumDetectorConfig;
import com.linkedin.sentinel.detection.detector.Detector;
import com.linkedin.sentinel.detection.detector.DetectorKind;
import com.linkedin.sentinel.detection.detector.DetectorStats;
import com.linkedin.sentinel.detection.detector.IqrDetector;
import com.linkedin.sentinel.detection.detector.IqrDetectorConfig;
import com.linkedin.sentinel.detection.detector.MadDetector;
import com.linkedin.sentinel.detection.detector.MadDetectorConfig;
import com.linkedin.sentinel.detection.detector.ZScoreDetector;
import com.linkedin.sentinel.detection.detector.ZScoreDetectorConfig;
import com.linkedin.sentinel.detection.exception.DetectorFailureException;
import com.linkedin.sentinel.detection.telemetry.InvalidTelemetryException;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import com.linkedin.sentinel.detection.telemetry.TelemetryValidator;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Runs the enabled detectors over the baselines of one {@link BaselineManager} and reports anomalies.
 *
 * <ul>
 *   <li>{@link #detect(TelemetryEvent)} classifies an event against the current baselines without learning from it.</li>
 *   <li>{@link #update(TelemetryEvent)} learns from an event if continuous learning is enabled.</li>
 *   <li>{@link #process(TelemetryEvent)} detects, then learns, so an event never influences its own detection.</li>
 * </ul>
 *
 * A failing or late detector never fails the engine: its result is skipped, the failure is logged and counted, and
 * the remaining detectors still run. Only a malformed event is reported to the caller, as an
 * {@link InvalidTelemetryException}.
 * <p>
 * The engine is thread-safe. Events of different series are independent, events of the same series should be
 * submitted by one producer to keep their order.
 */
public class DetectionEngine implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);
  public static final String DETECTION_ENGINE_SENSOR = "DetectionEngine";
  private static final long NO_DEADLINE = -1L;
  private static final long EXECUTOR_SHUTDOWN_TIMEOUT_MS = 5000L;
  private final BaselineManager _baselineManager;
  private final List<Detector> _detectors;
  private final boolean _continuousLearning;
  private final AnomalySelectionPolicy _selectionPolicy;
  private final long _detectionTimeoutMs;
  private final ExecutorService _detectionExecutor;
  private final ExecutorService _batchExecutor;
  private final AtomicLong _numEventsProcessed;
  private final AtomicLong _numAnomaliesDetected;
  private final MetricRegistry _dropwizardMetricRegistry;
  private final Timer _detectionTimer;

  /**
   * Create an engine reporting its metrics to a private registry.
   *
   * @param configs Engine and detector configs, see {@link DetectionEngineConfig}.
   */
  public DetectionEngine(Map<?, ?> configs) {
    this(configs, new MetricRegistry());
  }

  /**
   * @param configs Engine and detector configs, see {@link DetectionEngineConfig}.
   * @param dropwizardMetricRegistry The metric registry that holds the metrics of the engine.
   */
  public DetectionEngine(Map<?, ?> configs, MetricRegistry dropwizardMetricRegistry) {
    this(new DetectionEngineConfig(configs), configs, dropwizardMetricRegistry);
  }

  private DetectionEngine(DetectionEngineConfig config, Map<?, ?> configs, MetricRegistry dropwizardMetricRegistry) {
    this(config, new BaselineManager(config.baselineWindowSize(), dropwizardMetricRegistry), configs, dropwizardMetricRegistry);
  }

  private DetectionEngine(DetectionEngineConfig config,
                          BaselineManager baselineManager,
                          Map<?, ?> configs,
                          MetricRegistry dropwizardMetricRegistry) {
    this(config, baselineManager, createDetectors(config, baselineManager, configs), dropwizardMetricRegistry);
  }

  /**
   * Package private constructor for unit test.
   */
  DetectionEngine(DetectionEngineConfig config,
                  BaselineManager baselineManager,
                  List<Detector> detectors,
                  MetricRegistry dropwizardMetricRegistry) {
    if (detectors.isEmpty()) {
      throw new IllegalArgumentException("Detection engine requires at least one detector.");
    }
    _baselineManager = Utils.validateNotNull(baselineManager, "Baseline manager cannot be null.");
    _detectors = List.copyOf(detectors);
    _continuousLearning = config.continuousLearningEnabled();
    _selectionPolicy = config.anomalySelectionPolicy();
    _detectionTimeoutMs = config.detectionTimeoutMs();
    int numThreads = config.numDetectionThreads();
    _detectionExecutor = Executors.newFixedThreadPool(numThreads, new SentinelThreadFactory("DetectionExecutor", true, LOG));
    _batchExecutor = Executors.newFixedThreadPool(numThreads, new SentinelThreadFactory("BatchProcessor", true, LOG));
    _numEventsProcessed = new AtomicLong(0L);
    _numAnomaliesDetected = new AtomicLong(0L);
    _dropwizardMetricRegistry = Utils.validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null.");
    _detectionTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(DETECTION_ENGINE_SENSOR, "detection-timer"));
    LOG.info("Detection engine created with detectors {}, selection policy {}, continuous learning {}, "
             + "detection timeout {} ms.", detectorNames(), _selectionPolicy, _continuousLearning, _detectionTimeoutMs);
  }

  private static List<Detector> createDetectors(DetectionEngineConfig config,
                                                BaselineManager baselineManager,
                                                Map<?, ?> configs) {
    List<Detector> detectors = new ArrayList<>();
    for (DetectorKind kind : config.enabledDetectors()) {
      switch (kind) {
        case ZSCORE:
          detectors.add(new ZScoreDetector(new ZScoreDetectorConfig(configs), baselineManager));
          break;
        case IQR:
          detectors.add(new IqrDetector(new IqrDetectorConfig(configs), baselineManager));
          break;
        case MAD:
          detectors.add(new MadDetector(new MadDetectorConfig(configs), baselineManager));
          break;
        case CUSUM:
          detectors.add(new CusumDetector(new CusumDetectorConfig(configs), baselineManager));
          break;
        default:
          throw new IllegalStateException("Unsupported detector " + kind);
      }
      LOG.info("Enabled {} detector.", kind);
    }
    return detectors;
  }

  /**
   * Classify the given event against the current baselines, within the configured detection timeout.
   *
   * @param event The event to classify.
   * @return The selected anomaly, or {@code null} if no detector reported one.
   * @throws InvalidTelemetryException if the event is malformed. Nothing is counted in that case.
   */
  public AnomalyEvent detect(TelemetryEvent event) {
    return detect(event, _detectionTimeoutMs);
  }

  /**
   * Classify the given event against the current baselines. Detectors still running when the time budget is spent
   * are skipped and counted as failed.
   *
   * @param event The event to classify.
   * @param timeoutMs Time budget of the call in milliseconds, 0 for no deadline.
   * @return The selected anomaly, or {@code null} if no detector reported one.
   * @throws InvalidTelemetryException if the event is malformed. Nothing is counted in that case.
   */
  public AnomalyEvent detect(TelemetryEvent event, long timeoutMs) {
    TelemetryValidator.validate(event);
    if (timeoutMs < 0) {
      throw new IllegalArgumentException("Detection timeout cannot be negative (" + timeoutMs + ").");
    }
    _numEventsProcessed.incrementAndGet();
    long deadlineNs = timeoutMs == 0 ? NO_DEADLINE : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    AnomalyEvent selected = null;
    Detector selectedBy = null;
    try (Timer.Context ignored = _detectionTimer.time()) {
      for (Detector detector : _detectors) {
        AnomalyEvent anomaly = runDetector(detector, event, deadlineNs);
        if (anomaly == null) {
          continue;
        }
        if (selected == null || anomaly.severity().isMoreSevereThan(selected.severity())) {
          selected = anomaly;
          selectedBy = detector;
        }
        if (_selectionPolicy == AnomalySelectionPolicy.FIRST_MATCH) {
          break;
        }
      }
    }
    if (selected != null) {
      _numAnomaliesDetected.incrementAndGet();
      _dropwizardMetricRegistry.counter(MetricRegistry.name(DETECTION_ENGINE_SENSOR, selectedBy.name(),
                                                            selected.anomalyType().name().toLowerCase(),
                                                            selected.severity().name().toLowerCase(),
                                                            "anomalies")).inc();
      LOG.debug("Detected {} on event {}.", selected, event.eventId());
    }
    return selected;
  }

  private AnomalyEvent runDetector(Detector detector, TelemetryEvent event, long deadlineNs) {
    try {
      if (deadlineNs == NO_DEADLINE) {
        return detector.detect(event);
      }
      return runDetectorWithDeadline(detector, event, deadlineNs);
    } catch (DetectorFailureException e) {
      onDetectorFailure(detector, event, e);
    } catch (RuntimeException e) {
      detector.recordFailure();
      onDetectorFailure(detector, event, e);
    }
    return null;
  }

  private AnomalyEvent runDetectorWithDeadline(Detector detector, TelemetryEvent event, long deadlineNs)
      throws DetectorFailureException {
    long remainingNs = deadlineNs - System.nanoTime();
    if (remainingNs <= 0) {
      onDetectorTimeout(detector, event);
      return null;
    }
    // Claimed by whichever comes first: the task delivering a result, or the engine giving up on it.
    AtomicBoolean claimed = new AtomicBoolean(false);
    Future<AnomalyEvent> future = _detectionExecutor.submit(() -> detectUnlessAbandoned(detector, event, claimed));
    try {
      try {
        return future.get(remainingNs, TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        if (claimed.compareAndSet(false, true)) {
          future.cancel(true);
          onDetectorTimeout(detector, event);
          return null;
        }
        // Delivered right at the deadline.
        return future.get();
      }
    } catch (InterruptedException e) {
      claimed.set(true);
      future.cancel(true);
      Thread.currentThread().interrupt();
      detector.recordFailure();
      onDetectorFailure(detector, event, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof DetectorFailureException) {
        throw (DetectorFailureException) cause;
      }
      detector.recordFailure();
      throw new DetectorFailureException(detector.name(), "unexpected failure on event " + event.eventId(), cause);
    }
    return null;
  }

  /**
   * Run the detector unless the engine already gave up on it. An anomaly found after the engine gave up is withdrawn
   * from the statistics of the detector.
   */
  private static AnomalyEvent detectUnlessAbandoned(Detector detector, TelemetryEvent event, AtomicBoolean claimed)
      throws DetectorFailureException {
    if (claimed.get()) {
      return null;
    }
    AnomalyEvent anomaly = detector.detect(event);
    if (!claimed.compareAndSet(false, true) && anomaly != null) {
      LOG.debug("Detector {} found {} after the detection deadline, discarding it.", detector.name(), anomaly);
      detector.discardResult(anomaly);
    }
    return anomaly;
  }

  private void onDetectorTimeout(Detector detector, TelemetryEvent event) {
    detector.recordFailure();
    _dropwizardMetricRegistry.counter(MetricRegistry.name(DETECTION_ENGINE_SENSOR, detector.name(), "detection-errors")).inc();
    LOG.warn("Detector {} exceeded the detection deadline on event {}, skipping its result.", detector.name(), event.eventId());
  }

  private void onDetectorFailure(Detector detector, TelemetryEvent event, Exception e) {
    _dropwizardMetricRegistry.counter(MetricRegistry.name(DETECTION_ENGINE_SENSOR, detector.name(), "detection-errors")).inc();
    LOG.warn("Detector {} failed on event {}, skipping its result.", detector.name(), event.eventId(), e);
  }

  /**
   * Learn from the given event if continuous learning is enabled: the detectors update their own state, then the
   * value is folded into the baseline of its series.
   *
   * @param event The event to learn from.
   * @throws InvalidTelemetryException if the event is malformed.
   */
  public void update(TelemetryEvent event) {
    TelemetryValidator.validate(event);
    if (_continuousLearning) {
      learn(event);
    }
  }

  /**
   * Learn from the given event regardless of the continuous learning setting, e.g. to seed baselines from history.
   *
   * @param event The event to learn from.
   * @throws InvalidTelemetryException if the event is malformed.
   */
  public void train(TelemetryEvent event) {
    TelemetryValidator.validate(event);
    learn(event);
  }

  private void learn(TelemetryEvent event) {
    for (Detector detector : _detectors) {
      try {
        detector.update(event);
      } catch (RuntimeException e) {
        detector.recordFailure();
        onDetectorFailure(detector, event, e);
      }
    }
    _baselineManager.update(BaselineKey.of(event), event.value());
  }

  /**
   * Detect, then learn from, the given event.
   *
   * @param event The event to process.
   * @return The selected anomaly, or {@code null} if no detector reported one.
   * @throws InvalidTelemetryException if the event is malformed.
   */
  public AnomalyEvent process(TelemetryEvent event) {
    AnomalyEvent anomaly = detect(event);
    update(event);
    return anomaly;
  }

  /**
   * Process a batch of events on the batch worker pool. The events of a series are processed one after another in the
   * order of the batch, different series are processed in parallel. Malformed events are logged and skipped.
   *
   * @param events The events to process.
   * @return The anomalies found, grouped by series in the order the series first appear in the batch.
   */
  public List<AnomalyEvent> processAll(Collection<TelemetryEvent> events) {
    Map<BaselineKey, List<TelemetryEvent>> eventsByKey = new LinkedHashMap<>();
    for (TelemetryEvent event : events) {
      try {
        TelemetryValidator.validate(event);
      } catch (InvalidTelemetryException e) {
        LOG.warn("Skipping malformed event {}.", event, e);
        continue;
      }
      eventsByKey.computeIfAbsent(BaselineKey.of(event), k -> new ArrayList<>()).add(event);
    }

    List<Future<List<AnomalyEvent>>> futures = new ArrayList<>(eventsByKey.size());
    for (List<TelemetryEvent> seriesEvents : eventsByKey.values()) {
      futures.add(_batchExecutor.submit(() -> processSeries(seriesEvents)));
    }
    List<AnomalyEvent> anomalies = new ArrayList<>();
    for (Future<List<AnomalyEvent>> future : futures) {
      try {
        anomalies.addAll(future.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.warn("Interrupted while processing a batch of {} events, returning the anomalies found so far.", events.size());
        futures.forEach(f -> f.cancel(true));
        break;
      } catch (ExecutionException e) {
        LOG.warn("Failed to process the events of a series.", e.getCause());
      }
    }
    return anomalies;
  }

  private List<AnomalyEvent> processSeries(List<TelemetryEvent> seriesEvents) {
    List<AnomalyEvent> anomalies = new ArrayList<>();
    for (TelemetryEvent event : seriesEvents) {
      AnomalyEvent anomaly = process(event);
      if (anomaly != null) {
        anomalies.add(anomaly);
      }
    }
    return anomalies;
  }

  /**
   * @return A snapshot of the engine, detector and baseline statistics.
   */
  public EngineStats stats() {
    List<DetectorStats> detectorStats = new ArrayList<>(_detectors.size());
    for (Detector detector : _detectors) {
      detectorStats.add(detector.stats());
    }
    return new EngineStats(_numEventsProcessed.get(), _numAnomaliesDetected.get(), detectorStats, _baselineManager.stats());
  }

  /**
   * Cold start: clear all baselines, the state and statistics of all detectors and the engine counters.
   */
  public void reset() {
    _baselineManager.clearAll();
    for (Detector detector : _detectors) {
      detector.reset();
    }
    _numEventsProcessed.set(0L);
    _numAnomaliesDetected.set(0L);
    LOG.info("Detection engine reset.");
  }

  public BaselineManager baselineManager() {
    return _baselineManager;
  }

  /**
   * @return Names of the enabled detectors, in the order they run.
   */
  public List<String> detectorNames() {
    List<String> names = new ArrayList<>(_detectors.size());
    for (Detector detector : _detectors) {
      names.add(detector.name());
    }
    return Collections.unmodifiableList(names);
  }

  public int detectorCount() {
    return _detectors.size();
  }

  /**
   * Shut down the worker pools of the engine.
   */
  @Override
  public void close() {
    LOG.info("Shutting down detection engine.");
    _detectionExecutor.shutdownNow();
    _batchExecutor.shutdown();
    try {
      if (!_batchExecutor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        LOG.warn("The batch executor failed to shutdown in {} ms.", EXECUTOR_SHUTDOWN_TIMEOUT_MS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for the batch executor to shutdown.");
    }
    LOG.info("Detection engine shutdown completed.");
  }
}
