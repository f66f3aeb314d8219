/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.baseline;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.sentinel.common.config.ConfigException;
import com.linkedin.sentinel.common.utils.AutoCloseableLock;
import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.stats.RollingWindow;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Tracks a rolling window and the derived {@link Baseline} of every series.
 *
 * <ul>
 *   <li>Updates of different keys never contend with each other, updates of the same key are serialized by a per-key
 *   lock.</li>
 *   <li>The baseline of a key is recomputed from the whole window on every update and published as a new immutable
 *   instance, so readers never see a partially updated baseline and never block.</li>
 * </ul>
 */
public class BaselineManager {
  private static final Logger LOG = LoggerFactory.getLogger(BaselineManager.class);
  public static final String BASELINE_MANAGER_SENSOR = "BaselineManager";
  private final int _windowSize;
  private final ConcurrentHashMap<BaselineKey, KeyState> _states;
  private final MetricRegistry _dropwizardMetricRegistry;

  /**
   * @param windowSize Capacity of the rolling window of each series, at least {@link Baseline#MIN_SAMPLES}.
   * @param dropwizardMetricRegistry Registry for the per-key gauges.
   */
  public BaselineManager(int windowSize, MetricRegistry dropwizardMetricRegistry) {
    if (windowSize < Baseline.MIN_SAMPLES) {
      throw new ConfigException(String.format("Baseline window size must be at least %d, but is %d.",
                                              Baseline.MIN_SAMPLES, windowSize));
    }
    _windowSize = windowSize;
    _states = new ConcurrentHashMap<>();
    _dropwizardMetricRegistry = Utils.validateNotNull(dropwizardMetricRegistry, "Metric registry cannot be null.");
  }

  public BaselineManager(int windowSize) {
    this(windowSize, new MetricRegistry());
  }

  /**
   * Fold a new sample into the window of the given key and publish the recomputed baseline.
   *
   * @param key Key of the series.
   * @param value The new sample.
   * @return The baseline after the update.
   */
  public Baseline update(BaselineKey key, double value) {
    Utils.validateNotNull(key, "Baseline key cannot be null.");
    KeyState state = _states.computeIfAbsent(key, this::newKeyState);
    try (AutoCloseableLock ignored = new AutoCloseableLock(state._lock)) {
      state._window.push(value);
      Baseline baseline = Baseline.fromSamples(state._window.values());
      state._baseline = baseline;
      LOG.trace("Updated baseline of {} to {}.", key, baseline);
      return baseline;
    }
  }

  /**
   * @param key Key of the series.
   * @return The most recently published baseline of the key, or {@code null} if the key has no samples.
   */
  public Baseline get(BaselineKey key) {
    KeyState state = _states.get(key);
    return state == null ? null : state._baseline;
  }

  /**
   * @param key Key of the series.
   * @return The baseline of the key if it is valid, {@code null} otherwise.
   */
  public Baseline getValid(BaselineKey key) {
    Baseline baseline = get(key);
    return baseline != null && baseline.isValid() ? baseline : null;
  }

  /**
   * @param key Key of the series.
   * @return {@code true} if the key has at least {@link Baseline#MIN_SAMPLES} samples.
   */
  public boolean hasValidBaseline(BaselineKey key) {
    return getValid(key) != null;
  }

  /**
   * Drop the window and the baseline of the given key.
   *
   * @param key Key of the series.
   * @return {@code true} if the key was tracked.
   */
  public boolean clear(BaselineKey key) {
    boolean[] removed = new boolean[1];
    _states.computeIfPresent(key, (k, state) -> {
      removeGauges(state);
      removed[0] = true;
      return null;
    });
    if (removed[0]) {
      LOG.debug("Cleared baseline of {}.", key);
    }
    return removed[0];
  }

  /**
   * Drop the windows and baselines of all keys.
   */
  public void clearAll() {
    for (BaselineKey key : _states.keySet()) {
      clear(key);
    }
    LOG.info("Cleared all baselines.");
  }

  /**
   * @return Keys of the tracked series.
   */
  public Set<BaselineKey> keys() {
    return Set.copyOf(_states.keySet());
  }

  /**
   * @return Number of tracked series.
   */
  public int size() {
    return _states.size();
  }

  public int windowSize() {
    return _windowSize;
  }

  /**
   * @return A point-in-time view of this manager.
   */
  public BaselineManagerStats stats() {
    int total = 0;
    int valid = 0;
    for (Map.Entry<BaselineKey, KeyState> entry : _states.entrySet()) {
      total++;
      if (entry.getValue()._baseline.isValid()) {
        valid++;
      }
    }
    return new BaselineManagerStats(total, valid, _windowSize);
  }

  private KeyState newKeyState(BaselineKey key) {
    KeyState state = new KeyState(_windowSize);
    registerGauge(state, gaugeName(key, "mean"), () -> state._baseline.mean());
    registerGauge(state, gaugeName(key, "sample-count"), () -> state._baseline.sampleCount());
    LOG.debug("Started tracking baseline of {}.", key);
    return state;
  }

  /**
   * Gauges are best effort: a name already taken in a shared registry leaves the series without gauges, it never
   * prevents the series from being tracked.
   */
  private void registerGauge(KeyState state, String name, Gauge<?> gauge) {
    try {
      _dropwizardMetricRegistry.register(name, gauge);
      state._gauges.put(name, gauge);
    } catch (IllegalArgumentException e) {
      LOG.warn("Skipped registering gauge {}: {}", name, e.getMessage());
    }
  }

  private void removeGauges(KeyState state) {
    // Only remove the gauges registered by this manager, the registry may be shared.
    _dropwizardMetricRegistry.removeMatching((name, metric) -> state._gauges.get(name) == metric);
    state._gauges.clear();
  }

  /**
   * Gauge name of a key. Dots and backslashes inside the key parts are escaped, so distinct keys never share a name.
   */
  static String gaugeName(BaselineKey key, String name) {
    return MetricRegistry.name(BASELINE_MANAGER_SENSOR, escape(key.service()), escape(key.model()), escape(key.metric()), name);
  }

  private static String escape(String part) {
    return part.replace("\\", "\\\\").replace(".", "\\.");
  }

  /**
   * The window of a key, the lock serializing its updates and the last published baseline.
   */
  private static final class KeyState {
    private final RollingWindow _window;
    private final ReentrantLock _lock;
    private volatile Baseline _baseline;
    private final Map<String, Gauge<?>> _gauges;

    private KeyState(int windowSize) {
      _window = new RollingWindow(windowSize);
      _lock = new ReentrantLock();
      _baseline = Baseline.empty();
      _gauges = new ConcurrentHashMap<>();
    }
  }
}
