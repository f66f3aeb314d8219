/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import com.linkedin.sentinel.common.utils.Utils;
import com.linkedin.sentinel.detection.anomaly.AnomalyDetails;
import com.linkedin.sentinel.detection.anomaly.AnomalyEvent;
import com.linkedin.sentinel.detection.anomaly.AnomalyType;
import com.linkedin.sentinel.detection.anomaly.Severity;
import com.linkedin.sentinel.detection.baseline.Baseline;
import com.linkedin.sentinel.detection.baseline.BaselineKey;
import com.linkedin.sentinel.detection.baseline.BaselineManager;
import com.linkedin.sentinel.detection.telemetry.TelemetryEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Detects a sustained shift of a series away from its baseline mean with a two-sided cumulative sum control chart.
 * For every sample x, with the baseline mean as reference level, slack k and decision interval h:
 * <pre>
 *   S_high = max(0, S_high + (x - mean - k))
 *   S_low  = min(0, S_low  + (x - mean + k))
 *   drift iff S_high &gt; h or |S_low| &gt; h
 * </pre>
 * The accumulators are owned by this detector, one pair per series. {@link #detect(TelemetryEvent)} evaluates the
 * accumulators the observed value would lead to without storing them, {@link #update(TelemetryEvent)} stores them
 * and restarts both at zero once a drift was signalled.
 * <p>
 * Slack and decision interval are absolute, in the units of the metric. Only the series of the metrics configured
 * through {@link CusumDetectorConfig#CUSUM_DETECTOR_METRICS_CONFIG} are tracked, by default the request cost.
 */
public class CusumDetector extends AbstractDetector {
  private static final Logger LOG = LoggerFactory.getLogger(CusumDetector.class);
  static final double MAX_CONFIDENCE = 0.95;
  private final double _threshold;
  private final double _slack;
  private final Set<String> _metrics;
  private final ConcurrentHashMap<BaselineKey, CusumState> _states;

  public CusumDetector(CusumDetectorConfig config, BaselineManager baselineManager) {
    super(DetectorKind.CUSUM, baselineManager);
    _threshold = config.threshold();
    _slack = config.slack();
    _metrics = config.metrics();
    _states = new ConcurrentHashMap<>();
  }

  @Override
  protected AnomalyEvent detectAnomaly(TelemetryEvent event, Baseline baseline) {
    if (!tracks(event)) {
      return null;
    }
    BaselineKey key = BaselineKey.of(event);
    CusumState next = state(key).next(event.value(), baseline.mean(), _slack);
    if (!isDrift(next)) {
      return null;
    }
    boolean upward = next.upper() >= Math.abs(next.lower());
    double score = Math.max(next.upper(), Math.abs(next.lower()));
    Map<String, Double> additional = new LinkedHashMap<>();
    additional.put("cusum_high", next.upper());
    additional.put("cusum_low", next.lower());
    additional.put("slack", _slack);
    AnomalyDetails details = new AnomalyDetails(baseline.mean(), _threshold, score, additional);
    return anomalyBuilder(event, baseline)
        .anomalyType(AnomalyType.DRIFT)
        .severity(score > 2 * _threshold ? Severity.HIGH : Severity.MEDIUM)
        .confidence(Utils.clamp(score / (2 * _threshold), 0.5, MAX_CONFIDENCE))
        .details(details)
        .rootCause(String.format("Sustained %s of %s detected (CUSUM: %.2f, baseline: %.4f)",
                                 upward ? "increase" : "decrease", event.metric(), score, baseline.mean()))
        .build();
  }

  /**
   * Fold the observed value into the accumulators of its series. Series without a valid baseline have no reference
   * level and are left untouched.
   *
   * @param event The event to learn from.
   */
  @Override
  public void update(TelemetryEvent event) {
    super.update(event);
    if (!tracks(event)) {
      return;
    }
    BaselineKey key = BaselineKey.of(event);
    Baseline baseline = _baselineManager.getValid(key);
    if (baseline == null) {
      return;
    }
    _states.compute(key, (k, current) -> {
      CusumState next = (current == null ? CusumState.ZERO : current).next(event.value(), baseline.mean(), _slack);
      if (isDrift(next)) {
        LOG.debug("Restarting CUSUM of {} after drift (high: {}, low: {}).", k, next.upper(), next.lower());
        return CusumState.ZERO;
      }
      return next;
    });
  }

  @Override
  protected void resetState() {
    _states.clear();
  }

  /**
   * @param key Key of a series.
   * @return The current accumulators of the series, zero if the series has none.
   */
  public CusumState state(BaselineKey key) {
    return _states.getOrDefault(key, CusumState.ZERO);
  }

  /**
   * @param event A telemetry event.
   * @return {@code true} if the series of the event is tracked by this detector.
   */
  public boolean tracks(TelemetryEvent event) {
    return _metrics.contains(event.metric());
  }

  private boolean isDrift(CusumState state) {
    return state.upper() > _threshold || Math.abs(state.lower()) > _threshold;
  }

  public double threshold() {
    return _threshold;
  }

  public double slack() {
    return _slack;
  }

  public Set<String> metrics() {
    return _metrics;
  }

  /**
   * The immutable accumulators of one series.
   */
  public static final class CusumState {
    static final CusumState ZERO = new CusumState(0.0, 0.0, 0L);
    private final double _upper;
    private final double _lower;
    private final long _count;

    private CusumState(double upper, double lower, long count) {
      _upper = upper;
      _lower = lower;
      _count = count;
    }

    CusumState next(double value, double mean, double slack) {
      double deviation = value - mean;
      return new CusumState(Math.max(0.0, _upper + deviation - slack), Math.min(0.0, _lower + deviation + slack), _count + 1);
    }

    /**
     * @return The upper accumulator S_high, never negative.
     */
    public double upper() {
      return _upper;
    }

    /**
     * @return The lower accumulator S_low, never positive.
     */
    public double lower() {
      return _lower;
    }

    /**
     * @return Number of samples folded in since the last restart.
     */
    public long count() {
      return _count;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      CusumState that = (CusumState) o;
      return Double.compare(that._upper, _upper) == 0 && Double.compare(that._lower, _lower) == 0 && _count == that._count;
    }

    @Override
    public int hashCode() {
      return Objects.hash(_upper, _lower, _count);
    }

    @Override
    public String toString() {
      return String.format("{high:%.4f, low:%.4f, count:%d}", _upper, _lower, _count);
    }
  }
}
