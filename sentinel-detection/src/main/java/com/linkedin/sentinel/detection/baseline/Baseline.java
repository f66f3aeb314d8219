/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.baseline;

import com.linkedin.sentinel.stats.StatisticsUtils;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;


/**
 * An immutable statistical summary of the samples of one series. A baseline computed from fewer than
 * {@link #MIN_SAMPLES} samples exists but is not {@link #isValid() valid}, detectors treat it as absent.
 */
public final class Baseline {
  public static final int MIN_SAMPLES = 10;
  private static final Baseline EMPTY = new Baseline(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0);

  private final double _mean;
  private final double _stdDev;
  private final double _median;
  private final double _mad;
  private final double _q1;
  private final double _q3;
  private final double _p95;
  private final double _p99;
  private final double _min;
  private final double _max;
  private final int _sampleCount;

  Baseline(double mean, double stdDev, double median, double mad, double q1, double q3, double p95, double p99,
           double min, double max, int sampleCount) {
    _mean = mean;
    _stdDev = stdDev;
    _median = median;
    _mad = mad;
    _q1 = q1;
    _q3 = q3;
    _p95 = p95;
    _p99 = p99;
    _min = min;
    _max = max;
    _sampleCount = sampleCount;
  }

  /**
   * @return The baseline of a series without samples.
   */
  public static Baseline empty() {
    return EMPTY;
  }

  /**
   * Compute the baseline of the given samples.
   *
   * @param samples Samples of the series, not modified.
   * @return The baseline of the samples.
   */
  public static Baseline fromSamples(double[] samples) {
    if (samples.length == 0) {
      return EMPTY;
    }
    Percentile estimator = StatisticsUtils.estimator(samples);
    double median = StatisticsUtils.percentile(estimator, 50.0);
    double min = samples[0];
    double max = samples[0];
    for (double sample : samples) {
      min = Math.min(min, sample);
      max = Math.max(max, sample);
    }
    return new Baseline(StatisticsUtils.mean(samples),
                        StatisticsUtils.stdDev(samples),
                        median,
                        StatisticsUtils.mad(samples),
                        StatisticsUtils.percentile(estimator, 25.0),
                        StatisticsUtils.percentile(estimator, 75.0),
                        StatisticsUtils.percentile(estimator, 95.0),
                        StatisticsUtils.percentile(estimator, 99.0),
                        min,
                        max,
                        samples.length);
  }

  /**
   * @return {@code true} if the baseline has at least {@link #MIN_SAMPLES} samples.
   */
  public boolean isValid() {
    return _sampleCount >= MIN_SAMPLES;
  }

  public double mean() {
    return _mean;
  }

  /**
   * @return Population standard deviation.
   */
  public double stdDev() {
    return _stdDev;
  }

  public double median() {
    return _median;
  }

  /**
   * @return Median absolute deviation from the median.
   */
  public double mad() {
    return _mad;
  }

  public double q1() {
    return _q1;
  }

  public double q3() {
    return _q3;
  }

  public double iqr() {
    return _q3 - _q1;
  }

  public double p95() {
    return _p95;
  }

  public double p99() {
    return _p99;
  }

  public double min() {
    return _min;
  }

  public double max() {
    return _max;
  }

  public int sampleCount() {
    return _sampleCount;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("mean", _mean);
    structure.put("stdDev", _stdDev);
    structure.put("median", _median);
    structure.put("mad", _mad);
    structure.put("q1", _q1);
    structure.put("q3", _q3);
    structure.put("iqr", iqr());
    structure.put("p95", _p95);
    structure.put("p99", _p99);
    structure.put("min", _min);
    structure.put("max", _max);
    structure.put("sampleCount", _sampleCount);
    return structure;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Baseline that = (Baseline) o;
    return Double.compare(that._mean, _mean) == 0 && Double.compare(that._stdDev, _stdDev) == 0
           && Double.compare(that._median, _median) == 0 && Double.compare(that._mad, _mad) == 0
           && Double.compare(that._q1, _q1) == 0 && Double.compare(that._q3, _q3) == 0
           && Double.compare(that._p95, _p95) == 0 && Double.compare(that._p99, _p99) == 0
           && Double.compare(that._min, _min) == 0 && Double.compare(that._max, _max) == 0
           && _sampleCount == that._sampleCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_mean, _stdDev, _median, _mad, _q1, _q3, _p95, _p99, _min, _max, _sampleCount);
  }

  @Override
  public String toString() {
    return String.format("{mean:%.3f, stdDev:%.3f, median:%.3f, mad:%.3f, q1:%.3f, q3:%.3f, p95:%.3f, p99:%.3f, "
                         + "min:%.3f, max:%.3f, samples:%d}", _mean, _stdDev, _median, _mad, _q1, _q3, _p95, _p99,
                         _min, _max, _sampleCount);
  }
}
