/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.stats;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;


/**
 * Pure numeric functions over a finite sample.
 *
 * <ul>
 *   <li>The standard deviation is the population one.</li>
 *   <li>Percentiles interpolate linearly between closest ranks: the p-th percentile sits at position
 *   {@code 1 + (n - 1) * p / 100} of the sorted sample.</li>
 *   <li>Every function returns 0 for an empty sample.</li>
 * </ul>
 */
public final class StatisticsUtils {
  /**
   * Scale factor that makes the MAD a consistent estimator of the standard deviation for normal data.
   */
  public static final double MODIFIED_ZSCORE_FACTOR = 0.6745;

  private StatisticsUtils() {
  }

  /**
   * @param values The sample.
   * @return Arithmetic mean, 0 for an empty sample.
   */
  public static double mean(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    return new Mean().evaluate(values);
  }

  /**
   * @param values The sample.
   * @return Population standard deviation, 0 for fewer than two values.
   */
  public static double stdDev(double[] values) {
    if (values.length < 2) {
      return 0.0;
    }
    return new StandardDeviation(false).evaluate(values);
  }

  public static double median(double[] values) {
    return percentile(values, 50.0);
  }

  /**
   * @param values The sample.
   * @param percentile Percentile in [0, 100].
   * @return The interpolated percentile of the sample, 0 for an empty sample.
   */
  public static double percentile(double[] values, double percentile) {
    if (values.length == 0) {
      return 0.0;
    }
    return percentile(estimator(values), percentile);
  }

  /**
   * Create a percentile estimator holding a sorted copy of the given sample, so that several percentiles of the same
   * sample can be evaluated with a single sort. The estimator does not keep a reference to {@code values}.
   *
   * @param values The sample, must not be empty.
   * @return Percentile estimator for the sample.
   */
  public static Percentile estimator(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Cannot estimate percentiles of an empty sample.");
    }
    Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    estimator.setData(values);
    return estimator;
  }

  /**
   * @param estimator Estimator created by {@link #estimator(double[])}.
   * @param percentile Percentile in [0, 100].
   * @return The interpolated percentile.
   */
  public static double percentile(Percentile estimator, double percentile) {
    if (percentile < 0.0 || percentile > 100.0 || Double.isNaN(percentile)) {
      throw new IllegalArgumentException("Percentile must be in [0, 100], but is " + percentile);
    }
    // Percentile#evaluate rejects 0, the lowest rank is the minimum.
    return estimator.evaluate(percentile == 0.0 ? Double.MIN_VALUE : percentile);
  }

  public static double q1(double[] values) {
    return percentile(values, 25.0);
  }

  public static double q3(double[] values) {
    return percentile(values, 75.0);
  }

  /**
   * @param values The sample.
   * @return Interquartile range Q3 - Q1.
   */
  public static double iqr(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    Percentile estimator = estimator(values);
    return percentile(estimator, 75.0) - percentile(estimator, 25.0);
  }

  /**
   * @param values The sample.
   * @return Median of the absolute deviations from the median, not scaled.
   */
  public static double mad(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double median = median(values);
    double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - median);
    }
    return median(deviations);
  }

  /**
   * @param value The observed value.
   * @param mean Reference mean.
   * @param stdDev Reference standard deviation.
   * @return (value - mean) / stdDev, or 0 when the standard deviation is 0.
   */
  public static double zScore(double value, double mean, double stdDev) {
    if (stdDev == 0.0) {
      return 0.0;
    }
    return (value - mean) / stdDev;
  }

  /**
   * @param value The observed value.
   * @param median Reference median.
   * @param mad Reference median absolute deviation.
   * @return 0.6745 * (value - median) / mad, or 0 when the MAD is 0.
   */
  public static double modifiedZScore(double value, double median, double mad) {
    if (mad == 0.0) {
      return 0.0;
    }
    return MODIFIED_ZSCORE_FACTOR * (value - median) / mad;
  }

  public static boolean isZScoreOutlier(double value, double mean, double stdDev, double threshold) {
    return Math.abs(zScore(value, mean, stdDev)) > threshold;
  }

  /**
   * @return {@code true} if the value is outside [q1 - multiplier * iqr, q3 + multiplier * iqr].
   */
  public static boolean isIqrOutlier(double value, double q1, double q3, double multiplier) {
    double iqr = q3 - q1;
    return value < q1 - multiplier * iqr || value > q3 + multiplier * iqr;
  }

  public static boolean isMadOutlier(double value, double median, double mad, double threshold) {
    return Math.abs(modifiedZScore(value, median, mad)) > threshold;
  }
}
