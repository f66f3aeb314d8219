/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.stats;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class StatisticsUtilsTest {
  private static final double EPSILON = 1E-9;
  private static final double[] SMALL = {1, 2, 3, 4, 5};
  private static final double[] WITH_OUTLIER = {1, 2, 3, 4, 5, 100};

  @Test
  public void testEmptyAndSingleValue() {
    double[] empty = new double[0];
    assertEquals(0.0, StatisticsUtils.mean(empty), EPSILON);
    assertEquals(0.0, StatisticsUtils.stdDev(empty), EPSILON);
    assertEquals(0.0, StatisticsUtils.median(empty), EPSILON);
    assertEquals(0.0, StatisticsUtils.iqr(empty), EPSILON);
    assertEquals(0.0, StatisticsUtils.mad(empty), EPSILON);
    assertEquals(7.0, StatisticsUtils.mean(new double[]{7.0}), EPSILON);
    assertEquals(0.0, StatisticsUtils.stdDev(new double[]{7.0}), EPSILON);
  }

  @Test
  public void testMeanAndPopulationStdDev() {
    double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
    assertEquals(5.0, StatisticsUtils.mean(values), EPSILON);
    assertEquals(2.0, StatisticsUtils.stdDev(values), EPSILON);
  }

  @Test
  public void testOrderStatistics() {
    assertEquals(3.0, StatisticsUtils.median(SMALL), EPSILON);
    assertEquals(2.5, StatisticsUtils.median(new double[]{4, 1, 3, 2}), EPSILON);
    assertEquals(2.0, StatisticsUtils.q1(SMALL), EPSILON);
    assertEquals(4.0, StatisticsUtils.q3(SMALL), EPSILON);
    assertEquals(2.0, StatisticsUtils.iqr(SMALL), EPSILON);
    assertEquals(1.0, StatisticsUtils.percentile(SMALL, 0), EPSILON);
    assertEquals(5.0, StatisticsUtils.percentile(SMALL, 100), EPSILON);
    assertEquals(4.8, StatisticsUtils.percentile(SMALL, 95), EPSILON);
    assertThrows(IllegalArgumentException.class, () -> StatisticsUtils.percentile(SMALL, 101));
  }

  @Test
  public void testQuartilesAreRobustToOutlier() {
    // The outlier only moves the quartiles by re-ranking, not by its magnitude.
    assertEquals(2.25, StatisticsUtils.q1(WITH_OUTLIER), EPSILON);
    assertEquals(4.75, StatisticsUtils.q3(WITH_OUTLIER), EPSILON);
    assertEquals(2.5, StatisticsUtils.iqr(WITH_OUTLIER), EPSILON);
    double[] biggerOutlier = {1, 2, 3, 4, 5, 1_000_000};
    assertEquals(StatisticsUtils.q1(WITH_OUTLIER), StatisticsUtils.q1(biggerOutlier), EPSILON);
    assertEquals(StatisticsUtils.q3(WITH_OUTLIER), StatisticsUtils.q3(biggerOutlier), EPSILON);
    assertTrue(StatisticsUtils.q3(WITH_OUTLIER) - StatisticsUtils.q3(SMALL) <= 1.0);

    // The mean and standard deviation move with the outlier.
    assertNotEquals(StatisticsUtils.mean(SMALL), StatisticsUtils.mean(WITH_OUTLIER), 1.0);
    assertTrue(StatisticsUtils.stdDev(WITH_OUTLIER) > 10 * StatisticsUtils.stdDev(SMALL));
    assertTrue(StatisticsUtils.isIqrOutlier(100, StatisticsUtils.q1(WITH_OUTLIER), StatisticsUtils.q3(WITH_OUTLIER), 1.5));
    assertFalse(StatisticsUtils.isIqrOutlier(5, StatisticsUtils.q1(WITH_OUTLIER), StatisticsUtils.q3(WITH_OUTLIER), 1.5));
  }

  @Test
  public void testMad() {
    // median 3.5, deviations {2.5, 1.5, 0.5, 0.5, 1.5, 96.5} -> median 1.5
    assertEquals(1.5, StatisticsUtils.mad(WITH_OUTLIER), EPSILON);
    assertEquals(1.0, StatisticsUtils.mad(SMALL), EPSILON);
    assertEquals(0.0, StatisticsUtils.mad(new double[]{5, 5, 5}), EPSILON);
  }

  @Test
  public void testModifiedZScoreIsSymmetric() {
    double median = 50.0;
    double mad = 4.0;
    for (double t : new double[]{0.5, 1.0, 3.5, 10.0}) {
      double above = StatisticsUtils.modifiedZScore(median + t * mad / StatisticsUtils.MODIFIED_ZSCORE_FACTOR, median, mad);
      double below = StatisticsUtils.modifiedZScore(median - t * mad / StatisticsUtils.MODIFIED_ZSCORE_FACTOR, median, mad);
      assertEquals("Asymmetric modified z-score for t=" + t, Math.abs(above), Math.abs(below), EPSILON);
      assertEquals(t, above, 1E-6);
    }
    assertEquals(0.0, StatisticsUtils.modifiedZScore(100, median, 0.0), EPSILON);
    assertTrue(StatisticsUtils.isMadOutlier(100, median, mad, 3.5));
    assertFalse(StatisticsUtils.isMadOutlier(52, median, mad, 3.5));
  }

  @Test
  public void testZScore() {
    assertEquals(90.0, StatisticsUtils.zScore(1000, 100, 10), EPSILON);
    assertEquals(-2.0, StatisticsUtils.zScore(80, 100, 10), EPSILON);
    assertEquals(0.0, StatisticsUtils.zScore(1000, 100, 0), EPSILON);
    assertTrue(StatisticsUtils.isZScoreOutlier(131, 100, 10, 3.0));
    assertFalse(StatisticsUtils.isZScoreOutlier(130, 100, 10, 3.0));
  }
}
