/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.detector;

import java.util.Collections;
import java.util.List;


/**
 * The closed set of detection algorithms.
 *
 * <ul>
 *   <li>{@link #ZSCORE}: Distance from the baseline mean in standard deviations.</li>
 *   <li>{@link #IQR}: Tukey fences around the interquartile range.</li>
 *   <li>{@link #MAD}: Modified z-score based on the median absolute deviation.</li>
 *   <li>{@link #CUSUM}: Cumulative sum control chart for sustained drift.</li>
 * </ul>
 */
public enum DetectorKind {
  ZSCORE("zscore"), IQR("iqr"), MAD("mad"), CUSUM("cusum");

  private static final List<DetectorKind> CACHED_VALUES = List.of(values());
  private final String _detectorName;

  DetectorKind(String detectorName) {
    _detectorName = detectorName;
  }

  /**
   * @return Name used for the detector in configs, metric names and anomaly events.
   */
  public String detectorName() {
    return _detectorName;
  }

  /**
   * @param detectorName Name of a detector.
   * @return The detector kind with the given name.
   * @throws IllegalArgumentException if no detector has the given name.
   */
  public static DetectorKind forDetectorName(String detectorName) {
    for (DetectorKind kind : CACHED_VALUES) {
      if (kind._detectorName.equals(detectorName)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown detector " + detectorName);
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<DetectorKind> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return _detectorName;
  }
}
