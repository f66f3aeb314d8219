/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.baseline;

import java.util.Map;


/**
 * A point-in-time view of a {@link BaselineManager}.
 */
public class BaselineManagerStats {
  private static final String TOTAL_KEYS = "totalKeys";
  private static final String VALID_KEYS = "validKeys";
  private static final String WINDOW_SIZE = "windowSize";

  private final int _totalKeys;
  private final int _validKeys;
  private final int _windowSize;

  /**
   * @param totalKeys Number of series with at least one sample.
   * @param validKeys Number of series whose baseline is valid.
   * @param windowSize Capacity of the rolling window of each series.
   */
  public BaselineManagerStats(int totalKeys, int validKeys, int windowSize) {
    _totalKeys = totalKeys;
    _validKeys = validKeys;
    _windowSize = windowSize;
  }

  public int totalKeys() {
    return _totalKeys;
  }

  public int validKeys() {
    return _validKeys;
  }

  public int windowSize() {
    return _windowSize;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    return Map.of(TOTAL_KEYS, _totalKeys, VALID_KEYS, _validKeys, WINDOW_SIZE, _windowSize);
  }

  @Override
  public String toString() {
    return String.format("{totalKeys:%d, validKeys:%d, windowSize:%d}", _totalKeys, _validKeys, _windowSize);
  }
}
