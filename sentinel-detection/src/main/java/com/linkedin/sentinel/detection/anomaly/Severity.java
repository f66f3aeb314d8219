/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.anomaly;

/**
 * Coarse ranking of an anomaly's significance, declared from the least to the most severe.
 */
public enum Severity {
  LOW, MEDIUM, HIGH, CRITICAL;

  /**
   * @param other Severity to compare with.
   * @return {@code true} if this severity is strictly more severe than the other one.
   */
  public boolean isMoreSevereThan(Severity other) {
    return compareTo(other) > 0;
  }
}
