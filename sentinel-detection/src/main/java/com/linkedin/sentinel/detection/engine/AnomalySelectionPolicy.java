/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.detection.engine;

import java.util.List;


/**
 * How the engine picks the reported anomaly when more than one detector fires on an event.
 *
 * <ul>
 *   <li>{@link #FIRST_MATCH}: The anomaly of the first detector to fire in the configured order. The remaining
 *   detectors are not run.</li>
 *   <li>{@link #HIGHEST_SEVERITY}: All detectors run and the most severe anomaly is reported. Ties go to the
 *   detector earliest in the configured order.</li>
 * </ul>
 */
public enum AnomalySelectionPolicy {
  FIRST_MATCH("first_match"), HIGHEST_SEVERITY("highest_severity");

  private static final List<AnomalySelectionPolicy> CACHED_VALUES = List.of(values());
  private final String _policyName;

  AnomalySelectionPolicy(String policyName) {
    _policyName = policyName;
  }

  public String policyName() {
    return _policyName;
  }

  /**
   * @param policyName Config value of a policy.
   * @return The policy with the given name.
   * @throws IllegalArgumentException if no policy has the given name.
   */
  public static AnomalySelectionPolicy forPolicyName(String policyName) {
    for (AnomalySelectionPolicy policy : CACHED_VALUES) {
      if (policy._policyName.equals(policyName)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unknown anomaly selection policy " + policyName);
  }

  @Override
  public String toString() {
    return _policyName;
  }
}
