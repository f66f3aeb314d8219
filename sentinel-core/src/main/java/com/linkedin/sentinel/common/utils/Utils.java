/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.utils;

import java.util.Collection;
import java.util.Iterator;


/**
 * Miscellaneous helpers shared by the configuration and detection code.
 */
public final class Utils {

  private Utils() {
  }

  /**
   * Create a string representation of a collection joined by the given separator.
   *
   * @param collection The collection of items to be joined.
   * @param separator The separator.
   * @param <T> The type of items.
   * @return The string representation.
   */
  public static <T> String join(Collection<T> collection, String separator) {
    StringBuilder sb = new StringBuilder();
    Iterator<T> iter = collection.iterator();
    while (iter.hasNext()) {
      sb.append(iter.next());
      if (iter.hasNext()) {
        sb.append(separator);
      }
    }
    return sb.toString();
  }

  /**
   * Checks that the specified object reference is not {@code null} and throws a customized
   * {@link IllegalArgumentException} if it is.
   *
   * @param obj The object reference to check for nullity.
   * @param errorMsg Detail message to be used in the event that an exception is thrown.
   * @param <T> The type of the reference.
   * @return {@code obj} if not {@code null}.
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * @param value Value to clamp.
   * @param min Lower bound, inclusive.
   * @param max Upper bound, inclusive.
   * @return {@code value} restricted to {@code [min, max]}.
   */
  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
