/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.stats;

/**
 * A fixed-capacity circular buffer of the most recent samples. Once full, every push evicts the oldest sample.
 * Statistics are computed on demand from a snapshot of the current contents.
 * <p>
 * This class is not thread-safe, callers serialize access per window.
 */
public class RollingWindow {
  private final double[] _buffer;
  // Index of the slot the next sample is written to.
  private int _next;
  private int _size;

  /**
   * @param capacity Maximum number of samples kept, must be positive.
   */
  public RollingWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Rolling window capacity must be positive, but is " + capacity);
    }
    _buffer = new double[capacity];
    _next = 0;
    _size = 0;
  }

  /**
   * Add a sample, evicting the oldest one if the window is full.
   *
   * @param value Sample to add.
   */
  public void push(double value) {
    _buffer[_next] = value;
    _next = (_next + 1) % _buffer.length;
    if (_size < _buffer.length) {
      _size++;
    }
  }

  public int size() {
    return _size;
  }

  public int capacity() {
    return _buffer.length;
  }

  public boolean isEmpty() {
    return _size == 0;
  }

  public boolean isFull() {
    return _size == _buffer.length;
  }

  /**
   * @return A copy of the samples in insertion order, oldest first.
   */
  public double[] values() {
    double[] values = new double[_size];
    int start = isFull() ? _next : 0;
    for (int i = 0; i < _size; i++) {
      values[i] = _buffer[(start + i) % _buffer.length];
    }
    return values;
  }

  /**
   * @return The most recently pushed sample.
   * @throws IllegalStateException if the window is empty.
   */
  public double latest() {
    if (isEmpty()) {
      throw new IllegalStateException("Rolling window is empty.");
    }
    return _buffer[(_next - 1 + _buffer.length) % _buffer.length];
  }

  public void clear() {
    _next = 0;
    _size = 0;
  }

  public double mean() {
    return StatisticsUtils.mean(values());
  }

  public double stdDev() {
    return StatisticsUtils.stdDev(values());
  }

  public double median() {
    return StatisticsUtils.median(values());
  }

  public double percentile(double percentile) {
    return StatisticsUtils.percentile(values(), percentile);
  }

  @Override
  public String toString() {
    return String.format("RollingWindow{size=%d, capacity=%d}", _size, _buffer.length);
  }
}
