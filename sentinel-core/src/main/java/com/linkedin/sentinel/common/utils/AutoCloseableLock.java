/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.utils;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;


/**
 * Acquires the given lock on construction and releases it on {@link #close()}, so that a per-key critical section
 * can be written as a try-with-resources block. Releasing is idempotent.
 */
public class AutoCloseableLock implements AutoCloseable {

  private final Lock _lock;
  private final AtomicBoolean _released;

  public AutoCloseableLock(Lock lock) {
    _lock = Utils.validateNotNull(lock, "Lock cannot be null");
    _released = new AtomicBoolean(false);
    _lock.lock();
  }

  @Override
  public void close() {
    if (!_released.compareAndSet(false, true)) {
      return;
    }
    try {
      _lock.unlock();
    } catch (RuntimeException e) {
      throw new IllegalStateException("Failed to release lock " + _lock, e);
    }
  }

  // Visible for testing
  boolean isReleased() {
    return _released.get();
  }
}
