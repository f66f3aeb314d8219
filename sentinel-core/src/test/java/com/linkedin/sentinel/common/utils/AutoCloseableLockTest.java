/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.utils;

import java.util.concurrent.locks.ReentrantLock;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class AutoCloseableLockTest {

  @Test
  public void testIdempotentRelease() {
    ReentrantLock lock = new ReentrantLock();
    AutoCloseableLock autoCloseableLock = new AutoCloseableLock(lock);
    assertTrue(lock.isHeldByCurrentThread());
    assertFalse(autoCloseableLock.isReleased());
    autoCloseableLock.close();
    assertTrue(autoCloseableLock.isReleased());
    assertFalse(lock.isLocked());

    // Releasing again should be a no-op
    autoCloseableLock.close();
    assertTrue(autoCloseableLock.isReleased());
    assertEquals(0, lock.getHoldCount());
  }

  @Test
  public void testTryWithResourcesReleasesOnException() {
    ReentrantLock lock = new ReentrantLock();
    assertThrows(IllegalStateException.class, () -> {
      try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
        assertTrue(lock.isHeldByCurrentThread());
        throw new IllegalStateException("boom");
      }
    });
    assertFalse(lock.isLocked());
  }

  @Test
  public void testNullLockRejected() {
    assertThrows(IllegalArgumentException.class, () -> new AutoCloseableLock(null));
  }
}
