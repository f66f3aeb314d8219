/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.utils;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class SentinelThreadFactoryTest {

  @Test
  public void testThreadNamesAndDaemonFlag() {
    SentinelThreadFactory factory = new SentinelThreadFactory("detection");
    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });
    assertEquals("detection-0", first.getName());
    assertEquals("detection-1", second.getName());
    assertTrue(first.isDaemon());
    assertNotNull(first.getUncaughtExceptionHandler());

    Thread nonDaemon = new SentinelThreadFactory("worker", false, null).newThread(() -> { });
    assertFalse(nonDaemon.isDaemon());
  }
}
