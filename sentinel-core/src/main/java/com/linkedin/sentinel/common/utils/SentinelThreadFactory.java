/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Creates threads named {@code <name>-<id>} that log, rather than silently drop, exceptions escaping their task.
 */
public class SentinelThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(SentinelThreadFactory.class);
  private final String _name;
  private final boolean _daemon;
  private final AtomicInteger _id = new AtomicInteger(0);
  private final Logger _logger;

  /**
   * Create a factory of daemon threads.
   *
   * @param name Prefix of the thread names.
   */
  public SentinelThreadFactory(String name) {
    this(name, true, null);
  }

  /**
   * @param name Prefix of the thread names.
   * @param daemon Whether the created threads are daemon threads.
   * @param logger Logger for uncaught exceptions, {@code null} to use the logger of this class.
   */
  public SentinelThreadFactory(String name, boolean daemon, Logger logger) {
    _name = Utils.validateNotNull(name, "Thread name prefix cannot be null.");
    _daemon = daemon;
    _logger = logger == null ? LOG : logger;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, _name + "-" + _id.getAndIncrement());
    t.setDaemon(_daemon);
    t.setUncaughtExceptionHandler((thread, e) -> _logger.error("Uncaught exception in {}: ", thread.getName(), e));
    return t;
  }
}
