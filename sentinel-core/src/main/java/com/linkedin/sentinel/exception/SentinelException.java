/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.exception;

/**
 * The base checked exception of the Sentinel detection engine.
 */
public class SentinelException extends Exception {

  public SentinelException(String message, Throwable cause) {
    super(message, cause);
  }

  public SentinelException(String message) {
    super(message);
  }

  public SentinelException(Throwable cause) {
    super(cause);
  }
}
