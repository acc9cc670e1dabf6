package com.mk.fx.qa.fanout.execution.exception;

import java.time.Duration;

/** No pooled handle became free within the caller's wait budget. */
public class PoolTimeoutException extends FanoutException {

  public PoolTimeoutException(String poolName, Duration waited) {
    super("Timed out after " + waited.toMillis() + "ms waiting for a handle from pool " + poolName);
  }
}
