package com.mk.fx.qa.fanout.execution.exception;

import java.time.Duration;

/**
 * A submitted task did not complete within the waiter's window. The task itself keeps running;
 * only the wait is abandoned.
 */
public class TaskTimeoutException extends Exception {

  private final Duration timeout;

  public TaskTimeoutException(Duration timeout) {
    super("Task did not complete within " + timeout.toMillis() + "ms");
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
