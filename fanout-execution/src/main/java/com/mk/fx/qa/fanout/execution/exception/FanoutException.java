package com.mk.fx.qa.fanout.execution.exception;

/** Base class for runtime failures raised by the fan-out execution core. */
public abstract class FanoutException extends RuntimeException {

  protected FanoutException(String message) {
    super(message);
  }

  protected FanoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
