package com.mk.fx.qa.fanout.execution.exception;

/** The preferred scheduling substrate cannot be constructed on this runtime. */
public class SubstrateUnavailableException extends FanoutException {

  public SubstrateUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
