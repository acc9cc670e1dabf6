package com.mk.fx.qa.fanout.execution.exception;

/** Unexpected failure while awaiting the units of a batch. */
public class BatchFailureException extends FanoutException {

  private final String unitId;

  public BatchFailureException(String unitId, String message, Throwable cause) {
    super(message, cause);
    this.unitId = unitId;
  }

  public String getUnitId() {
    return unitId;
  }
}
