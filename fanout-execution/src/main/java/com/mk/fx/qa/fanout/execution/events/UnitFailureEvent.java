package com.mk.fx.qa.fanout.execution.events;

import com.mk.fx.qa.fanout.execution.model.FailureKind;

/** A unit resolved to a failure record. */
public record UnitFailureEvent(
    String implementation, FailureKind kind, String unitId, String error)
    implements ProcessingEvent {

  @Override
  public String event() {
    return kind == FailureKind.TIMEOUT ? "timeout_error" : "processing_error";
  }
}
