package com.mk.fx.qa.fanout.execution.events;

/** A sub-fetch raised an error. */
public record ApiErrorEvent(String implementation, String api, String unitId, String error)
    implements ProcessingEvent {

  @Override
  public String event() {
    return "api_error";
  }
}
