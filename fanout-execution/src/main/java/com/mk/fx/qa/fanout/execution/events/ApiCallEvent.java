package com.mk.fx.qa.fanout.execution.events;

/** One sub-fetch attempt finished, successfully or not. */
public record ApiCallEvent(
    String implementation, String api, String unitId, double durationMs, boolean success)
    implements ProcessingEvent {

  @Override
  public String event() {
    return "api_call";
  }
}
