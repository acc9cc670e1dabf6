package com.mk.fx.qa.fanout.execution.events;

/**
 * Awaiting a batch failed at the batch level.
 *
 * @param degradedToEmpty whether the whole batch was reported as an empty result
 */
public record BatchFailureEvent(
    String implementation, int totalUnits, String unitId, String error, boolean degradedToEmpty)
    implements ProcessingEvent {

  @Override
  public String event() {
    return "batch_failure";
  }
}
