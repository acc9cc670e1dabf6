package com.mk.fx.qa.fanout.execution.events;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Structured event emitted by the processing core; rendered as {@code {"event": ..., ...}}. */
public interface ProcessingEvent {

  @JsonProperty("event")
  String event();
}
