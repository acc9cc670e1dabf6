package com.mk.fx.qa.fanout.client;

/** Raised by {@link MockApiClient} when a call is chosen to fail. */
public class SimulatedApiError extends RuntimeException {

  private final String sourceName;

  public SimulatedApiError(String sourceName) {
    super(sourceName + " API Error");
    this.sourceName = sourceName;
  }

  public String getSourceName() {
    return sourceName;
  }
}
