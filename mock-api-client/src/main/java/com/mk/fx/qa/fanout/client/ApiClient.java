package com.mk.fx.qa.fanout.client;

/**
 * Upstream data source consulted once per sub-fetch. Implementations may block for the duration of
 * the simulated call and signal upstream failures with {@link SimulatedApiError}.
 */
public interface ApiClient extends AutoCloseable {

  /** Source name this client reports in its results, e.g. {@code primary}. */
  String sourceName();

  /**
   * Fetches one payload from the upstream source.
   *
   * @return the fetched result envelope
   * @throws SimulatedApiError when the upstream call fails
   */
  SubFetchResult fetch();

  @Override
  default void close() {}
}
