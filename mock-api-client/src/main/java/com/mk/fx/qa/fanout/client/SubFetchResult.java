package com.mk.fx.qa.fanout.client;

import java.util.Map;

/**
 * Envelope returned by an {@link ApiClient}. The payload is opaque to the execution core.
 *
 * @param sourceName name of the source that produced the result
 * @param id identifier generated for this fetch
 * @param timestamp formatted time at which the payload was produced
 * @param payload arbitrary structured data
 */
public record SubFetchResult(
    String sourceName, String id, String timestamp, Map<String, Object> payload) {

  public SubFetchResult {
    payload = payload != null ? Map.copyOf(payload) : Map.of();
  }
}
