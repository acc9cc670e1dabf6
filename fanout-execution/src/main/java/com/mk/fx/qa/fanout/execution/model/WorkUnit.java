package com.mk.fx.qa.fanout.execution.model;

import java.util.Map;
import java.util.Objects;

/**
 * One logical item that needs two independent sub-fetches before it counts as processed.
 *
 * @param id unit identifier
 * @param kind unit kind, e.g. {@code test_unit}
 * @param timestamp formatted creation time
 * @param metadata free-form attributes
 */
public record WorkUnit(String id, String kind, String timestamp, Map<String, Object> metadata) {

  public WorkUnit {
    Objects.requireNonNull(id, "id");
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }
}
