package com.mk.fx.qa.fanout.execution.model;

import java.util.List;
import java.util.Objects;

/**
 * Simulated client driving repeated batch submissions against its own fixed unit set.
 *
 * @param id user identifier, e.g. {@code user_3}
 * @param assignedUnits units submitted on every iteration
 */
public record VirtualUser(String id, List<WorkUnit> assignedUnits) {

  public VirtualUser {
    Objects.requireNonNull(id, "id");
    assignedUnits = List.copyOf(assignedUnits);
  }
}
