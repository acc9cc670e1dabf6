package com.mk.fx.qa.fanout.execution.model;

import java.util.Objects;

/**
 * A unit could not be processed. No partial results are kept.
 *
 * @param kind why the unit failed
 * @param unitId unit identifier
 * @param message description of the underlying error
 */
public record Failure(FailureKind kind, String unitId, String message) implements ProcessedUnit {

  public Failure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(unitId, "unitId");
  }

  @Override
  public boolean isSuccess() {
    return false;
  }
}
