package com.mk.fx.qa.fanout.execution.model;

/**
 * Outcome of processing one {@link WorkUnit}: exactly one of {@link Success} or {@link Failure}.
 */
public sealed interface ProcessedUnit permits Success, Failure {

  /** Identifier of the unit this outcome belongs to. */
  String unitId();

  boolean isSuccess();
}
