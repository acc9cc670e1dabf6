package com.mk.fx.qa.fanout.execution.processor;

/** What a {@link BatchDriver} returns when awaiting a unit fails at the batch level. */
public enum BatchFailureMode {
  /** Log the failure and report the whole batch as an empty result. */
  DEGRADE_TO_EMPTY,
  /** Keep every other unit and record the failed one as a failure. */
  STRICT
}
