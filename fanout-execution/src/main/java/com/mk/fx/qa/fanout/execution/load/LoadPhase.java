package com.mk.fx.qa.fanout.execution.load;

/** Lifecycle of one load run, in the only order it can be traversed. */
public enum LoadPhase {
  IDLE,
  RAMPING_UP,
  STEADY,
  STOPPING,
  REPORTED
}
