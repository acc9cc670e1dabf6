package com.mk.fx.qa.fanout.execution.substrate;

/** Scheduling policies a {@link TaskExecutionSubstrate} can implement. */
public enum SubstratePolicy {
  /** Fixed/bounded worker count, bounded backlog, run-on-caller when saturated. */
  BOUNDED_WORKER_POOL,
  /** One cheap task per submission, no substrate-imposed concurrency ceiling. */
  CHEAP_TASK
}
