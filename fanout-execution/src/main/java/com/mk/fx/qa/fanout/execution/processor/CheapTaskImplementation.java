package com.mk.fx.qa.fanout.execution.processor;

import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.pool.ApiClientPool;
import com.mk.fx.qa.fanout.execution.substrate.SubstrateFactory;
import com.mk.fx.qa.fanout.execution.substrate.TaskExecutionSubstrate;

/**
 * Fan-out with one cheap task per submission. Units and sub-fetches get a substrate each. When the
 * runtime cannot provide cheap tasks, each falls back to a queued fixed pool: {@code
 * fallbackThreads} workers for units and twice that for sub-fetches.
 */
public class CheapTaskImplementation extends FanoutImplementation {

  public static final String NAME = "cheap_task";
  public static final String FETCH_NAME = NAME + "-fetch";

  public CheapTaskImplementation(
      int fallbackThreads,
      ApiClientPool primary,
      ApiClientPool secondary,
      Timeouts timeouts,
      BatchFailureMode failureMode,
      ProcessingEventPublisher publisher,
      MetricsCollector metrics) {
    this(
        SubstrateFactory.cheapTask(NAME, fallbackThreads),
        SubstrateFactory.cheapTask(FETCH_NAME, fallbackThreads * 2),
        primary,
        secondary,
        timeouts,
        failureMode,
        publisher,
        metrics);
  }

  CheapTaskImplementation(
      TaskExecutionSubstrate substrate,
      TaskExecutionSubstrate fetchSubstrate,
      ApiClientPool primary,
      ApiClientPool secondary,
      Timeouts timeouts,
      BatchFailureMode failureMode,
      ProcessingEventPublisher publisher,
      MetricsCollector metrics) {
    super(
        NAME,
        substrate,
        fetchSubstrate,
        primary,
        secondary,
        timeouts,
        failureMode,
        publisher,
        metrics);
  }
}
