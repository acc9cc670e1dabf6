package com.mk.fx.qa.fanout.execution.processor;

import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.pool.ApiClientPool;
import com.mk.fx.qa.fanout.execution.substrate.SubstrateFactory;
import com.mk.fx.qa.fanout.execution.substrate.TaskExecutionSubstrate;
import java.time.Duration;

/**
 * Fan-out on a bounded worker pool with a backlog queue and run-on-caller saturation. Sub-fetches
 * run on a second pool named {@code bounded_worker_pool-fetch} with twice the maximum workers,
 * since every running unit issues two of them.
 */
public class BoundedWorkerPoolImplementation extends FanoutImplementation {

  public static final String NAME = "bounded_worker_pool";
  public static final String FETCH_NAME = NAME + "-fetch";

  /**
   * @param workers worker bounds and backlog of the pool; see {@link SubstrateFactory}
   */
  public BoundedWorkerPoolImplementation(
      WorkerBounds workers,
      ApiClientPool primary,
      ApiClientPool secondary,
      Timeouts timeouts,
      BatchFailureMode failureMode,
      ProcessingEventPublisher publisher,
      MetricsCollector metrics) {
    this(
        SubstrateFactory.boundedWorkerPool(
            NAME,
            workers.minThreads(),
            workers.maxThreads(),
            workers.queueCapacity(),
            workers.idleTimeout()),
        SubstrateFactory.boundedWorkerPool(
            FETCH_NAME,
            workers.minThreads(),
            workers.maxThreads() * 2,
            workers.queueCapacity(),
            workers.idleTimeout()),
        primary,
        secondary,
        timeouts,
        failureMode,
        publisher,
        metrics);
  }

  BoundedWorkerPoolImplementation(
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

  /** Resolved worker-pool shape; a {@code queueCapacity} of 0 means direct hand-off. */
  public record WorkerBounds(
      int minThreads, int maxThreads, int queueCapacity, Duration idleTimeout) {}
}
