package com.mk.fx.qa.fanout.execution.substrate;

import com.mk.fx.qa.fanout.execution.exception.SubstrateUnavailableException;
import java.time.Duration;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Selects and builds the substrate for a policy once, at construction time. When the cheap-task
 * substrate cannot be built, a fixed-size worker pool with an unbounded backlog takes its place.
 */
@Slf4j
public final class SubstrateFactory {

  private SubstrateFactory() {
    throw new UnsupportedOperationException("SubstrateFactory cannot be instantiated");
  }

  public static TaskExecutionSubstrate boundedWorkerPool(
      String name, int minThreads, int maxThreads, int queueCapacity, Duration idleTimeout) {
    return new BoundedWorkerPoolSubstrate(name, minThreads, maxThreads, queueCapacity, idleTimeout);
  }

  public static TaskExecutionSubstrate cheapTask(String name, int fallbackThreads) {
    return cheapTask(name, fallbackThreads, CheapTaskSubstrate::virtualThreads);
  }

  /**
   * Builds a cheap-task substrate through {@code preferred}, falling back to a queued fixed pool of
   * {@code fallbackThreads} workers if it raises {@link SubstrateUnavailableException}.
   */
  public static TaskExecutionSubstrate cheapTask(
      String name, int fallbackThreads, Function<String, ? extends TaskExecutionSubstrate> preferred) {
    try {
      return preferred.apply(name);
    } catch (SubstrateUnavailableException e) {
      log.warn(
          "Failed to create cheap-task substrate, falling back to fixed pool of {} workers: {}",
          fallbackThreads,
          e.getMessage());
      return BoundedWorkerPoolSubstrate.queued(name + "-fallback", Math.max(1, fallbackThreads));
    }
  }
}
