package com.mk.fx.qa.fanout.execution.substrate;

import com.mk.fx.qa.fanout.execution.exception.TaskTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs submitted work concurrently and hands back awaitable handles.
 *
 * <p>Timeouts only release the waiter: a task that outlives its wait keeps running in the
 * background until it completes or fails.
 */
public interface TaskExecutionSubstrate {

  SubstratePolicy policy();

  /** Short human-readable description used in logs and reports. */
  String description();

  /**
   * Schedules {@code task} and returns a handle to its eventual result.
   *
   * @throws IllegalStateException if the substrate has been shut down
   */
  <T> TaskHandle<T> submit(Callable<T> task);

  /**
   * Waits up to {@code timeout} for the task behind {@code handle}.
   *
   * @throws TaskTimeoutException if the task is still running when the window closes
   * @throws ExecutionException if the task failed; the cause is the task's exception
   * @throws InterruptedException if the waiting thread is interrupted
   */
  default <T> T await(TaskHandle<T> handle, Duration timeout)
      throws TaskTimeoutException, ExecutionException, InterruptedException {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(timeout, "timeout");
    try {
      return handle.future().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      throw new TaskTimeoutException(timeout);
    }
  }

  /** Pool statistics, present only for bounded worker pools. */
  Optional<ExecutorStats> stats();

  /**
   * Stops accepting work and waits up to {@code drainTimeout} for running tasks before forcing
   * termination. Safe to call more than once.
   */
  void shutdown(Duration drainTimeout);

  boolean isShutdown();
}
