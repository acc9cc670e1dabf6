package com.mk.fx.qa.fanout.execution.substrate;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded worker pool: between {@code minThreads} and {@code maxThreads} workers, a backlog of at
 * most {@code queueCapacity} tasks, and run-on-caller when both are saturated. Workers above the
 * minimum are reclaimed after {@code idleTimeout}.
 *
 * <p>A {@code queueCapacity} of zero hands tasks straight to a worker or back to the caller.
 * Tasks submitted after the executor has shut down are rejected, never run on the caller.
 */
@Slf4j
public class BoundedWorkerPoolSubstrate extends ExecutorServiceSubstrate {

  private final String name;
  private final ThreadPoolExecutor pool;

  public BoundedWorkerPoolSubstrate(
      String name, int minThreads, int maxThreads, int queueCapacity, Duration idleTimeout) {
    this(name, createPool(name, minThreads, maxThreads, queueCapacity, idleTimeout));
  }

  private BoundedWorkerPoolSubstrate(String name, ThreadPoolExecutor pool) {
    super(pool);
    this.name = name;
    this.pool = pool;
    log.info(
        "{} initialised - min: {}, max: {}, queue: {}, idle: {}s",
        name,
        pool.getCorePoolSize(),
        pool.getMaximumPoolSize(),
        pool.getQueue().remainingCapacity(),
        pool.getKeepAliveTime(TimeUnit.SECONDS));
  }

  /** Fixed-size pool with no backlog. */
  @VisibleForTesting
  public static BoundedWorkerPoolSubstrate fixed(String name, int threads) {
    return new BoundedWorkerPoolSubstrate(name, threads, threads, 0, Duration.ofSeconds(60));
  }

  /**
   * Fixed-size pool whose backlog is unbounded, so submitters never run tasks themselves. Used
   * when the cheap-task substrate is not available.
   */
  public static BoundedWorkerPoolSubstrate queued(String name, int threads) {
    if (threads <= 0) {
      throw new IllegalArgumentException("threads must be > 0");
    }
    return new BoundedWorkerPoolSubstrate(
        name,
        new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            threadFactory(name),
            new CallerRunsUnlessShutdown()));
  }

  private static ThreadPoolExecutor createPool(
      String name, int minThreads, int maxThreads, int queueCapacity, Duration idleTimeout) {
    if (minThreads < 0 || maxThreads <= 0 || maxThreads < minThreads) {
      throw new IllegalArgumentException(
          "Invalid worker bounds min=" + minThreads + " max=" + maxThreads);
    }
    if (queueCapacity < 0) {
      throw new IllegalArgumentException("queueCapacity must be >= 0");
    }
    BlockingQueue<Runnable> queue =
        queueCapacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(queueCapacity);
    var idle = idleTimeout != null ? idleTimeout : Duration.ofSeconds(60);
    return new ThreadPoolExecutor(
        minThreads,
        maxThreads,
        idle.toMillis(),
        TimeUnit.MILLISECONDS,
        queue,
        threadFactory(name),
        new CallerRunsUnlessShutdown());
  }

  private static ThreadFactory threadFactory(String name) {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(name + "-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /**
   * Runs a saturated pool's task on the submitting thread, but rejects it once the executor is shut
   * down, where {@link ThreadPoolExecutor.CallerRunsPolicy} would drop it silently.
   */
  static final class CallerRunsUnlessShutdown implements RejectedExecutionHandler {

    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
      if (executor.isShutdown()) {
        throw new RejectedExecutionException("Executor has been shut down");
      }
      task.run();
    }
  }

  @Override
  public SubstratePolicy policy() {
    return SubstratePolicy.BOUNDED_WORKER_POOL;
  }

  @Override
  public String description() {
    return name;
  }

  @Override
  public Optional<ExecutorStats> stats() {
    return Optional.of(
        new ExecutorStats(
            pool.getCompletedTaskCount(),
            pool.getQueue().size(),
            pool.getPoolSize(),
            pool.getActiveCount()));
  }
}
