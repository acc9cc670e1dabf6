package com.mk.fx.qa.fanout.execution.substrate;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.fanout.execution.exception.TaskTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BoundedWorkerPoolSubstrateTest {

  private TaskExecutionSubstrate substrate;

  @AfterEach
  void tearDown() {
    if (substrate != null) {
      substrate.shutdown(Duration.ofSeconds(1));
    }
  }

  @Test
  void submitAndAwait_returnsTaskResult() throws Exception {
    substrate = new BoundedWorkerPoolSubstrate("pool", 1, 2, 4, Duration.ofSeconds(1));

    var handle = substrate.submit(() -> 21 * 2);

    assertEquals(42, substrate.await(handle, Duration.ofSeconds(1)));
    assertEquals(SubstratePolicy.BOUNDED_WORKER_POOL, substrate.policy());
  }

  @Test
  void await_wrapsTaskFailureInExecutionException() {
    substrate = BoundedWorkerPoolSubstrate.fixed("pool", 1);

    var handle =
        substrate.submit(
            () -> {
              throw new IllegalStateException("task failed");
            });

    var error =
        assertThrows(ExecutionException.class, () -> substrate.await(handle, Duration.ofSeconds(1)));
    assertInstanceOf(IllegalStateException.class, error.getCause());
  }

  @Test
  void await_timesOutWithoutCancellingTask() throws Exception {
    substrate = BoundedWorkerPoolSubstrate.fixed("pool", 1);
    var release = new CountDownLatch(1);
    var finished = new AtomicBoolean(false);

    var handle =
        substrate.submit(
            () -> {
              release.await(2, TimeUnit.SECONDS);
              finished.set(true);
              return "late";
            });

    var timeout =
        assertThrows(
            TaskTimeoutException.class, () -> substrate.await(handle, Duration.ofMillis(50)));
    assertEquals(Duration.ofMillis(50), timeout.getTimeout());
    assertFalse(handle.isDone());

    release.countDown();
    assertEquals("late", substrate.await(handle, Duration.ofSeconds(2)));
    assertTrue(finished.get());
  }

  @Test
  void saturatedPool_runsTaskOnCaller() throws Exception {
    substrate = BoundedWorkerPoolSubstrate.fixed("pool", 1);
    var blockWorker = new CountDownLatch(1);
    var workerStarted = new CountDownLatch(1);
    substrate.submit(
        () -> {
          workerStarted.countDown();
          blockWorker.await(2, TimeUnit.SECONDS);
          return null;
        });
    assertTrue(workerStarted.await(1, TimeUnit.SECONDS));

    var runner = new AtomicReference<Thread>();
    var handle =
        substrate.submit(
            () -> {
              runner.set(Thread.currentThread());
              return "inline";
            });

    assertTrue(handle.isDone());
    assertSame(Thread.currentThread(), runner.get());
    assertEquals("inline", substrate.await(handle, Duration.ofMillis(10)));
    blockWorker.countDown();
  }

  @Test
  void stats_reportPoolSnapshot() throws Exception {
    substrate = new BoundedWorkerPoolSubstrate("pool", 2, 4, 8, Duration.ofSeconds(1));
    substrate.await(substrate.submit(() -> "done"), Duration.ofSeconds(1));

    var stats = substrate.stats().orElseThrow();

    assertTrue(stats.poolSize() >= 1);
    assertEquals(0, stats.queueLength());
  }

  @Test
  void submitAfterShutdown_isRejected() {
    substrate = BoundedWorkerPoolSubstrate.fixed("pool", 1);
    substrate.shutdown(Duration.ofMillis(100));
    substrate.shutdown(Duration.ofMillis(100));

    assertTrue(substrate.isShutdown());
    assertThrows(IllegalStateException.class, () -> substrate.submit(() -> "nope"));
  }

  @Test
  void callerRunsUnlessShutdown_runsOnCallerWhileLive_rejectsOnceShutDown() {
    var handler = new BoundedWorkerPoolSubstrate.CallerRunsUnlessShutdown();
    var executor = handOffExecutor(handler);
    var runner = new AtomicReference<Thread>();
    try {
      handler.rejectedExecution(() -> runner.set(Thread.currentThread()), executor);
      assertSame(Thread.currentThread(), runner.get());
    } finally {
      executor.shutdown();
    }

    var ran = new AtomicBoolean(false);
    assertThrows(
        RejectedExecutionException.class,
        () -> handler.rejectedExecution(() -> ran.set(true), executor));
    assertFalse(ran.get());
  }

  @Test
  void submit_racingExecutorShutdown_failsInsteadOfLosingTask() {
    var closed = handOffExecutor(new BoundedWorkerPoolSubstrate.CallerRunsUnlessShutdown());
    closed.shutdown();
    var ran = new AtomicBoolean(false);
    var racing =
        new ExecutorServiceSubstrate(stillOpenView(closed)) {
          @Override
          public SubstratePolicy policy() {
            return SubstratePolicy.BOUNDED_WORKER_POOL;
          }

          @Override
          public String description() {
            return "racing";
          }

          @Override
          public Optional<ExecutorStats> stats() {
            return Optional.empty();
          }
        };

    var error =
        assertThrows(
            IllegalStateException.class,
            () ->
                racing.submit(
                    () -> {
                      ran.set(true);
                      return "lost";
                    }));
    assertInstanceOf(RejectedExecutionException.class, error.getCause());
    assertFalse(ran.get());
  }

  @Test
  void queued_neverRunsOnCaller_andBacklogsInstead() throws Exception {
    substrate = BoundedWorkerPoolSubstrate.queued("queued", 1);
    var blockWorker = new CountDownLatch(1);
    var workerStarted = new CountDownLatch(1);
    substrate.submit(
        () -> {
          workerStarted.countDown();
          blockWorker.await(2, TimeUnit.SECONDS);
          return null;
        });
    assertTrue(workerStarted.await(1, TimeUnit.SECONDS));

    var runner = new AtomicReference<Thread>();
    var handles =
        List.of(
            substrate.submit(() -> runner.getAndSet(Thread.currentThread())),
            substrate.submit(() -> runner.getAndSet(Thread.currentThread())));

    assertFalse(handles.get(0).isDone());
    assertEquals(2, substrate.stats().orElseThrow().queueLength());
    assertEquals(1, substrate.stats().orElseThrow().poolSize());

    blockWorker.countDown();
    for (var handle : handles) {
      substrate.await(handle, Duration.ofSeconds(2));
    }
    assertNotSame(Thread.currentThread(), runner.get());
    assertTrue(runner.get().getName().startsWith("queued-worker-"));
  }

  private static ThreadPoolExecutor handOffExecutor(
      BoundedWorkerPoolSubstrate.CallerRunsUnlessShutdown handler) {
    return new ThreadPoolExecutor(
        1, 1, 0L, TimeUnit.MILLISECONDS, new SynchronousQueue<>(), handler);
  }

  /** Reports open while delegating to {@code delegate}, as seen between a check and a submit. */
  private static ExecutorService stillOpenView(ExecutorService delegate) {
    return new AbstractExecutorService() {
      @Override
      public void execute(Runnable command) {
        delegate.execute(command);
      }

      @Override
      public void shutdown() {
        delegate.shutdown();
      }

      @Override
      public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
      }

      @Override
      public boolean isShutdown() {
        return false;
      }

      @Override
      public boolean isTerminated() {
        return false;
      }

      @Override
      public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
      }
    };
  }

  @Test
  void constructor_rejectsInvalidBounds() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new BoundedWorkerPoolSubstrate("bad", 4, 2, 0, Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new BoundedWorkerPoolSubstrate("bad", 1, 2, -1, Duration.ofSeconds(1)));
  }
}
