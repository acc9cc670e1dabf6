package com.mk.fx.qa.fanout.execution.substrate;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/** Common submission and shutdown handling for substrates backed by an {@link ExecutorService}. */
@Slf4j
abstract class ExecutorServiceSubstrate implements TaskExecutionSubstrate {

  protected final ExecutorService executor;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  ExecutorServiceSubstrate(ExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public <T> TaskHandle<T> submit(Callable<T> task) {
    Objects.requireNonNull(task, "task");
    checkNotShutdown();
    var future = new CompletableFuture<T>();
    try {
      executor.execute(
          () -> {
            try {
              future.complete(task.call());
            } catch (Throwable t) {
              future.completeExceptionally(t);
            }
          });
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
      throw new IllegalStateException(description() + " has been shut down", e);
    }
    return new TaskHandle<>(future);
  }

  @Override
  public void shutdown(Duration drainTimeout) {
    if (!shutdown.compareAndSet(false, true)) {
      log.debug("{} already shut down", description());
      return;
    }
    var drain = drainTimeout != null ? drainTimeout : Duration.ZERO;
    try {
      executor.shutdown();
      if (executor.awaitTermination(drain.toMillis(), TimeUnit.MILLISECONDS)) {
        log.debug("{} shut down gracefully", description());
        return;
      }
      log.debug(
          "{} did not drain within {}ms, initiating forced shutdown",
          description(),
          drain.toMillis());
      executor.shutdownNow();
    } catch (InterruptedException e) {
      log.info("{} shutdown interrupted - performing immediate shutdown", description());
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  @Override
  public boolean isShutdown() {
    return shutdown.get();
  }

  private void checkNotShutdown() {
    if (shutdown.get() || executor.isShutdown()) {
      throw new IllegalStateException(description() + " has been shut down");
    }
  }
}
