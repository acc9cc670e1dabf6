package com.mk.fx.qa.fanout.execution.substrate;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Awaitable reference to one submitted task.
 *
 * @param <T> result type
 */
public final class TaskHandle<T> {

  private final CompletableFuture<T> future;

  TaskHandle(CompletableFuture<T> future) {
    this.future = Objects.requireNonNull(future, "future");
  }

  public boolean isDone() {
    return future.isDone();
  }

  CompletableFuture<T> future() {
    return future;
  }
}
