package com.mk.fx.qa.fanout.execution.pool;

import com.mk.fx.qa.fanout.execution.exception.PoolTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size checkout/release pool of reusable resources.
 *
 * <p>Resources are created lazily through the factory, never more than {@code size} of them, and
 * reused indefinitely. A fair {@link Semaphore} holds one permit per resource: acquiring blocks
 * only the calling thread until a permit frees up or the wait budget elapses, in which case a
 * {@link PoolTimeoutException} is raised.
 *
 * <p>Prefer {@link #with(Duration, Function)}, which returns the resource on every exit path.
 *
 * @param <T> pooled resource type
 */
@Slf4j
public class BoundedResourcePool<T> {

  @Getter private final String name;
  @Getter private final int size;
  private final Supplier<T> factory;
  private final Semaphore permits;
  private final ConcurrentLinkedDeque<T> idle = new ConcurrentLinkedDeque<>();
  private final AtomicInteger created = new AtomicInteger();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private final AtomicReference<Consumer<? super T>> closer = new AtomicReference<>();

  public BoundedResourcePool(String name, int size, Supplier<T> factory) {
    this.name = Objects.requireNonNull(name, "name");
    if (size <= 0) {
      throw new IllegalArgumentException("Pool size must be > 0");
    }
    this.size = size;
    this.factory = Objects.requireNonNull(factory, "factory");
    this.permits = new Semaphore(size, true);
  }

  /**
   * Leases one resource, waiting at most {@code timeout} for one to become free.
   *
   * @throws PoolTimeoutException if no resource frees up in time
   * @throws IllegalStateException if the pool has been shut down
   */
  public PoolHandle<T> acquire(Duration timeout) {
    checkNotShutdown();
    var wait = timeout != null ? timeout : Duration.ZERO;
    boolean acquired;
    try {
      acquired = permits.tryAcquire(wait.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PoolTimeoutException(name, wait);
    }
    if (!acquired) {
      throw new PoolTimeoutException(name, wait);
    }
    try {
      return new PoolHandle<>(this, nextResource());
    } catch (RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  /** Returns a leased resource to the pool. Releasing the same handle twice is a no-op. */
  public void release(PoolHandle<T> handle) {
    Objects.requireNonNull(handle, "handle");
    if (handle.owner() != this) {
      throw new IllegalArgumentException("Handle does not belong to pool " + name);
    }
    if (!handle.markReleased()) {
      return;
    }
    idle.addFirst(handle.resource());
    permits.release();
    if (shutdown.get()) {
      closeIdle();
    }
  }

  /**
   * Scoped acquisition: leases a resource, applies {@code work} to it and returns it to the pool
   * whether the work completes or throws.
   */
  public <R> R with(Duration timeout, Function<? super T, ? extends R> work) {
    Objects.requireNonNull(work, "work");
    try (PoolHandle<T> handle = acquire(timeout)) {
      return work.apply(handle.get());
    }
  }

  public PoolStatus status() {
    int available = permits.availablePermits();
    return new PoolStatus(size, available, size - available);
  }

  /** Number of resources created so far. */
  public int createdCount() {
    return created.get();
  }

  /**
   * Stops handing out resources and closes the idle ones. Resources leased at that moment are
   * closed with the same {@code closer} when they are released.
   */
  public void shutdown(Consumer<? super T> closer) {
    Objects.requireNonNull(closer, "closer");
    this.closer.compareAndSet(null, closer);
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    int closed = closeIdle();
    log.debug("Pool {} shut down, closed {} idle resources", name, closed);
  }

  private int closeIdle() {
    var close = closer.get();
    T resource;
    int closed = 0;
    while ((resource = idle.pollFirst()) != null) {
      try {
        close.accept(resource);
        closed++;
      } catch (RuntimeException e) {
        log.warn("Pool {} failed to close {}: {}", name, resource, e.getMessage());
      }
    }
    return closed;
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  private T nextResource() {
    T resource = idle.pollFirst();
    if (resource != null) {
      return resource;
    }
    // a held permit guarantees created < size whenever the idle deque is empty
    T fresh = factory.get();
    created.incrementAndGet();
    log.debug("Pool {} created resource {}/{}", name, created.get(), size);
    return fresh;
  }

  private void checkNotShutdown() {
    if (shutdown.get()) {
      throw new IllegalStateException("Pool " + name + " has been shut down");
    }
  }
}
