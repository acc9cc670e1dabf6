package com.mk.fx.qa.fanout.execution.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lease on one pooled resource. Owned by a single borrower until {@link #close()} returns it to the
 * pool; closing more than once has no further effect.
 *
 * @param <T> pooled resource type
 */
public final class PoolHandle<T> implements AutoCloseable {

  private final BoundedResourcePool<T> owner;
  private final T resource;
  private final AtomicBoolean released = new AtomicBoolean(false);

  PoolHandle(BoundedResourcePool<T> owner, T resource) {
    this.owner = owner;
    this.resource = resource;
  }

  /** Returns the leased resource. */
  public T get() {
    if (released.get()) {
      throw new IllegalStateException("Handle already returned to pool " + owner.getName());
    }
    return resource;
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  BoundedResourcePool<T> owner() {
    return owner;
  }

  T resource() {
    return resource;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    owner.release(this);
  }
}
