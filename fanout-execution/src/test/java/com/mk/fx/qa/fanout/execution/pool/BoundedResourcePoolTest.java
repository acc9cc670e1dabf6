package com.mk.fx.qa.fanout.execution.pool;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.fanout.execution.exception.PoolTimeoutException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class BoundedResourcePoolTest {

  private static BoundedResourcePool<Object> pool(int size) {
    return new BoundedResourcePool<>("test", size, Object::new);
  }

  @Test
  void status_inUsePlusAvailableEqualsSize() {
    var pool = pool(3);
    assertEquals(new PoolStatus(3, 3, 0), pool.status());

    var first = pool.acquire(Duration.ofMillis(100));
    var second = pool.acquire(Duration.ofMillis(100));
    var status = pool.status();
    assertEquals(2, status.inUse());
    assertEquals(1, status.available());
    assertEquals(status.size(), status.inUse() + status.available());

    first.close();
    second.close();
    assertEquals(new PoolStatus(3, 3, 0), pool.status());
  }

  @Test
  void resourcesAreCreatedLazilyAndReused() {
    var created = new AtomicInteger();
    var pool =
        new BoundedResourcePool<>(
            "lazy",
            4,
            () -> {
              created.incrementAndGet();
              return new Object();
            });
    assertEquals(0, created.get());

    Object firstLease = pool.with(Duration.ofMillis(100), r -> r);
    Object secondLease = pool.with(Duration.ofMillis(100), r -> r);

    assertSame(firstLease, secondLease);
    assertEquals(1, created.get());
    assertEquals(1, pool.createdCount());
  }

  @Test
  void acquire_failsWithPoolTimeout_whenExhausted() {
    var pool = pool(1);
    var held = pool.acquire(Duration.ofMillis(100));

    long start = System.nanoTime();
    assertThrows(PoolTimeoutException.class, () -> pool.acquire(Duration.ofMillis(150)));
    long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    assertTrue(waitedMs >= 100, "should have waited for the budget, waited " + waitedMs);

    held.close();
    assertEquals(1, pool.status().available());
  }

  @Test
  void secondBorrowerBlocksUntilFirstReleases() throws Exception {
    var pool = pool(1);
    var firstHandle = pool.acquire(Duration.ofMillis(100));
    var secondAcquired = new CountDownLatch(1);
    var secondResource = new AtomicReference<Object>();

    Thread borrower =
        new Thread(
            () ->
                pool.with(
                    Duration.ofSeconds(2),
                    resource -> {
                      secondResource.set(resource);
                      secondAcquired.countDown();
                      return null;
                    }));
    borrower.start();

    assertFalse(secondAcquired.await(150, TimeUnit.MILLISECONDS), "must block while held");
    Object firstResource = firstHandle.get();
    firstHandle.close();

    assertTrue(secondAcquired.await(2, TimeUnit.SECONDS));
    borrower.join(2000);
    assertSame(firstResource, secondResource.get());
  }

  @Test
  void with_releasesOnException() {
    var pool = pool(1);

    assertThrows(
        IllegalStateException.class,
        () ->
            pool.with(
                Duration.ofMillis(100),
                r -> {
                  throw new IllegalStateException("boom");
                }));

    assertEquals(new PoolStatus(1, 1, 0), pool.status());
    assertNotNull(pool.acquire(Duration.ofMillis(50)));
  }

  @Test
  void release_isIdempotent_andHandleUnusableAfterwards() {
    var pool = pool(2);
    var handle = pool.acquire(Duration.ofMillis(100));

    handle.close();
    handle.close();

    assertTrue(handle.isReleased());
    assertEquals(2, pool.status().available());
    assertThrows(IllegalStateException.class, handle::get);
  }

  @Test
  void release_rejectsForeignHandle() {
    var pool = pool(1);
    var other = pool(1);
    var foreign = other.acquire(Duration.ofMillis(100));

    assertThrows(IllegalArgumentException.class, () -> pool.release(foreign));
  }

  @Test
  void factoryFailure_returnsPermit() {
    var pool =
        new BoundedResourcePool<Object>(
            "broken",
            1,
            () -> {
              throw new IllegalStateException("cannot create");
            });

    assertThrows(IllegalStateException.class, () -> pool.acquire(Duration.ofMillis(100)));
    assertEquals(1, pool.status().available());
  }

  @Test
  void shutdown_closesIdleResources_andRejectsAcquisition() {
    var closed = new AtomicInteger();
    var pool = pool(2);
    pool.with(Duration.ofMillis(100), r -> r);

    pool.shutdown(r -> closed.incrementAndGet());

    assertTrue(pool.isShutdown());
    assertEquals(1, closed.get());
    assertThrows(IllegalStateException.class, () -> pool.acquire(Duration.ofMillis(10)));
  }

  @Test
  void release_afterShutdown_closesLeasedResource() {
    var closed = new AtomicInteger();
    var pool = pool(2);
    var held = pool.acquire(Duration.ofMillis(100));
    pool.with(Duration.ofMillis(100), r -> r);

    pool.shutdown(r -> closed.incrementAndGet());
    assertEquals(1, closed.get());

    held.close();

    assertEquals(2, closed.get());
    held.close();
    assertEquals(2, closed.get());
  }

  @Test
  void constructor_rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> pool(0));
  }
}
