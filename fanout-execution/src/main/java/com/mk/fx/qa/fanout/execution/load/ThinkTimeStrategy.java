package com.mk.fx.qa.fanout.execution.load;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Random pause in {@code [0, max)} between the iterations of a virtual user. */
public class ThinkTimeStrategy {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  private final long maxMillis;

  public ThinkTimeStrategy(Duration max) {
    this.maxMillis = max != null ? Math.max(0, max.toMillis()) : 0;
  }

  public static ThinkTimeStrategy none() {
    return new ThinkTimeStrategy(Duration.ZERO);
  }

  public boolean isEnabled() {
    return maxMillis > 0;
  }

  /**
   * Sleeps for a random delay, returning early once {@code stop} is set.
   *
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  public void pause(AtomicBoolean stop) throws InterruptedException {
    if (!isEnabled()) {
      return;
    }
    var remaining = ThreadLocalRandom.current().nextLong(maxMillis);
    while (remaining > 0 && !stop.get()) {
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
  }
}
