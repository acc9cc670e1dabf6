package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import com.mk.fx.qa.fanout.execution.model.VirtualUser;
import com.mk.fx.qa.fanout.execution.model.WorkUnitGenerator;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a ramped population of virtual users against a {@link BatchTarget} for a fixed wall-clock
 * duration.
 *
 * <p>Users start staggered over the ramp-up window; user {@code i} of {@code N} starts {@code
 * rampUp * i / N} after the run starts. Each user repeatedly calls the target with its own unit
 * set and pauses for a random think time until the shared stop flag is set. The calling thread
 * runs the monitor loop, which logs live throughput and error rate and sets the stop flag once the
 * duration has elapsed. Users observe the flag only between iterations; the run then waits for
 * every in-flight call to finish before computing the result.
 */
@Slf4j
public class LoadGenerator {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  private final int unitsPerUser;
  private final ThinkTimeStrategy thinkTime;
  private final Duration monitorInterval;

  public LoadGenerator(int unitsPerUser, ThinkTimeStrategy thinkTime, Duration monitorInterval) {
    if (unitsPerUser <= 0) {
      throw new IllegalArgumentException("unitsPerUser must be > 0");
    }
    this.unitsPerUser = unitsPerUser;
    this.thinkTime = Objects.requireNonNull(thinkTime, "thinkTime");
    this.monitorInterval = Objects.requireNonNull(monitorInterval, "monitorInterval");
    if (monitorInterval.isNegative() || monitorInterval.isZero()) {
      throw new IllegalArgumentException("monitorInterval must be positive");
    }
  }

  /**
   * Runs {@code profile} against {@code target}. Successful calls are recorded as timings and
   * failed calls as errors in {@code metrics}, both under {@code implementation}.
   *
   * <p>Never throws for failures of the target. If the calling thread is interrupted the run stops
   * early, the interrupt flag is restored, and the figures gathered so far are reported.
   */
  public LoadRun run(
      String implementation, LoadProfile profile, BatchTarget target, MetricsCollector metrics) {
    Objects.requireNonNull(implementation, "implementation");
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(metrics, "metrics");

    var phases = new LoadPhaseTracker(implementation);
    var users = WorkUnitGenerator.virtualUsers(profile.users(), unitsPerUser);
    var counters = new RunCounters();
    var stop = new AtomicBoolean(false);
    long startNanos = System.nanoTime();
    var tracker = new UserTracker(startNanos);
    List<LoadProgress> progress = new ArrayList<>();

    log.info(
        "Load run {} starting: users={}, duration={}s, rampUp={}s, unitsPerUser={}",
        implementation,
        profile.users(),
        profile.durationSeconds(),
        profile.rampUpSeconds(),
        unitsPerUser);

    var executor = Executors.newFixedThreadPool(users.size(), threadFactory(implementation));
    List<Future<?>> futures = new ArrayList<>(users.size());
    phases.advanceTo(LoadPhase.RAMPING_UP);
    try {
      long rampMillis = TimeUnit.SECONDS.toMillis(profile.rampUpSeconds());
      for (int i = 0; i < users.size(); i++) {
        var user = users.get(i);
        long startDelayMillis = rampMillis * i / users.size();
        futures.add(
            executor.submit(
                () ->
                    runUser(
                        implementation,
                        user,
                        startDelayMillis,
                        target,
                        metrics,
                        counters,
                        tracker,
                        stop)));
      }

      monitor(implementation, profile, startNanos, counters, tracker, phases, progress);
    } catch (InterruptedException e) {
      log.warn("Load run {} interrupted, stopping early", implementation);
      Thread.currentThread().interrupt();
    } finally {
      stop.set(true);
      phases.advanceTo(LoadPhase.STOPPING);
      log.info("Load run {} stopping, waiting for users to finish", implementation);
      waitForUsers(implementation, futures);
      shutdownExecutorGracefully(executor);
    }

    var result = buildResult(profile, counters);
    phases.advanceTo(LoadPhase.REPORTED);
    log.info(
        "Load run {} finished: requests={}, errors={}, throughput={} req/s, errorRate={}%",
        implementation,
        result.totalRequests(),
        result.totalErrors(),
        result.throughput(),
        result.errorRate());
    return new LoadRun(
        implementation,
        profile,
        result,
        tracker.activity(),
        List.copyOf(progress),
        phases.transitions());
  }

  private void runUser(
      String implementation,
      VirtualUser user,
      long startDelayMillis,
      BatchTarget target,
      MetricsCollector metrics,
      RunCounters counters,
      UserTracker tracker,
      AtomicBoolean stop) {
    try {
      if (!sleepUnlessStopped(startDelayMillis, stop)) {
        return;
      }
      tracker.onUserStarted(user.id());
      log.debug("Load run {} user {} started", implementation, user.id());
      while (!stop.get()) {
        long start = System.nanoTime();
        try {
          target.processBatch(user.assignedUnits());
          double durationMs = LoadUtils.millisSince(start);
          counters.durationsMs.add(durationMs);
          metrics.recordTiming(implementation, durationMs);
        } catch (RuntimeException e) {
          counters.errors.incrementAndGet();
          metrics.recordError(implementation, e);
          log.debug("Load run {} user {} request failed: {}", implementation, user.id(), e.getMessage());
        } finally {
          counters.requests.incrementAndGet();
          tracker.onIterationCompleted(user.id());
        }
        thinkTime.pause(stop);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Load run {} user {} interrupted", implementation, user.id());
    } finally {
      tracker.onUserStopped(user.id());
    }
  }

  private void monitor(
      String implementation,
      LoadProfile profile,
      long startNanos,
      RunCounters counters,
      UserTracker tracker,
      LoadPhaseTracker phases,
      List<LoadProgress> progress)
      throws InterruptedException {
    long deadline = startNanos + TimeUnit.SECONDS.toNanos(profile.durationSeconds());
    long rampEnd = startNanos + TimeUnit.SECONDS.toNanos(profile.rampUpSeconds());
    while (true) {
      long now = System.nanoTime();
      if (phases.current() == LoadPhase.RAMPING_UP
          && (tracker.totalUsersStarted() >= profile.users() || now >= rampEnd)) {
        phases.advanceTo(LoadPhase.STEADY);
      }
      if (now >= deadline) {
        return;
      }
      long sleepNanos = Math.min(monitorInterval.toNanos(), deadline - now);
      TimeUnit.NANOSECONDS.sleep(sleepNanos);

      var snapshot = snapshot(startNanos, counters, tracker);
      progress.add(snapshot);
      logProgress(implementation, profile, snapshot);
    }
  }

  private static LoadProgress snapshot(long startNanos, RunCounters counters, UserTracker tracker) {
    double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
    long requests = counters.requests.get();
    long errors = counters.errors.get();
    double throughput = elapsedSeconds > 0 ? requests / elapsedSeconds : 0;
    double errorRate = requests > 0 ? errors * 100.0 / requests : 0;
    return new LoadProgress(
        LoadUtils.round2(elapsedSeconds),
        requests,
        errors,
        LoadUtils.round2(throughput),
        LoadUtils.round2(errorRate),
        tracker.activeUsers());
  }

  private static void logProgress(String implementation, LoadProfile profile, LoadProgress p) {
    var sb = new StringBuilder();
    sb.append("Load run ")
        .append(implementation)
        .append(" progress: requests=")
        .append(p.totalRequests())
        .append(", throughput=")
        .append(String.format("%.2f", p.throughput()))
        .append(" req/s, errors=")
        .append(String.format("%.2f", p.errorRate()))
        .append("%, activeUsers=")
        .append(p.activeUsers())
        .append(", remaining=")
        .append(Math.max(0, Math.round(profile.durationSeconds() - p.elapsedSeconds())))
        .append("s");
    log.info(sb.toString());
  }

  private static LoadProfileResult buildResult(LoadProfile profile, RunCounters counters) {
    long requests = counters.requests.get();
    long errors = counters.errors.get();
    double errorRate = requests > 0 ? errors * 100.0 / requests : 0;
    return new LoadProfileResult(
        LoadUtils.round2(requests / (double) profile.durationSeconds()),
        LoadUtils.round2(errorRate),
        LatencySummary.of(counters.durationsMs),
        requests,
        errors,
        profile.durationSeconds());
  }

  /** Waits for every user to leave its loop. In-flight calls are not cancelled. */
  private static void waitForUsers(String implementation, List<Future<?>> futures) {
    boolean interrupted = false;
    for (Future<?> future : futures) {
      while (true) {
        try {
          future.get();
          break;
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          log.error(
              "Load run {} user terminated abnormally: {}",
              implementation,
              e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
          break;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean sleepUnlessStopped(long millis, AtomicBoolean stop)
      throws InterruptedException {
    long remaining = millis;
    while (remaining > 0) {
      if (stop.get()) {
        return false;
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
    return !stop.get();
  }

  private static ThreadFactory threadFactory(String implementation) {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("load-" + implementation + "-user-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static void shutdownExecutorGracefully(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static final class RunCounters {
    final AtomicLong requests = new AtomicLong();
    final AtomicLong errors = new AtomicLong();
    final Queue<Double> durationsMs = new ConcurrentLinkedQueue<>();
  }
}
