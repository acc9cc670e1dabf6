package com.mk.fx.qa.fanout.execution.load;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import com.mk.fx.qa.fanout.execution.model.ProcessedUnit;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LoadGeneratorTest {

  private static List<ProcessedUnit> sleepFor(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return List.of();
  }

  @Test
  void run_rampsAllUsersAndStopsAtDuration() {
    var generator =
        new LoadGenerator(
            10, new ThinkTimeStrategy(Duration.ofMillis(100)), Duration.ofSeconds(1));
    var metrics = new MetricsCollector();
    Queue<Long> callStarts = new ConcurrentLinkedQueue<>();
    long runStart = System.nanoTime();

    var run =
        generator.run(
            "impl",
            new LoadProfile(10, 5, 2),
            units -> {
              assertEquals(10, units.size());
              callStarts.add(System.nanoTime());
              return sleepFor(20);
            },
            metrics);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - runStart);

    assertEquals(10, run.usersStarted());
    assertTrue(
        run.users().stream().allMatch(u -> u.startOffsetMs() < 2000),
        "all users start within the ramp-up window: " + run.users());
    assertTrue(run.users().stream().allMatch(u -> u.iterations() >= 1));
    assertTrue(run.result().totalRequests() >= 10);
    assertEquals(0, run.result().totalErrors());
    assertEquals(5, run.result().duration());
    assertTrue(elapsedMs >= 5000, "ran for " + elapsedMs + "ms");

    long stopAt = runStart + TimeUnit.SECONDS.toNanos(5) + TimeUnit.MILLISECONDS.toNanos(200);
    assertTrue(callStarts.stream().allMatch(start -> start <= stopAt));

    assertEquals(run.result().totalRequests(), metrics.timingSamples("impl").size());
    assertTrue(run.result().latency().min() >= 19.0);
    assertFalse(run.progress().isEmpty());
    assertEquals(
        List.of(
            LoadPhase.IDLE,
            LoadPhase.RAMPING_UP,
            LoadPhase.STEADY,
            LoadPhase.STOPPING,
            LoadPhase.REPORTED),
        run.phases().stream().map(PhaseTransition::phase).collect(Collectors.toList()));
  }

  @Test
  void run_countsFailedCallsAsErrors() {
    var generator = new LoadGenerator(2, ThinkTimeStrategy.none(), Duration.ofMillis(200));
    var metrics = new MetricsCollector();

    var run =
        generator.run(
            "failing",
            new LoadProfile(2, 1, 0),
            units -> {
              sleepFor(10);
              throw new IllegalStateException("upstream down");
            },
            metrics);

    assertTrue(run.result().totalRequests() >= 2);
    assertEquals(run.result().totalRequests(), run.result().totalErrors());
    assertEquals(100.0, run.result().errorRate(), 1e-9);
    assertEquals(new LatencySummary(0, 0, 0, 0, 0, 0, 0), run.result().latency());
    assertEquals(run.result().totalErrors(), metrics.errorSamples("failing").size());
    assertEquals("upstream down", metrics.errorSamples("failing").get(0).message());
  }

  @Test
  void run_waitsForInFlightCallsWithoutInterruptingThem() {
    var generator = new LoadGenerator(1, ThinkTimeStrategy.none(), Duration.ofMillis(200));
    Queue<Boolean> completedNormally = new ConcurrentLinkedQueue<>();

    generator.run(
        "slow",
        new LoadProfile(1, 1, 0),
        units -> {
          sleepFor(700);
          completedNormally.add(!Thread.currentThread().isInterrupted());
          return List.of();
        },
        new MetricsCollector());

    assertFalse(completedNormally.isEmpty());
    assertTrue(completedNormally.stream().allMatch(Boolean::booleanValue));
  }

  @Test
  void constructor_rejectsInvalidSettings() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LoadGenerator(0, ThinkTimeStrategy.none(), Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LoadGenerator(1, ThinkTimeStrategy.none(), Duration.ZERO));
  }
}
