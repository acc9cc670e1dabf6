package com.mk.fx.qa.fanout.execution.benchmark;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.fanout.execution.cfg.FanoutProperties;
import com.mk.fx.qa.fanout.execution.events.ProcessingEventPublisher;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.Success;
import com.mk.fx.qa.fanout.execution.model.WorkUnitGenerator;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementation;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementationFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BenchmarkRunnerTest {

  private static FanoutImplementationFactory fastFactory() {
    var properties = new FanoutProperties();
    properties.getSources().getPrimary().setLatency(Duration.ofMillis(1));
    properties.getSources().getPrimary().setErrorRate(0.0);
    properties.getSources().getSecondary().setLatency(Duration.ofMillis(1));
    properties.getSources().getSecondary().setErrorRate(0.0);
    properties.getClientPool().setSize(16);
    properties.getBoundedPool().setMaxThreads(16);
    properties.getBoundedPool().setQueueCapacity(64);
    properties.getCheapTask().setFallbackThreads(16);
    return new FanoutImplementationFactory(properties, mock(ProcessingEventPublisher.class));
  }

  private static FanoutImplementation mockImplementation(String name) {
    var implementation = mock(FanoutImplementation.class);
    when(implementation.getName()).thenReturn(name);
    return implementation;
  }

  @Test
  void run_benchmarksEveryImplementationInOrder() {
    var metrics = new MetricsCollector();
    var implementations = fastFactory().createAll(metrics);
    try {
      var results =
          new BenchmarkRunner(50, 2, 5, Duration.ofSeconds(5)).run(implementations, metrics);

      assertEquals(
          List.of("bounded_worker_pool", "cheap_task"),
          List.copyOf(results.implementations().keySet()));
      for (var benchmark : results.implementations().values()) {
        assertTrue(benchmark.warmupSucceeded());
        assertEquals(2, benchmark.runs().size());
        assertEquals(2, benchmark.summary().successfulRuns());
        assertTrue(benchmark.runs().stream().allMatch(run -> run.successfulUnits() == 50));
        assertEquals(2, metrics.memorySamples(benchmark.implementation()).size());
      }
      assertNotNull(results.comparison());
      assertEquals("bounded_worker_pool", results.comparison().baseline());
    } finally {
      implementations.forEach(FanoutImplementation::close);
    }
  }

  @Test
  void runOnce_failsWhenBatchDegradesToEmpty() {
    var implementation = mockImplementation("degraded");
    when(implementation.processBatch(anyList())).thenReturn(List.of());

    var run =
        new BenchmarkRunner(10, 1, 0, Duration.ofSeconds(1))
            .runOnce(implementation, WorkUnitGenerator.benchmarkUnits(10));

    assertTrue(run.isFailed());
    assertEquals(-1, run.durationMs());
  }

  @Test
  void runOnce_failsWhenBatchThrows() {
    var implementation = mockImplementation("broken");
    when(implementation.processBatch(anyList())).thenThrow(new IllegalStateException("boom"));

    var run =
        new BenchmarkRunner(10, 1, 0, Duration.ofSeconds(1))
            .runOnce(implementation, WorkUnitGenerator.benchmarkUnits(10));

    assertTrue(run.isFailed());
  }

  @Test
  void runOnce_countsSuccessfulUnits() {
    var implementation = mockImplementation("ok");
    when(implementation.processBatch(anyList()))
        .thenReturn(List.of(new Success("0", Map.of(), Instant.now().toString())));

    var run =
        new BenchmarkRunner(1, 1, 0, Duration.ofSeconds(1))
            .runOnce(implementation, WorkUnitGenerator.benchmarkUnits(1));

    assertFalse(run.isFailed());
    assertEquals(1, run.successfulUnits());
    assertEquals(0, run.failedUnits());
  }

  @Test
  void warmUp_reportsFailureWhenBudgetIsExceeded() {
    var implementation = mockImplementation("slow");
    when(implementation.processBatch(anyList()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(2000);
              return List.of();
            });

    var runner = new BenchmarkRunner(5, 1, 5, Duration.ofMillis(100));

    assertFalse(runner.warmUp(implementation, WorkUnitGenerator.benchmarkUnits(5)));
  }

  @Test
  void summary_excludesFailedRuns() {
    var benchmark =
        ImplementationBenchmark.of(
            "impl",
            true,
            List.of(
                new BenchmarkRun(10, 1024 * 1024, 1, 5, 0),
                BenchmarkRun.failed(),
                new BenchmarkRun(30, 3 * 1024 * 1024, 2, 5, 0)));

    assertEquals(2, benchmark.summary().successfulRuns());
    assertEquals(20.0, benchmark.summary().averageDurationMs());
    assertEquals(10.0, benchmark.summary().minDurationMs());
    assertEquals(30.0, benchmark.summary().maxDurationMs());
    assertEquals(3, benchmark.summary().totalGcCount());
  }

  @Test
  void comparison_reportsSpeedImprovementOfCandidate() {
    var baseline = ImplementationBenchmark.of("a", true, List.of(new BenchmarkRun(100, 0, 4, 1, 0)));
    var candidate = ImplementationBenchmark.of("b", true, List.of(new BenchmarkRun(75, 0, 1, 1, 0)));

    var comparison = BenchmarkComparison.compare(baseline, candidate).orElseThrow();

    assertEquals(25.0, comparison.speedImprovementPercent());
    assertEquals(3, comparison.gcDifference());
    assertTrue(
        BenchmarkComparison.compare(
                baseline, ImplementationBenchmark.of("c", true, List.of(BenchmarkRun.failed())))
            .isEmpty());
  }
}
