package com.mk.fx.qa.fanout.execution.benchmark;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.fanout.execution.metrics.MetricsCollector;
import com.mk.fx.qa.fanout.execution.model.ProcessedUnit;
import com.mk.fx.qa.fanout.execution.model.WorkUnit;
import com.mk.fx.qa.fanout.execution.model.WorkUnitGenerator;
import com.mk.fx.qa.fanout.execution.processor.FanoutImplementation;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-shot comparison: warms every implementation up, then times a fixed number of passes over
 * the same benchmark units, recording duration, heap growth and garbage collections per pass.
 */
@Slf4j
public class BenchmarkRunner {

  private final int units;
  private final int iterations;
  private final int warmupUnits;
  private final Duration warmupTimeout;

  public BenchmarkRunner(int units, int iterations, int warmupUnits, Duration warmupTimeout) {
    if (units <= 0 || iterations <= 0 || warmupUnits < 0) {
      throw new IllegalArgumentException(
          "Invalid benchmark size units=" + units + " iterations=" + iterations);
    }
    this.units = units;
    this.iterations = iterations;
    this.warmupUnits = warmupUnits;
    this.warmupTimeout = warmupTimeout != null ? warmupTimeout : Duration.ofSeconds(5);
  }

  /**
   * Benchmarks {@code implementations} in order; the first one is the comparison baseline. Memory
   * deltas are also recorded in {@code metrics}.
   */
  public BenchmarkResults run(List<FanoutImplementation> implementations, MetricsCollector metrics) {
    var testData = WorkUnitGenerator.benchmarkUnits(units);
    log.info(
        "Benchmark configuration: units={}, iterations={}, warmupUnits={}, processors={}",
        testData.size(),
        iterations,
        warmupUnits,
        Runtime.getRuntime().availableProcessors());

    Map<String, Boolean> warmups = new LinkedHashMap<>();
    for (var implementation : implementations) {
      warmups.put(implementation.getName(), warmUp(implementation, testData));
    }

    Map<String, ImplementationBenchmark> results = new LinkedHashMap<>();
    for (var implementation : implementations) {
      var name = implementation.getName();
      log.info("Running benchmark for {}", name);
      List<BenchmarkRun> runs = new ArrayList<>(iterations);
      for (int i = 0; i < iterations; i++) {
        var run = runOnce(implementation, testData);
        runs.add(run);
        if (!run.isFailed()) {
          metrics.recordMemoryDelta(name, run.memoryDeltaBytes());
        }
        log.info(
            "  Run {}/{}: {}ms (Memory: {}MB, GC: {}, failed units: {})",
            i + 1,
            iterations,
            LoadUtils.round2(run.durationMs()),
            LoadUtils.round2(run.memoryDeltaBytes() / (1024.0 * 1024.0)),
            run.gcCount(),
            run.failedUnits());
      }
      var benchmark = ImplementationBenchmark.of(name, warmups.get(name), runs);
      logSummary(benchmark);
      results.put(name, benchmark);
    }

    BenchmarkComparison comparison = null;
    if (implementations.size() == 2) {
      var baseline = results.get(implementations.get(0).getName());
      var candidate = results.get(implementations.get(1).getName());
      comparison = BenchmarkComparison.compare(baseline, candidate).orElse(null);
      if (comparison != null) {
        log.info(
            "Performance comparison {} vs {}: speed improvement {}%, memory difference {}MB,"
                + " GC runs difference {}",
            comparison.candidate(),
            comparison.baseline(),
            comparison.speedImprovementPercent(),
            comparison.memoryDifferenceMb(),
            comparison.gcDifference());
      }
    }
    return new BenchmarkResults(Collections.unmodifiableMap(results), comparison);
  }

  /**
   * Processes the first warm-up units within the warm-up budget. A failure or overrun is reported
   * and otherwise ignored.
   */
  @VisibleForTesting
  boolean warmUp(FanoutImplementation implementation, List<WorkUnit> testData) {
    if (warmupUnits == 0) {
      return true;
    }
    var sample = testData.subList(0, Math.min(warmupUnits, testData.size()));
    ExecutorService warmupThread =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable);
              thread.setName("warmup-" + implementation.getName());
              thread.setDaemon(true);
              return thread;
            });
    try {
      warmupThread
          .submit(() -> implementation.processBatch(sample))
          .get(warmupTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info("Warming up {}... done", implementation.getName());
      return true;
    } catch (TimeoutException e) {
      log.warn(
          "Warming up {}... failed (exceeded {}ms)",
          implementation.getName(),
          warmupTimeout.toMillis());
      return false;
    } catch (ExecutionException e) {
      log.warn(
          "Warming up {}... failed ({})", implementation.getName(), e.getCause().getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Warming up {}... interrupted", implementation.getName());
      return false;
    } finally {
      warmupThread.shutdownNow();
    }
  }

  /**
   * Times one pass. A pass fails if the batch throws or degrades to an empty result for a
   * non-empty input.
   */
  @VisibleForTesting
  BenchmarkRun runOnce(FanoutImplementation implementation, List<WorkUnit> testData) {
    long gcBefore = gcCount();
    long memoryBefore = usedHeap();
    long start = System.nanoTime();
    List<ProcessedUnit> processed;
    try {
      processed = implementation.processBatch(testData);
    } catch (RuntimeException e) {
      log.error("Benchmark run of {} failed: {}", implementation.getName(), e.getMessage());
      return BenchmarkRun.failed();
    }
    double durationMs = LoadUtils.millisSince(start);
    long memoryAfter = usedHeap();
    long gcAfter = gcCount();

    if (processed.isEmpty() && !testData.isEmpty()) {
      log.error("Benchmark run of {} returned no results", implementation.getName());
      return BenchmarkRun.failed();
    }
    int successes = (int) processed.stream().filter(ProcessedUnit::isSuccess).count();
    return new BenchmarkRun(
        durationMs,
        memoryAfter - memoryBefore,
        gcAfter - gcBefore,
        successes,
        processed.size() - successes);
  }

  private static void logSummary(ImplementationBenchmark benchmark) {
    var summary = benchmark.summary();
    if (summary.successfulRuns() == 0) {
      log.info("{}: all runs failed", benchmark.implementation());
      return;
    }
    log.info(
        "{}: duration avg={}ms min={}ms max={}ms, memory avg={}MB, GC runs={}",
        benchmark.implementation(),
        summary.averageDurationMs(),
        summary.minDurationMs(),
        summary.maxDurationMs(),
        summary.averageMemoryMb(),
        summary.totalGcCount());
  }

  private static long usedHeap() {
    var runtime = Runtime.getRuntime();
    return runtime.totalMemory() - runtime.freeMemory();
  }

  private static long gcCount() {
    long total = 0;
    for (GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
      long count = gc.getCollectionCount();
      if (count > 0) {
        total += count;
      }
    }
    return total;
  }
}
