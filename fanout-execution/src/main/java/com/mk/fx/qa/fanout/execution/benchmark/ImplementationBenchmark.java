package com.mk.fx.qa.fanout.execution.benchmark;

import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.util.List;

/**
 * Runs of one implementation and their summary.
 *
 * @param warmupSucceeded whether the warm-up batch completed within its budget
 */
public record ImplementationBenchmark(
    String implementation, boolean warmupSucceeded, List<BenchmarkRun> runs, Summary summary) {

  public static ImplementationBenchmark of(
      String implementation, boolean warmupSucceeded, List<BenchmarkRun> runs) {
    return new ImplementationBenchmark(
        implementation, warmupSucceeded, List.copyOf(runs), Summary.of(runs));
  }

  /**
   * Averages over the runs. Failed runs are left out of the duration figures, which are 0 when
   * every run failed.
   */
  public record Summary(
      int successfulRuns,
      double averageDurationMs,
      double minDurationMs,
      double maxDurationMs,
      double averageMemoryMb,
      long totalGcCount) {

    static Summary of(List<BenchmarkRun> runs) {
      var durations =
          runs.stream()
              .filter(run -> !run.isFailed())
              .mapToDouble(BenchmarkRun::durationMs)
              .summaryStatistics();
      double averageMemory =
          runs.stream().mapToLong(BenchmarkRun::memoryDeltaBytes).average().orElse(0);
      long gc = runs.stream().mapToLong(BenchmarkRun::gcCount).sum();
      boolean any = durations.getCount() > 0;
      return new Summary(
          (int) durations.getCount(),
          any ? LoadUtils.round2(durations.getAverage()) : 0,
          any ? LoadUtils.round2(durations.getMin()) : 0,
          any ? LoadUtils.round2(durations.getMax()) : 0,
          LoadUtils.round2(averageMemory / (1024.0 * 1024.0)),
          gc);
    }
  }
}
