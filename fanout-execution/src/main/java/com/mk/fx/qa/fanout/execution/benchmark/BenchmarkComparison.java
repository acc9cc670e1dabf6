package com.mk.fx.qa.fanout.execution.benchmark;

import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.util.Optional;

/**
 * How {@code candidate} fared against {@code baseline}.
 *
 * @param speedImprovementPercent reduction of the average duration relative to the baseline
 * @param memoryDifferenceMb baseline average memory minus candidate average memory
 * @param gcDifference baseline collections minus candidate collections
 */
public record BenchmarkComparison(
    String baseline,
    String candidate,
    double speedImprovementPercent,
    double memoryDifferenceMb,
    long gcDifference) {

  /** Empty when either side has no successful run to compare. */
  public static Optional<BenchmarkComparison> compare(
      ImplementationBenchmark baseline, ImplementationBenchmark candidate) {
    double baselineAvg = baseline.summary().averageDurationMs();
    double candidateAvg = candidate.summary().averageDurationMs();
    if (baselineAvg == 0 || candidateAvg == 0) {
      return Optional.empty();
    }
    return Optional.of(
        new BenchmarkComparison(
            baseline.implementation(),
            candidate.implementation(),
            LoadUtils.round2((baselineAvg - candidateAvg) / baselineAvg * 100),
            LoadUtils.round2(
                baseline.summary().averageMemoryMb() - candidate.summary().averageMemoryMb()),
            baseline.summary().totalGcCount() - candidate.summary().totalGcCount()));
  }
}
