package com.mk.fx.qa.fanout.execution.benchmark;

/**
 * One timed pass over the benchmark units.
 *
 * @param durationMs wall-clock time of the pass, or {@code -1} if it failed
 * @param memoryDeltaBytes used heap after the pass minus before
 * @param gcCount collections that ran during the pass
 * @param successfulUnits units that resolved to a success
 * @param failedUnits units that resolved to a failure
 */
public record BenchmarkRun(
    double durationMs, long memoryDeltaBytes, long gcCount, int successfulUnits, int failedUnits) {

  public static final double FAILED_DURATION = -1;

  public static BenchmarkRun failed() {
    return new BenchmarkRun(FAILED_DURATION, 0, 0, 0, 0);
  }

  public boolean isFailed() {
    return durationMs < 0;
  }
}
