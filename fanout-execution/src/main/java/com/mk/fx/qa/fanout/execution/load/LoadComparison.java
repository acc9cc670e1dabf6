package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.util.Optional;

/**
 * How {@code candidate} fared against {@code baseline} under one profile.
 *
 * @param throughputImprovementPercent throughput gain relative to the baseline
 * @param latencyImprovementPercent average latency reduction relative to the baseline
 * @param errorRateDifference candidate error rate minus baseline error rate, in points
 */
public record LoadComparison(
    String baseline,
    String candidate,
    double throughputImprovementPercent,
    double latencyImprovementPercent,
    double errorRateDifference) {

  /** Empty when the baseline has no throughput or no latency to compare against. */
  public static Optional<LoadComparison> compare(
      String baseline,
      LoadProfileResult baselineResult,
      String candidate,
      LoadProfileResult candidateResult) {
    if (baselineResult.throughput() == 0 || baselineResult.latency().avg() == 0) {
      return Optional.empty();
    }
    return Optional.of(
        new LoadComparison(
            baseline,
            candidate,
            LoadUtils.round2(
                (candidateResult.throughput() - baselineResult.throughput())
                    / baselineResult.throughput()
                    * 100),
            LoadUtils.round2(
                (baselineResult.latency().avg() - candidateResult.latency().avg())
                    / baselineResult.latency().avg()
                    * 100),
            LoadUtils.round2(candidateResult.errorRate() - baselineResult.errorRate())));
  }
}
