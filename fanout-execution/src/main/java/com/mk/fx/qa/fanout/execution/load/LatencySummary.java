package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.metrics.Percentiles;
import com.mk.fx.qa.fanout.execution.utils.LoadUtils;
import java.util.Collection;

/** Latency distribution in milliseconds, rounded to two decimals. All zero without samples. */
public record LatencySummary(
    double min, double max, double avg, double p50, double p90, double p95, double p99) {

  public static LatencySummary of(Collection<Double> durationsMs) {
    if (durationsMs.isEmpty()) {
      return new LatencySummary(0, 0, 0, 0, 0, 0, 0);
    }
    double[] sorted = durationsMs.stream().mapToDouble(Double::doubleValue).sorted().toArray();
    double sum = 0;
    for (double v : sorted) {
      sum += v;
    }
    return new LatencySummary(
        LoadUtils.round2(sorted[0]),
        LoadUtils.round2(sorted[sorted.length - 1]),
        LoadUtils.round2(sum / sorted.length),
        LoadUtils.round2(Percentiles.percentileOfSorted(sorted, 50)),
        LoadUtils.round2(Percentiles.percentileOfSorted(sorted, 90)),
        LoadUtils.round2(Percentiles.percentileOfSorted(sorted, 95)),
        LoadUtils.round2(Percentiles.percentileOfSorted(sorted, 99)));
  }
}
