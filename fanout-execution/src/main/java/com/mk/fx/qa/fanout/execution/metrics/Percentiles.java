package com.mk.fx.qa.fanout.execution.metrics;

import java.util.Arrays;
import java.util.Collection;

/** Percentiles by linear interpolation between order statistics. */
public final class Percentiles {

  private Percentiles() {
    // Utility class, no instantiation
  }

  /**
   * Returns the {@code p}-th percentile of {@code values}, or {@code 0} when there are none.
   *
   * @param values samples in any order
   * @param p percentile in [0, 100]
   */
  public static double percentile(Collection<? extends Number> values, double p) {
    double[] sorted = values.stream().mapToDouble(Number::doubleValue).toArray();
    Arrays.sort(sorted);
    return percentileOfSorted(sorted, p);
  }

  /**
   * Same as {@link #percentile(Collection, double)} for an already sorted array.
   *
   * <p>With {@code k = (p / 100) * (n - 1)} the result is {@code sorted[k]} when {@code k} is
   * integral, else the blend of the two neighbouring samples weighted by distance to {@code k}.
   */
  public static double percentileOfSorted(double[] sorted, double p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    if (sorted.length == 0) {
      return 0;
    }
    double k = (p / 100.0) * (sorted.length - 1);
    int floor = (int) Math.floor(k);
    int ceil = (int) Math.ceil(k);
    if (floor == ceil) {
      return sorted[floor];
    }
    return sorted[floor] * (ceil - k) + sorted[ceil] * (k - floor);
  }
}
