package com.mk.fx.qa.fanout.execution.events;

import com.mk.fx.qa.fanout.execution.substrate.ExecutorStats;

/**
 * Aggregate timing of one completed batch.
 *
 * @param executorStats pool snapshot, {@code null} unless the substrate is a bounded worker pool
 */
public record PerformanceMetricsEvent(
    String implementation,
    int totalUnits,
    double totalDurationMs,
    double avgDurationMs,
    ExecutorStats executorStats)
    implements ProcessingEvent {

  @Override
  public String event() {
    return "performance_metrics";
  }
}
