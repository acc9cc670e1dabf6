package com.mk.fx.qa.fanout.execution.metrics;

import java.util.Map;

/** Statistics derived from a {@link MetricsCollector} at the time of the call. */
public record MetricsStatistics(
    Map<String, TimingStats> timings,
    Map<String, MemoryStats> memory,
    Map<String, ErrorRate> errorRates,
    MetricsSummary summary) {}
