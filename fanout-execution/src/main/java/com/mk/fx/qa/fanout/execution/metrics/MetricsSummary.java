package com.mk.fx.qa.fanout.execution.metrics;

/**
 * Totals across every key.
 *
 * @param totalOperations timing samples recorded
 * @param totalErrors error samples recorded
 * @param totalDurationMs sum of all timing samples
 */
public record MetricsSummary(long totalOperations, long totalErrors, double totalDurationMs) {}
