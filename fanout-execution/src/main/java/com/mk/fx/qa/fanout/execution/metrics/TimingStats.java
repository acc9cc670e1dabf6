package com.mk.fx.qa.fanout.execution.metrics;

/** Distribution of the durations recorded for one operation, in milliseconds. */
public record TimingStats(long count, double min, double max, double avg, double p95, double p99) {}
