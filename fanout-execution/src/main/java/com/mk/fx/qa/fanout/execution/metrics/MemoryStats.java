package com.mk.fx.qa.fanout.execution.metrics;

/** Memory samples recorded for one implementation, in bytes. */
public record MemoryStats(long count, long min, long max, double avg) {}
