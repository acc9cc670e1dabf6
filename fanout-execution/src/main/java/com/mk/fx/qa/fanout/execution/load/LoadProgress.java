package com.mk.fx.qa.fanout.execution.load;

/** Live figures of a load run, taken by the monitor loop. */
public record LoadProgress(
    double elapsedSeconds,
    long totalRequests,
    long totalErrors,
    double throughput,
    double errorRate,
    int activeUsers) {}
